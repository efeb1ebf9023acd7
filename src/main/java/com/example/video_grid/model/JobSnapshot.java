package com.example.video_grid.model;

import com.example.video_grid.util.JobStatus;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Read-only view of a {@link VideoJob} at one point in time.
 */
public record JobSnapshot(UUID id,
                          Path sourcePath,
                          JobStatus status,
                          String statusText,
                          double progress,
                          @Nullable Path outputPath,
                          boolean isComplete,
                          boolean isCancelled,
                          @Nullable String errorMessage) {
}
