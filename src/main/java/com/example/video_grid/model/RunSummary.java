package com.example.video_grid.model;

import org.springframework.lang.Nullable;

import java.nio.file.Path;

/**
 * Aggregate outcome of one scheduler run. A run never fails as a whole.
 */
public record RunSummary(int completed, int cancelled, int failed, @Nullable Path lastOutputPath) {

    public int total() {
        return completed + cancelled + failed;
    }
}
