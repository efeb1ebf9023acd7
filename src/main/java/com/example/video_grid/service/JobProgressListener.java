package com.example.video_grid.service;

import com.example.video_grid.model.JobSnapshot;

import java.util.UUID;

/**
 * Receives job progress. Called from worker threads; implementations must not block.
 */
public interface JobProgressListener {

    void onProgress(UUID jobId, double fraction, String phaseLabel);

    default void onFinished(JobSnapshot job) {
    }
}
