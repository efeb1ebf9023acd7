package com.example.video_grid.exception;

import java.util.UUID;

/**
 * Unwinds a job that observed its cancellation signal. Not a failure.
 */
public class JobCancelledException extends GridPipelineException {
    private final UUID jobId;

    public JobCancelledException(UUID jobId) {
        super("Job cancelled: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
