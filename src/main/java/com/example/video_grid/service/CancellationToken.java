package com.example.video_grid.service;

import com.example.video_grid.exception.JobCancelledException;

import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation checkpoint handed to every phase of a job. Hot loops call
 * {@link #yieldPoint()} at a fixed cadence; phase boundaries call {@link #checkpoint()}.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken(null, () -> false);

    private final UUID jobId;
    private final BooleanSupplier cancelled;

    public CancellationToken(UUID jobId, BooleanSupplier cancelled) {
        this.jobId = jobId;
        this.cancelled = cancelled;
    }

    /** Token that only reacts to thread interruption. */
    public static CancellationToken none() {
        return NONE;
    }

    public UUID jobId() {
        return jobId;
    }

    public boolean isCancelled() {
        return Thread.currentThread().isInterrupted() || cancelled.getAsBoolean();
    }

    /**
     * @throws JobCancelledException when cancellation was requested or the thread was interrupted.
     */
    public void checkpoint() {
        if (isCancelled()) {
            throw new JobCancelledException(jobId);
        }
    }

    /** Checkpoint that also lets other runnable work proceed before the loop resumes. */
    public void yieldPoint() {
        checkpoint();
        Thread.yield();
    }

    /** Restores the interrupt flag and converts the interruption into cancellation. */
    public JobCancelledException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        JobCancelledException ex = new JobCancelledException(jobId);
        ex.initCause(e);
        return ex;
    }
}
