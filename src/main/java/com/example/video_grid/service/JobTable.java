package com.example.video_grid.service;

import com.example.video_grid.exception.JobCancelledException;
import com.example.video_grid.model.JobSnapshot;
import com.example.video_grid.model.VideoJob;
import com.example.video_grid.util.JobStatus;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns every {@link VideoJob} in display order. All reads and writes hold the table's monitor, so a
 * cancellation request and a phase transition can never interleave.
 */
class JobTable {
    private final Map<UUID, VideoJob> jobs = new LinkedHashMap<>();

    synchronized JobSnapshot add(VideoJob job) {
        jobs.put(job.getId(), job);
        return job.snapshot();
    }

    /**
     * Marks every queued job as claimed by a run and returns them.
     */
    synchronized List<VideoJob> claimQueued() {
        List<VideoJob> claimed = new ArrayList<>();
        for (VideoJob job : jobs.values()) {
            if (job.getStatus() == JobStatus.QUEUED && !job.isClaimed() && !job.isCancelRequested()) {
                job.setClaimed(true);
                claimed.add(job);
            }
        }
        return claimed;
    }

    /**
     * Moves a running job into {@code status}. Progress never goes backwards.
     *
     * @throws JobCancelledException when the job was cancelled or removed.
     */
    synchronized JobSnapshot transition(UUID id, JobStatus status, double progress) {
        VideoJob job = jobs.get(id);
        if (job == null || job.isCancelRequested() || job.isComplete()) {
            throw new JobCancelledException(id);
        }
        job.setStatus(status);
        job.setStatusText(status.label());
        job.setProgress(Math.max(job.getProgress(), clamp(progress)));
        return job.snapshot();
    }

    synchronized Optional<JobSnapshot> markComplete(UUID id, Path outputPath) {
        VideoJob job = jobs.get(id);
        if (job == null || job.isComplete()) {
            return Optional.empty();
        }
        job.setOutputPath(outputPath);
        job.setProgress(1.0);
        return Optional.of(finish(job, JobStatus.COMPLETE, JobStatus.COMPLETE.label()));
    }

    synchronized Optional<JobSnapshot> markCancelled(UUID id) {
        VideoJob job = jobs.get(id);
        if (job == null || job.isComplete()) {
            return Optional.empty();
        }
        job.setCancelRequested(true);
        return Optional.of(finish(job, JobStatus.CANCELLED, JobStatus.CANCELLED.label()));
    }

    synchronized Optional<JobSnapshot> markFailed(UUID id, String message) {
        VideoJob job = jobs.get(id);
        if (job == null || job.isComplete()) {
            return Optional.empty();
        }
        job.setErrorMessage(message);
        return Optional.of(finish(job, JobStatus.FAILED, JobStatus.FAILED.label() + ": " + message));
    }

    /**
     * Flags the job. A job no run has claimed yet is cancelled on the spot and returned; a claimed
     * one is left for its worker to observe.
     */
    synchronized Optional<JobSnapshot> requestCancel(UUID id) {
        VideoJob job = jobs.get(id);
        if (job == null || job.isComplete()) {
            return Optional.empty();
        }
        job.setCancelRequested(true);
        if (!job.isClaimed()) {
            return Optional.of(finish(job, JobStatus.CANCELLED, JobStatus.CANCELLED.label()));
        }
        return Optional.empty();
    }

    synchronized List<JobSnapshot> requestCancelAll() {
        List<JobSnapshot> cancelled = new ArrayList<>();
        for (VideoJob job : jobs.values()) {
            requestCancel(job.getId()).ifPresent(cancelled::add);
        }
        return cancelled;
    }

    synchronized boolean exists(UUID id) {
        return jobs.containsKey(id);
    }

    synchronized boolean isCancelRequested(UUID id) {
        VideoJob job = jobs.get(id);
        return job == null || job.isCancelRequested();
    }

    synchronized Optional<JobSnapshot> snapshot(UUID id) {
        VideoJob job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.snapshot());
    }

    synchronized List<JobSnapshot> snapshots() {
        return jobs.values().stream().map(VideoJob::snapshot).toList();
    }

    synchronized int removeTerminal() {
        int removed = 0;
        Iterator<VideoJob> it = jobs.values().iterator();
        while (it.hasNext()) {
            if (it.next().isComplete()) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    synchronized int clear() {
        int size = jobs.size();
        jobs.clear();
        return size;
    }

    private static JobSnapshot finish(VideoJob job, JobStatus status, String text) {
        job.setStatus(status);
        job.setStatusText(text);
        return job.snapshot();
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
