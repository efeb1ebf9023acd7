package com.example.video_grid.model;

import com.example.video_grid.util.JobStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Mutable job record. Only the scheduler's job table touches instances; everyone else sees
 * {@link JobSnapshot}s.
 */
public class VideoJob {
    private final UUID id;
    private final Path sourcePath;
    private final GridConfig config;
    private final Path outputFolder;
    private final Instant createdAt;

    private JobStatus status = JobStatus.QUEUED;
    private String statusText = JobStatus.QUEUED.label();
    private double progress;
    private Path outputPath;
    private boolean cancelRequested;
    private boolean claimed;
    private String errorMessage;

    public VideoJob(UUID id, Path sourcePath, GridConfig config, Path outputFolder, Instant createdAt) {
        this.id = id;
        this.sourcePath = sourcePath;
        this.config = config;
        this.outputFolder = outputFolder;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public GridConfig getConfig() {
        return config;
    }

    public Path getOutputFolder() {
        return outputFolder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getStatusText() {
        return statusText;
    }

    public void setStatusText(String statusText) {
        this.statusText = statusText;
    }

    public double getProgress() {
        return progress;
    }

    public void setProgress(double progress) {
        this.progress = progress;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(Path outputPath) {
        this.outputPath = outputPath;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public boolean isClaimed() {
        return claimed;
    }

    public void setClaimed(boolean claimed) {
        this.claimed = claimed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public boolean isComplete() {
        return status.isTerminal();
    }

    public boolean isCancelled() {
        return status == JobStatus.CANCELLED;
    }

    public JobSnapshot snapshot() {
        return new JobSnapshot(id, sourcePath, status, statusText, progress, outputPath,
                isComplete(), isCancelled(), errorMessage);
    }
}
