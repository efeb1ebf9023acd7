package com.example.video_grid.exception;

/**
 * Raised when nothing is left of a video once the intro and outro margins are skipped.
 */
public class VideoTooShortException extends GridPipelineException {
    private final double durationSeconds;

    public VideoTooShortException(double durationSeconds) {
        super("Video too short (" + durationSeconds + "s)");
        this.durationSeconds = durationSeconds;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }
}
