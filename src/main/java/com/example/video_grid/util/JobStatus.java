package com.example.video_grid.util;

/**
 * Lifecycle of a single video job. COMPLETE, CANCELLED and FAILED are terminal.
 */
public enum JobStatus {
    QUEUED("Queued"),
    LOADING("Loading..."),
    EXTRACTING("Extracting frames..."),
    SELECTING("Selecting frames..."),
    COMPOSING("Compositing..."),
    COMPLETE("Complete"),
    CANCELLED("Cancelled"),
    FAILED("Error");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED || this == FAILED;
    }
}
