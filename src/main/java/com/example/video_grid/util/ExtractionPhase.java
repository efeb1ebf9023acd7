package com.example.video_grid.util;

/**
 * Sub-phases reported while frames are produced for a job.
 */
public enum ExtractionPhase {
    EXTRACTING,
    SELECTING
}
