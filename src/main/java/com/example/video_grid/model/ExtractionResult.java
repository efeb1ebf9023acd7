package com.example.video_grid.model;

import java.util.List;

/**
 * Frames chosen for a grid and whether they were served from the frame cache.
 */
public record ExtractionResult(List<ExtractedFrame> frames, boolean fromCache) {
    public ExtractionResult {
        frames = List.copyOf(frames);
    }
}
