package com.example.video_grid.model;

import java.util.List;

/**
 * Frames previously selected for a (source, modification time, frame count) triple.
 *
 * @param fingerprint cache key the entry was stored under.
 * @param frames      frames in chronological order.
 */
public record CacheEntry(String fingerprint, List<ExtractedFrame> frames) {
    public CacheEntry {
        frames = List.copyOf(frames);
    }
}
