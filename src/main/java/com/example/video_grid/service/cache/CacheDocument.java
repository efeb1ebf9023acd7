package com.example.video_grid.service.cache;

import java.util.List;

/**
 * On-disk layout of one cache file. Images are PNG bytes, serialised by Jackson as base64.
 */
record CacheDocument(int version, String sourcePath, int frameCount, List<Frame> frames) {
    static final int CURRENT_VERSION = 1;

    record Frame(double timestampSeconds, byte[] image) { }
}
