package com.example.video_grid.exception;

/**
 * A cache entry exists but cannot be turned back into frames. Never leaves the cache.
 */
public class CacheCorruptException extends GridPipelineException {
    public CacheCorruptException(String message) {
        super(message);
    }

    public CacheCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
