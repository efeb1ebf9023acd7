package com.example.video_grid.exception;

public class CompositionException extends GridPipelineException {
    public CompositionException(String message) {
        super(message);
    }

    public CompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
