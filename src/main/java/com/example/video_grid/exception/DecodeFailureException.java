package com.example.video_grid.exception;

public class DecodeFailureException extends GridPipelineException {
    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
