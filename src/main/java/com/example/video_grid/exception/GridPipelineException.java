package com.example.video_grid.exception;

/**
 * Base type for failures raised by the frame selection and composition pipeline.
 */
public class GridPipelineException extends RuntimeException {
    public GridPipelineException(String message) {
        super(message);
    }

    public GridPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
