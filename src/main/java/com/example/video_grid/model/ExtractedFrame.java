package com.example.video_grid.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A decoded raster and the position in the video it was taken from.
 *
 * @param image            decoded frame, never mutated after creation.
 * @param timestampSeconds offset from the start of the video in seconds.
 */
public record ExtractedFrame(BufferedImage image, double timestampSeconds) {
    public ExtractedFrame {
        Objects.requireNonNull(image, "image");
    }
}
