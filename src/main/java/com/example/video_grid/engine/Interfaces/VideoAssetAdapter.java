package com.example.video_grid.engine.Interfaces;

import com.example.video_grid.model.DisplaySize;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decoding backend for a local video file.
 */
public interface VideoAssetAdapter {

    /**
     * @return container duration in seconds.
     */
    double getDuration(Path source) throws IOException, InterruptedException;

    /**
     * Decodes the frame closest to {@code timestampSeconds}, rotated for display and scaled to fit
     * within {@code maxSize}×{@code maxSize} without upscaling.
     *
     * @throws com.example.video_grid.exception.DecodeFailureException when no frame can be produced.
     */
    BufferedImage decodeFrame(Path source, double timestampSeconds, int maxSize) throws IOException, InterruptedException;

    /**
     * Display size of the first video track with its rotation applied, or empty when unknown.
     */
    Optional<DisplaySize> getNativeDisplaySize(Path source);
}
