package com.example.video_grid.model;

import org.springframework.lang.Nullable;

/**
 * Cheap summary statistics of one candidate frame, used only while selecting.
 *
 * @param index         position of the frame in the candidate list.
 * @param brightness    mean relative luminance in {@code [0,1]}.
 * @param colorVariance mean per-channel population variance in {@code [0,1]}.
 * @param edgeDensity   share of edge pixels, {@code null} when not computed.
 * @param histogram     normalised 16-bin luminance histogram, {@code null} when not computed.
 */
public record FrameMetrics(int index,
                           double brightness,
                           double colorVariance,
                           @Nullable Double edgeDensity,
                           @Nullable double[] histogram) {

    public static final int HISTOGRAM_BINS = 16;

    public FrameMetrics(int index, double brightness, double colorVariance) {
        this(index, brightness, colorVariance, null, null);
    }
}
