package com.example.video_grid.selector;

/**
 * Thresholds and weights for {@link FrameSelector}.
 *
 * @param fastPathMaxCount   requests up to this size skip scoring and use even spacing.
 * @param minBrightness      frames at or below this brightness count as fades.
 * @param maxBrightness      frames at or above this brightness count as fades.
 * @param minColorVariance   frames at or below this variance count as flat/blank.
 * @param brightnessWeight   weight of the brightness difference.
 * @param varianceWeight     weight of the colour variance difference.
 * @param edgeWeight         weight of the edge density difference; {@code 0} disables edge metrics.
 * @param histogramWeight    weight of the histogram distance; {@code 0} disables histograms.
 * @param maxComparisons     comparison partners per candidate.
 * @param yieldEvery         scoring iterations between cooperative yields.
 */
public record SelectorConfig(int fastPathMaxCount,
                             double minBrightness,
                             double maxBrightness,
                             double minColorVariance,
                             double brightnessWeight,
                             double varianceWeight,
                             double edgeWeight,
                             double histogramWeight,
                             int maxComparisons,
                             int yieldEvery) {

    public static SelectorConfig defaults() {
        return new SelectorConfig(12, 0.15, 0.85, 0.008, 0.6, 0.4, 0.0, 0.0, 5, 10);
    }

    public boolean usesEdgeDensity() {
        return edgeWeight > 0.0;
    }

    public boolean usesHistogram() {
        return histogramWeight > 0.0;
    }
}
