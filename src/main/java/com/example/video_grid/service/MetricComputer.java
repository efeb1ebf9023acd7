package com.example.video_grid.service;

import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.model.FrameMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Summarises a frame on a 16×16 box-averaged grid. The reduction is deliberately lossy; the
 * statistics only need to tell frames apart.
 */
@Component
public class MetricComputer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricComputer.class);

    public static final int GRID_SIZE = 16;
    private static final double EDGE_THRESHOLD = 0.1;

    public Optional<FrameMetrics> compute(int index, ExtractedFrame frame) {
        return compute(index, frame, false, false);
    }

    /**
     * @return metrics, or empty when the frame cannot be rasterised.
     */
    public Optional<FrameMetrics> compute(int index, ExtractedFrame frame, boolean withEdges, boolean withHistogram) {
        if (frame == null) {
            return Optional.empty();
        }
        double[][] rgb;
        try {
            rgb = downsample(frame.image());
        } catch (RuntimeException e) {
            LOGGER.debug("metrics skip index={} reason={}", index, e.toString());
            return Optional.empty();
        }
        if (rgb == null) {
            return Optional.empty();
        }

        int n = rgb.length;
        double[] luma = new double[n];
        double sumLuma = 0;
        double[] sum = new double[3];
        for (int i = 0; i < n; i++) {
            luma[i] = 0.299 * rgb[i][0] + 0.587 * rgb[i][1] + 0.114 * rgb[i][2];
            sumLuma += luma[i];
            for (int c = 0; c < 3; c++) {
                sum[c] += rgb[i][c];
            }
        }
        double brightness = sumLuma / n;

        double varianceSum = 0;
        for (int c = 0; c < 3; c++) {
            double mean = sum[c] / n;
            double sq = 0;
            for (double[] px : rgb) {
                double d = px[c] - mean;
                sq += d * d;
            }
            varianceSum += sq / n;
        }
        double colorVariance = varianceSum / 3.0;

        Double edgeDensity = withEdges ? edgeDensity(luma) : null;
        double[] histogram = withHistogram ? histogram(luma) : null;
        return Optional.of(new FrameMetrics(index, brightness, colorVariance, edgeDensity, histogram));
    }

    /**
     * Box-averages the image into {@link #GRID_SIZE}² cells of normalised RGB values.
     */
    private static double[][] downsample(BufferedImage image) {
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            return null;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);

        double[][] cells = new double[GRID_SIZE * GRID_SIZE][3];
        for (int gy = 0; gy < GRID_SIZE; gy++) {
            int y0 = gy * h / GRID_SIZE;
            int y1 = Math.max(y0 + 1, (gy + 1) * h / GRID_SIZE);
            for (int gx = 0; gx < GRID_SIZE; gx++) {
                int x0 = gx * w / GRID_SIZE;
                int x1 = Math.max(x0 + 1, (gx + 1) * w / GRID_SIZE);
                double r = 0, g = 0, b = 0;
                int count = 0;
                for (int y = y0; y < y1 && y < h; y++) {
                    int row = y * w;
                    for (int x = x0; x < x1 && x < w; x++) {
                        int p = argb[row + x];
                        r += (p >> 16) & 0xFF;
                        g += (p >> 8) & 0xFF;
                        b += p & 0xFF;
                        count++;
                    }
                }
                double[] cell = cells[gy * GRID_SIZE + gx];
                cell[0] = r / (count * 255.0);
                cell[1] = g / (count * 255.0);
                cell[2] = b / (count * 255.0);
            }
        }
        return cells;
    }

    private static double edgeDensity(double[] luma) {
        int edges = 0;
        int samples = 0;
        for (int y = 0; y < GRID_SIZE - 1; y++) {
            for (int x = 0; x < GRID_SIZE - 1; x++) {
                double here = luma[y * GRID_SIZE + x];
                double gradient = Math.abs(luma[y * GRID_SIZE + x + 1] - here)
                        + Math.abs(luma[(y + 1) * GRID_SIZE + x] - here);
                if (gradient > EDGE_THRESHOLD) {
                    edges++;
                }
                samples++;
            }
        }
        return (double) edges / samples;
    }

    private static double[] histogram(double[] luma) {
        double[] bins = new double[FrameMetrics.HISTOGRAM_BINS];
        for (double l : luma) {
            int bin = (int) Math.min(FrameMetrics.HISTOGRAM_BINS - 1, Math.max(0, l * FrameMetrics.HISTOGRAM_BINS));
            bins[bin]++;
        }
        for (int i = 0; i < bins.length; i++) {
            bins[i] /= luma.length;
        }
        return bins;
    }
}
