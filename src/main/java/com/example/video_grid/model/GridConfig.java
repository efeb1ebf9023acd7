package com.example.video_grid.model;

import com.example.video_grid.util.AspectMode;
import com.example.video_grid.util.BackgroundTheme;

import java.util.Objects;

/**
 * Layout options for one composed grid.
 *
 * @param rows            number of frame rows.
 * @param columns         number of frame columns.
 * @param targetWidthPx   width of the output image.
 * @param aspectMode      cell aspect and image placement.
 * @param backgroundTheme background colour scheme.
 * @param showTimestamps  whether each cell gets its timestamp overlay.
 */
public record GridConfig(int rows,
                         int columns,
                         int targetWidthPx,
                         AspectMode aspectMode,
                         BackgroundTheme backgroundTheme,
                         boolean showTimestamps) {

    public GridConfig {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Grid needs at least one row and column: " + rows + "x" + columns);
        }
        if (targetWidthPx <= 0) {
            throw new IllegalArgumentException("targetWidthPx must be positive: " + targetWidthPx);
        }
        Objects.requireNonNull(aspectMode, "aspectMode");
        Objects.requireNonNull(backgroundTheme, "backgroundTheme");
    }

    public static GridConfig defaults() {
        return new GridConfig(4, 4, 1920, AspectMode.FILL, BackgroundTheme.BLACK, true);
    }

    public int frameCount() {
        return rows * columns;
    }
}
