package com.example.video_grid.util;

/**
 * How a frame is placed into its grid cell.
 */
public enum AspectMode {
    /** 16:9 cells, image cropped to cover the cell. */
    FILL,
    /** 16:9 cells, image letterboxed inside the cell. */
    FIT,
    /** Cells follow the video's display aspect ratio, image letterboxed. */
    SOURCE
}
