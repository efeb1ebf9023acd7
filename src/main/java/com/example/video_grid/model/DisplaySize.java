package com.example.video_grid.model;

/**
 * Display dimensions of a video track after rotation and pixel aspect correction.
 */
public record DisplaySize(int width, int height) {

    public double aspectRatio() {
        return height > 0 ? (double) width / height : 0.0;
    }
}
