package com.example.video_grid.util;

import java.awt.Color;

public enum BackgroundTheme {
    BLACK(Color.BLACK, Color.WHITE),
    WHITE(Color.WHITE, Color.BLACK);

    private final Color background;
    private final Color foreground;

    BackgroundTheme(Color background, Color foreground) {
        this.background = background;
        this.foreground = foreground;
    }

    public Color background() {
        return background;
    }

    /** Text and border colour: always the inverse of the background. */
    public Color foreground() {
        return foreground;
    }
}
