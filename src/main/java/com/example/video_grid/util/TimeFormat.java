package com.example.video_grid.util;

import java.util.Locale;

public final class TimeFormat {
    private TimeFormat() {
    }

    /** {@code H:MM:SS} from one hour on, {@code M:SS} below. */
    public static String timestamp(double seconds) {
        int total = (int) Math.max(0, seconds);
        int hours = total / 3600;
        int minutes = (total % 3600) / 60;
        int secs = total % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }

    /** Human readable length for the title strip: {@code 1h 5m}, {@code 3m 7s} or {@code 42s}. */
    public static String duration(double seconds) {
        int total = (int) Math.max(0, seconds);
        int hours = total / 3600;
        int minutes = (total % 3600) / 60;
        int secs = total % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %dm", hours, minutes);
        }
        if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %ds", minutes, secs);
        }
        return String.format(Locale.ROOT, "%ds", secs);
    }
}
