package com.phillippitts.livefacts.util;

import com.phillippitts.livefacts.domain.Coordinates;

import java.util.Locale;

/** Utility for privacy-safe logging of generated text and user positions. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "…";
    }

    /**
     * Coordinates rounded to two decimals (about 1 km), enough to follow a session in logs
     * without recording a user's exact track.
     */
    public static String coarse(Coordinates c) {
        if (c == null) {
            return "?";
        }
        return String.format(Locale.ROOT, "%.2f,%.2f", c.latitude(), c.longitude());
    }
}
