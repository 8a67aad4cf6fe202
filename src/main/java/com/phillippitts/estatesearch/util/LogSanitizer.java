package com.phillippitts.estatesearch.util;

/** Utility for privacy-safe logging of user and worker text. */
public final class LogSanitizer {

    private static final int PREVIEW_LENGTH = 80;

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
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: line breaks become spaces and text over 80 characters is cut with
     * an ellipsis. Keeps user text from forging log lines.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= PREVIEW_LENGTH ? flat : truncate(flat, PREVIEW_LENGTH) + "...";
    }
}
