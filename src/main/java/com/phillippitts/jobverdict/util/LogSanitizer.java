package com.phillippitts.jobverdict.util;

/** Utility for privacy-safe logging of prompt and response previews. */
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
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: line breaks collapsed to spaces, then truncated with an ellipsis marker.
     */
    public static String preview(String s, int max) {
        String flat = s == null ? "" : s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : truncate(flat, max) + "...";
    }
}
