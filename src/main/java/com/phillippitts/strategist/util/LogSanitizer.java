package com.phillippitts.strategist.util;

/** Utility for privacy-safe logging of query and answer previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW = 60;

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
     * Single-line preview: line breaks collapsed to spaces, truncated with an ellipsis.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replaceAll("\\s+", " ").strip();
        return oneLine.length() <= DEFAULT_PREVIEW ? oneLine : truncate(oneLine, DEFAULT_PREVIEW) + "…";
    }
}
