package com.phillippitts.agentcore.util;

/** Privacy-safe previews of user text for logs. */
public final class LogSanitizer {

    /** Default preview length for request and transcript text. */
    public static final int DEFAULT_PREVIEW = 60;

    private LogSanitizer() {
    }

    /**
     * Truncates to at most {@code max} characters; returns "" for null or non-positive max.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: newlines collapsed, truncated to {@link #DEFAULT_PREVIEW}, with an
     * ellipsis marker when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= DEFAULT_PREVIEW ? flat : truncate(flat, DEFAULT_PREVIEW) + "...";
    }
}
