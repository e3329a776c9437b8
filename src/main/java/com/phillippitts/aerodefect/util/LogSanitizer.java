package com.phillippitts.aerodefect.util;

/** Utility for log-safe previews of remote model text and other untrusted strings. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Collapses whitespace (including newlines, so one record stays on one log line) and
     * truncates to at most {@code max} characters, appending "..." when cut. Returns "" for null.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").strip();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
