package com.phillippitts.bbdetector.util;

/** Utility for privacy-safe logging of inbound payloads and server text. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters, marking the cut with an ellipsis;
     * returns "" for null. Control characters are replaced so one payload stays on one log line.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\p{Cntrl}", " ");
        return flat.length() <= max ? flat : flat.substring(0, max) + "…";
    }

    /** Masks a secret for display: "" stays "", anything else becomes "***". */
    public static String mask(String secret) {
        return (secret == null || secret.isEmpty()) ? "" : "***";
    }
}
