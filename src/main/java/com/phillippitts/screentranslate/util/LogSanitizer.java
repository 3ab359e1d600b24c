package com.phillippitts.screentranslate.util;

/** Utility for privacy-safe logging of text previews and secrets. */
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
     * Short single-line preview of user text: newlines flattened, truncated, total length appended.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\n', ' ').replace('\r', ' ');
        String head = truncate(flat, max);
        return head.length() < flat.length() ? head + "...(" + s.length() + " chars)" : head;
    }

    /**
     * Masks a secret, keeping at most the last four characters of long values.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
