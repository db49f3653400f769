package com.jreinhal.docqa.util;

import java.util.regex.Pattern;

/**
 * Keeps user-controlled text (questions, file names, labels) from forging log lines.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    static final int MAX_VALUE_LENGTH = 200;

    private LogSanitizer() {
    }

    /**
     * Questions are never logged verbatim; only their length and a hash for correlation.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_VALUE_LENGTH ? cleaned.substring(0, MAX_VALUE_LENGTH) + "..." : cleaned;
    }
}
