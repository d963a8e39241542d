package com.jreinhal.caseflow.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 128;

    private LogSanitizer() {
    }

    /**
     * Note and end-case text is client data; logs only carry its length and a hash.
     */
    public static String textSummary(String text) {
        if (text == null) {
            return "[len=0,id=none]";
        }
        int len = text.length();
        String id = Integer.toHexString(text.hashCode());
        return "[len=" + len + ",id=" + id + "]";
    }

    /**
     * Strip control characters from caller-supplied values before they enter log output
     * and cap their length.
     */
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
