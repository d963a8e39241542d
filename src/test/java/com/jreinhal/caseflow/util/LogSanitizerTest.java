package com.jreinhal.caseflow.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void textSummaryNeverContainsTheText() {
        String summary = LogSanitizer.textSummary("Client admitted liability");

        assertTrue(summary.startsWith("[len=25,id="));
        assertFalse(summary.contains("liability"));
        assertEquals("[len=0,id=none]", LogSanitizer.textSummary(null));
    }

    @Test
    void sanitizeStripsLineBreaksAndCapsLength() {
        assertEquals("a b", LogSanitizer.sanitize("a\r\nb"));
        assertEquals("", LogSanitizer.sanitize(null));
        String capped = LogSanitizer.sanitize("x".repeat(300));
        assertEquals(131, capped.length());
        assertTrue(capped.endsWith("..."));
    }
}
