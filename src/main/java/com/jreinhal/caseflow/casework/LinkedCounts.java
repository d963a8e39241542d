package com.jreinhal.caseflow.casework;

/**
 * Number of records in neighbouring modules that point at a case.
 */
public record LinkedCounts(long tasks, long notionPages, long reminders, long events) {
    public static final LinkedCounts NONE = new LinkedCounts(0, 0, 0, 0);
}
