package com.jreinhal.caseflow.casework;

import java.util.Set;

/**
 * Case status values as stored by the case module. The set is open-ended; only the
 * values the pipeline reasons about are named here.
 */
public final class CaseStatus {
    public static final String OPEN = "open";
    public static final String CLOSED = "closed";
    public static final String COMPLETED = "completed";
    public static final String ARCHIVED = "archived";

    private static final Set<String> TERMINAL = Set.of(CLOSED, COMPLETED);
    private static final Set<String> INACTIVE = Set.of(CLOSED, COMPLETED, ARCHIVED);

    private CaseStatus() {
    }

    public static boolean isTerminal(String status) {
        return status != null && TERMINAL.contains(status);
    }

    public static Set<String> terminalStatuses() {
        return TERMINAL;
    }

    public static Set<String> inactiveStatuses() {
        return INACTIVE;
    }
}
