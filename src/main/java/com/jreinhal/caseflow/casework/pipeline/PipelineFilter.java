package com.jreinhal.caseflow.casework.pipeline;

import java.util.Locale;

/**
 * Optional equality filters. Blank values and {@code all} mean no filter.
 */
public record PipelineFilter(String category, String outcome, String priority) {
    public PipelineFilter {
        category = normalize(category);
        outcome = normalize(outcome);
        priority = normalize(priority);
    }

    public static PipelineFilter none() {
        return new PipelineFilter(null, null, null);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank() || "all".equalsIgnoreCase(value.trim())) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
