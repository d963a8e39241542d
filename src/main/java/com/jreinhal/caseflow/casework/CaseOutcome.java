package com.jreinhal.caseflow.casework;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

public enum CaseOutcome {
    ONGOING("ongoing"),
    WON("won"),
    LOST("lost"),
    SETTLED("settled");

    /** Outcomes accepted when a case is ended. */
    public static final List<CaseOutcome> FINAL_OUTCOMES = List.of(WON, LOST, SETTLED);

    private final String key;

    private CaseOutcome(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return this.key;
    }

    public boolean isFinal() {
        return this != ONGOING;
    }

    /**
     * @return the matching outcome, or null when the key is blank or unknown
     */
    public static CaseOutcome fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (CaseOutcome outcome : values()) {
            if (outcome.key.equals(normalized)) {
                return outcome;
            }
        }
        return null;
    }

    public static List<String> finalOutcomeKeys() {
        return FINAL_OUTCOMES.stream().map(CaseOutcome::getKey).toList();
    }
}
