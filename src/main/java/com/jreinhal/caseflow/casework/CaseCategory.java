package com.jreinhal.caseflow.casework;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CaseCategory {
    LABOR("labor"),
    COMMERCIAL("commercial"),
    CIVIL("civil"),
    FAMILY("family"),
    CRIMINAL("criminal"),
    ADMINISTRATIVE("administrative"),
    OTHER("other");

    private final String key;

    private CaseCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return this.key;
    }

    /**
     * Resolves a persisted or requested category key. Matching is case-insensitive and
     * anything unrecognised (including null and blank) resolves to {@link #OTHER}, so
     * stage lookups never fail on legacy category values.
     */
    @JsonCreator
    public static CaseCategory fromKey(String key) {
        if (key == null || key.isBlank()) {
            return OTHER;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (CaseCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }

    public static boolean isKnownKey(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (CaseCategory category : values()) {
            if (category.key.equals(normalized)) {
                return true;
            }
        }
        return false;
    }
}
