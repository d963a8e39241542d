package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.casework.CaseRecord;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered stage list per case category. Instances are immutable; unknown categories
 * resolve to the {@code other} list so every lookup is total.
 */
public final class StageVocabulary {
    private final Map<CaseCategory, List<String>> stages;

    private StageVocabulary(Map<CaseCategory, List<String>> stages) {
        EnumMap<CaseCategory, List<String>> copy = new EnumMap<>(CaseCategory.class);
        for (CaseCategory category : CaseCategory.values()) {
            List<String> list = stages.get(category);
            if (list == null || list.isEmpty()) {
                throw new IllegalArgumentException("No stages defined for category " + category.getKey());
            }
            copy.put(category, List.copyOf(list));
        }
        this.stages = Collections.unmodifiableMap(copy);
    }

    public static StageVocabulary defaults() {
        return new StageVocabulary(defaultTable());
    }

    /**
     * Built-in table with per-category overrides applied. Override keys are category keys;
     * unknown keys and empty lists are ignored.
     */
    public static StageVocabulary withOverrides(Map<String, List<String>> overrides) {
        EnumMap<CaseCategory, List<String>> table = defaultTable();
        if (overrides != null) {
            overrides.forEach((key, list) -> {
                if (CaseCategory.isKnownKey(key) && list != null && !list.isEmpty()) {
                    table.put(CaseCategory.fromKey(key), list.stream().map(String::trim).filter(s -> !s.isEmpty()).toList());
                }
            });
        }
        return new StageVocabulary(table);
    }

    public List<String> stagesFor(CaseCategory category) {
        return this.stages.get(category != null ? category : CaseCategory.OTHER);
    }

    public List<String> stagesFor(String category) {
        return this.stagesFor(CaseCategory.fromKey(category));
    }

    public List<String> allCategories() {
        return Arrays.stream(CaseCategory.values()).map(CaseCategory::getKey).toList();
    }

    public String defaultStage(CaseCategory category) {
        return this.stagesFor(category).get(0);
    }

    /**
     * Stage a case sits in: {@code currentStage}, then the legacy {@code pipelineStage},
     * then the first stage of its category.
     */
    public String effectiveStage(CaseRecord record) {
        if (record.getCurrentStage() != null && !record.getCurrentStage().isBlank()) {
            return record.getCurrentStage();
        }
        if (record.getPipelineStage() != null && !record.getPipelineStage().isBlank()) {
            return record.getPipelineStage();
        }
        return this.defaultStage(record.resolvedCategory());
    }

    public boolean isValidStage(CaseCategory category, String stage) {
        return stage != null && this.stagesFor(category).contains(stage);
    }

    private static EnumMap<CaseCategory, List<String>> defaultTable() {
        EnumMap<CaseCategory, List<String>> table = new EnumMap<>(CaseCategory.class);
        table.put(CaseCategory.LABOR, List.of("filing", "friendly_settlement_1", "friendly_settlement_2", "labor_court", "appeal", "execution"));
        table.put(CaseCategory.COMMERCIAL, List.of("filing", "mediation", "commercial_court", "appeal", "supreme", "execution"));
        table.put(CaseCategory.CIVIL, List.of("filing", "reconciliation", "general_court", "appeal", "supreme", "execution"));
        table.put(CaseCategory.FAMILY, List.of("filing", "reconciliation_committee", "family_court", "appeal", "supreme", "execution"));
        table.put(CaseCategory.CRIMINAL, List.of("investigation", "prosecution", "criminal_court", "appeal", "supreme", "execution"));
        table.put(CaseCategory.ADMINISTRATIVE, List.of("grievance", "administrative_court", "admin_appeal", "supreme_admin", "execution"));
        table.put(CaseCategory.OTHER, List.of("filing", "first_hearing", "ongoing_hearings", "appeal", "final"));
        return table;
    }
}
