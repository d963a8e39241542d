package com.jreinhal.caseflow.casework;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when a requested stage is not part of the case category's vocabulary. The
 * details carry the valid list so the caller can correct the request.
 */
public class InvalidStageException extends CaseworkException {
    private final String category;
    private final String requestedStage;
    private final List<String> validStages;

    public InvalidStageException(String category, String requestedStage, List<String> validStages) {
        super(Kind.INVALID_STAGE, "INVALID_STAGE", "Invalid stage for case category", "المرحلة غير صالحة لفئة القضية",
                remediation(category, requestedStage, validStages));
        this.category = category;
        this.requestedStage = requestedStage;
        this.validStages = List.copyOf(validStages);
    }

    public String getCategory() {
        return this.category;
    }

    public String getRequestedStage() {
        return this.requestedStage;
    }

    public List<String> getValidStages() {
        return this.validStages;
    }

    private static Map<String, Object> remediation(String category, String requestedStage, List<String> validStages) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", category);
        details.put("requestedStage", requestedStage);
        details.put("validStages", List.copyOf(validStages));
        return details;
    }
}
