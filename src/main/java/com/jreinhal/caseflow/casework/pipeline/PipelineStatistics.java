package com.jreinhal.caseflow.casework.pipeline;

import java.math.BigDecimal;
import java.util.Map;

public record PipelineStatistics(
    long totalCases,
    long activeCases,
    long wonCases,
    long lostCases,
    long settledCases,
    Map<String, Long> byCategory,
    Map<String, Map<String, Long>> byStage,
    Map<String, Map<String, Long>> avgDaysInStage,
    BigDecimal totalClaimAmount,
    BigDecimal totalWonAmount,
    double successRate
) {
}
