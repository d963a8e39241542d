package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.casework.CaseRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Aggregates a tenant's cases into pipeline statistics. Pure function of its input;
 * nothing is cached between requests.
 */
@Component
public class PipelineStatisticsCalculator {
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private final StageVocabulary vocabulary;

    public PipelineStatisticsCalculator(StageVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public PipelineStatistics calculate(List<CaseRecord> cases, Instant now) {
        long active = 0;
        long won = 0;
        long lost = 0;
        long settled = 0;
        Map<String, Long> byCategory = new LinkedHashMap<>();
        Map<String, Map<String, Long>> byStage = new LinkedHashMap<>();
        Map<String, Map<String, double[]>> daysAccumulator = new LinkedHashMap<>();
        BigDecimal totalClaim = BigDecimal.ZERO;
        BigDecimal totalWon = BigDecimal.ZERO;

        for (CaseRecord record : cases) {
            CaseOutcome outcome = record.getOutcome();
            if (outcome == null || outcome == CaseOutcome.ONGOING) {
                active++;
            } else if (outcome == CaseOutcome.WON) {
                won++;
            } else if (outcome == CaseOutcome.LOST) {
                lost++;
            } else if (outcome == CaseOutcome.SETTLED) {
                settled++;
            }

            String category = record.resolvedCategory().getKey();
            String stage = vocabulary.effectiveStage(record);
            byCategory.merge(category, 1L, Long::sum);
            byStage.computeIfAbsent(category, k -> new LinkedHashMap<>()).merge(stage, 1L, Long::sum);

            if (record.getStageEnteredAt() != null) {
                double days = (now.toEpochMilli() - record.getStageEnteredAt().toEpochMilli()) / MILLIS_PER_DAY;
                double[] sumAndCount = daysAccumulator.computeIfAbsent(category, k -> new LinkedHashMap<>())
                        .computeIfAbsent(stage, k -> new double[2]);
                sumAndCount[0] += days;
                sumAndCount[1] += 1;
            }

            if (record.getClaimAmount() != null) {
                totalClaim = totalClaim.add(record.getClaimAmount());
            }
            if (outcome == CaseOutcome.WON) {
                BigDecimal finalAmount = record.getEndDetails() != null ? record.getEndDetails().finalAmount() : null;
                BigDecimal wonAmount = finalAmount != null ? finalAmount : record.getClaimAmount();
                if (wonAmount != null) {
                    totalWon = totalWon.add(wonAmount);
                }
            }
        }

        Map<String, Map<String, Long>> avgDays = new LinkedHashMap<>();
        daysAccumulator.forEach((category, stages) -> {
            Map<String, Long> averages = new LinkedHashMap<>();
            stages.forEach((stage, sumAndCount) -> averages.put(stage, Math.round(sumAndCount[0] / sumAndCount[1])));
            avgDays.put(category, averages);
        });

        return new PipelineStatistics(cases.size(), active, won, lost, settled, byCategory, byStage, avgDays,
                totalClaim, totalWon, successRate(won, lost, settled));
    }

    /**
     * (won + settled) / (won + lost + settled), two decimals; exactly 0 when nothing has
     * been completed.
     */
    static double successRate(long won, long lost, long settled) {
        long completed = won + lost + settled;
        if (completed == 0) {
            return 0.0;
        }
        double rate = (double) (won + settled) / completed;
        return Math.round(rate * 100) / 100.0;
    }
}
