package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseAccessPolicy;
import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.casework.CaseRecord;
import com.jreinhal.caseflow.casework.CaseStatus;
import com.jreinhal.caseflow.casework.CaseStore;
import com.jreinhal.caseflow.casework.CaseworkException;
import com.jreinhal.caseflow.casework.EndDetails;
import com.jreinhal.caseflow.casework.InvalidStageException;
import com.jreinhal.caseflow.casework.StageHistoryEntry;
import com.jreinhal.caseflow.casework.event.CaseEndedEvent;
import com.jreinhal.caseflow.casework.event.CaseEventDispatcher;
import com.jreinhal.caseflow.casework.event.CaseStageChangedEvent;
import com.jreinhal.caseflow.model.User;
import com.jreinhal.caseflow.util.LogSanitizer;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stage transitions and case closure. Both commands run every check before mutating the
 * loaded case, persist with a revision check, then publish their event.
 */
@Service
public class CaseStageEngine {
    private static final Logger log = LoggerFactory.getLogger(CaseStageEngine.class);
    static final int MAX_MOVE_NOTE_LENGTH = 1000;
    static final int MAX_END_NOTE_LENGTH = 2000;
    static final Set<String> END_REASONS = Set.of("final_judgment", "settlement", "withdrawal", "dismissal", "reconciliation", "execution_complete", "other");

    private final CaseAccessPolicy accessPolicy;
    private final CaseStore caseStore;
    private final StageVocabulary vocabulary;
    private final CaseEventDispatcher eventDispatcher;
    private final Clock clock;

    public CaseStageEngine(CaseAccessPolicy accessPolicy, CaseStore caseStore, StageVocabulary vocabulary, CaseEventDispatcher eventDispatcher, Clock clock) {
        this.accessPolicy = accessPolicy;
        this.caseStore = caseStore;
        this.vocabulary = vocabulary;
        this.eventDispatcher = eventDispatcher;
        this.clock = clock;
    }

    public List<String> validStages(String category) {
        return vocabulary.stagesFor(category);
    }

    public StageTransition moveToStage(String caseId, String newStage, String notes, User user) {
        CaseRecord record = accessPolicy.requireAccessibleCase(caseId, user);
        if (record.isEnded()) {
            throw CaseworkException.caseEnded("Cannot modify ended case");
        }
        if (newStage == null || newStage.isBlank()) {
            throw CaseworkException.validation("Valid stage is required", "المرحلة مطلوبة");
        }
        CaseCategory category = record.resolvedCategory();
        if (!vocabulary.isValidStage(category, newStage)) {
            throw new InvalidStageException(record.getCategory() != null ? record.getCategory().getKey() : CaseCategory.OTHER.getKey(),
                    newStage, vocabulary.stagesFor(category));
        }
        if (notes != null && notes.length() > MAX_MOVE_NOTE_LENGTH) {
            throw CaseworkException.validation("Notes must not exceed " + MAX_MOVE_NOTE_LENGTH + " characters", "الملاحظات طويلة جداً");
        }

        Instant now = clock.instant();
        String oldStage = vocabulary.effectiveStage(record);
        List<StageHistoryEntry> history = historyWithInitialEntry(record);
        closeOpenEntry(history, now);
        history.add(StageHistoryEntry.open(newStage, now, notes, user.getId()));
        record.setStageHistory(history);
        record.setCurrentStage(newStage);
        record.setPipelineStage(newStage);
        record.setStageEnteredAt(now);
        record.setUpdatedAt(now);

        CaseRecord stored = caseStore.save(record, record.currentRevision(), CaseStore.Change.STAGE);
        log.info("Case {} moved from {} to {} by {}", caseId, oldStage, newStage, user.getId());
        eventDispatcher.dispatch(new CaseStageChangedEvent(caseId, user, oldStage, newStage, notes, now));
        return new StageTransition(stored.getId(), stored.getCurrentStage(), stored.getStageEnteredAt(), stored.getStageHistory());
    }

    public CaseClosure endCase(String caseId, EndCaseCommand command, User user) {
        CaseRecord record = accessPolicy.requireAccessibleCase(caseId, user);
        if (record.isEnded()) {
            throw CaseworkException.caseEnded("Case is already ended");
        }
        if (command == null || command.outcome() == null || command.outcome().isBlank()) {
            throw CaseworkException.validation("Outcome is required", "النتيجة مطلوبة");
        }
        CaseOutcome outcome = CaseOutcome.fromKey(command.outcome());
        if (outcome == null || !outcome.isFinal()) {
            throw CaseworkException.validation("Invalid outcome", "نتيجة غير صالحة", Map.of("validOutcomes", CaseOutcome.finalOutcomeKeys()));
        }
        String endReason = normalizeEndReason(command.endReason());
        BigDecimal finalAmount = parseFinalAmount(command.finalAmount());
        String notes = command.notes();
        if (notes != null && notes.length() > MAX_END_NOTE_LENGTH) {
            throw CaseworkException.validation("Notes must not exceed " + MAX_END_NOTE_LENGTH + " characters", "الملاحظات طويلة جداً");
        }
        Instant now = clock.instant();
        Instant endDate = parseEndDate(command.endDate(), now);

        List<StageHistoryEntry> history = historyWithInitialEntry(record);
        closeOpenEntry(history, now);
        record.setStageHistory(history);
        record.setOutcome(outcome);
        record.setStatus(CaseStatus.CLOSED);
        record.setEndDate(endDate);
        record.setEndDetails(new EndDetails(endDate, endReason, finalAmount, notes, user.getId()));
        record.setUpdatedAt(now);

        CaseRecord stored = caseStore.save(record, record.currentRevision(), CaseStore.Change.CLOSURE);
        log.info("Case {} ended with outcome {} by {}", caseId, outcome.getKey(), user.getId());
        eventDispatcher.dispatch(new CaseEndedEvent(caseId, user, outcome, endReason, finalAmount, now));
        return new CaseClosure(stored.getId(), stored.getStatus(), stored.getOutcome(), stored.getEndDetails());
    }

    /**
     * Cases created before stage tracking have no history; the stage they implicitly sit
     * in becomes the first entry so the history always accounts for it.
     */
    private List<StageHistoryEntry> historyWithInitialEntry(CaseRecord record) {
        List<StageHistoryEntry> history = record.getStageHistory() != null
                ? new ArrayList<>(record.getStageHistory())
                : new ArrayList<>();
        if (history.isEmpty()) {
            Instant enteredAt = record.getStageEnteredAt() != null ? record.getStageEnteredAt() : record.getCreatedAt();
            history.add(StageHistoryEntry.open(vocabulary.effectiveStage(record), enteredAt, null, null));
        }
        return history;
    }

    private static void closeOpenEntry(List<StageHistoryEntry> history, Instant timestamp) {
        for (int i = 0; i < history.size(); i++) {
            StageHistoryEntry entry = history.get(i);
            if (entry.isOpen()) {
                history.set(i, entry.closedAt(timestamp));
            }
        }
    }

    private static String normalizeEndReason(String endReason) {
        if (endReason == null || endReason.isBlank()) {
            return null;
        }
        String reason = endReason.trim();
        if (!END_REASONS.contains(reason)) {
            log.debug("Rejected end reason {}", LogSanitizer.sanitize(reason));
            throw CaseworkException.validation("Invalid end reason", "سبب الإنهاء غير صالح", Map.of("validEndReasons", END_REASONS.stream().sorted().toList()));
        }
        return reason;
    }

    static BigDecimal parseFinalAmount(Object raw) {
        if (raw == null) {
            return null;
        }
        BigDecimal amount;
        try {
            if (raw instanceof BigDecimal decimal) {
                amount = decimal;
            } else if (raw instanceof Number number) {
                amount = new BigDecimal(number.toString());
            } else if (raw instanceof String text) {
                if (text.isBlank()) {
                    return null;
                }
                amount = new BigDecimal(text.trim());
            } else {
                throw CaseworkException.validation("Invalid final amount", "المبلغ النهائي غير صالح");
            }
        } catch (NumberFormatException e) {
            throw CaseworkException.validation("Invalid final amount", "المبلغ النهائي غير صالح");
        }
        if (amount.signum() < 0) {
            throw CaseworkException.validation("Invalid final amount", "المبلغ النهائي غير صالح");
        }
        return amount;
    }

    static Instant parseEndDate(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException inner) {
                throw CaseworkException.validation("Invalid end date", "تاريخ الإنهاء غير صالح");
            }
        }
    }
}
