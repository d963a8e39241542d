package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseAccessPolicy;
import com.jreinhal.caseflow.casework.CaseEnrichmentService;
import com.jreinhal.caseflow.casework.CaseNote;
import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.casework.CaseRecord;
import com.jreinhal.caseflow.casework.CaseStatus;
import com.jreinhal.caseflow.casework.CaseStore;
import com.jreinhal.caseflow.casework.CaseworkException;
import com.jreinhal.caseflow.casework.ClientSummary;
import com.jreinhal.caseflow.casework.LinkedCounts;
import com.jreinhal.caseflow.casework.PartyNameResolver;
import com.jreinhal.caseflow.model.User;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Read side of the pipeline. Every query is restricted to the caller's tenant scope.
 */
@Service
public class PipelineQueryService {
    private static final Logger log = LoggerFactory.getLogger(PipelineQueryService.class);
    static final int DEFAULT_PAGE_SIZE = 100;

    private final CaseStore caseStore;
    private final CaseAccessPolicy accessPolicy;
    private final CaseEnrichmentService enrichmentService;
    private final PartyNameResolver partyNameResolver;
    private final PipelineStatisticsCalculator statisticsCalculator;
    private final StageVocabulary vocabulary;
    private final PipelineProperties properties;
    private final Clock clock;

    public PipelineQueryService(CaseStore caseStore, CaseAccessPolicy accessPolicy, CaseEnrichmentService enrichmentService,
                                PartyNameResolver partyNameResolver, PipelineStatisticsCalculator statisticsCalculator,
                                StageVocabulary vocabulary, PipelineProperties properties, Clock clock) {
        this.caseStore = caseStore;
        this.accessPolicy = accessPolicy;
        this.enrichmentService = enrichmentService;
        this.partyNameResolver = partyNameResolver;
        this.statisticsCalculator = statisticsCalculator;
        this.vocabulary = vocabulary;
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineListing listCases(User user, PipelineFilter filter, Integer page, Integer limit) {
        int pageNumber = page == null ? 1 : page;
        int pageSize = limit == null ? DEFAULT_PAGE_SIZE : limit;
        if (pageNumber < 1) {
            throw CaseworkException.validation("Page must be at least 1", "رقم الصفحة غير صالح");
        }
        if (pageSize < 1 || pageSize > properties.getMaxPageSize()) {
            throw CaseworkException.validation("Limit must be between 1 and " + properties.getMaxPageSize(), "حد الصفحة غير صالح");
        }
        Criteria criteria = filteredScope(user, filter);
        Instant now = clock.instant();

        Query pageQuery = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "updatedAt"))
                .skip((long) (pageNumber - 1) * pageSize)
                .limit(pageSize);
        List<CaseRecord> cases = caseStore.find(pageQuery);

        Query summaryQuery = new Query(criteria);
        summaryQuery.fields().include("category", "currentStage", "pipelineStage", "outcome");
        List<CaseRecord> filtered = caseStore.find(summaryQuery);
        long total = filtered.size();
        Map<String, Long> byStage = new LinkedHashMap<>();
        Map<String, Long> byOutcome = new LinkedHashMap<>();
        for (CaseRecord record : filtered) {
            byStage.merge(vocabulary.effectiveStage(record), 1L, Long::sum);
            String outcome = record.getOutcome() != null ? record.getOutcome().getKey() : CaseOutcome.ONGOING.getKey();
            byOutcome.merge(outcome, 1L, Long::sum);
        }

        Map<String, LinkedCounts> counts = enrichmentService.linkedCounts(cases.stream().map(CaseRecord::getId).toList());
        Map<String, ClientSummary> clients = enrichmentService.clientSummaries(cases.stream().map(CaseRecord::getClientId).filter(Objects::nonNull).toList());
        List<PipelineCaseView> views = new ArrayList<>(cases.size());
        for (CaseRecord record : cases) {
            views.add(toView(record, user, counts.getOrDefault(record.getId(), LinkedCounts.NONE), clients.get(record.getClientId()), now));
        }
        log.debug("Pipeline list for {} returned {} of {} cases", user.getId(), views.size(), total);
        return new PipelineListing(views, PipelineListing.Pagination.of(pageNumber, pageSize, total),
                new PipelineListing.Summary(total, byStage, byOutcome));
    }

    /**
     * Kanban buckets keyed by stage, cards ordered most recently updated first.
     *
     * @param status {@code active} (default), {@code closed} or {@code all}
     */
    public Map<String, List<StageBoardCard>> groupByStage(User user, String category, String status) {
        List<Criteria> conditions = new ArrayList<>();
        conditions.add(accessPolicy.scopeCriteria(user));
        PipelineFilter filter = new PipelineFilter(category, null, null);
        if (filter.category() != null) {
            conditions.add(Criteria.where("category").is(filter.category()));
        }
        String statusKey = status == null || status.isBlank() ? "active" : status.trim().toLowerCase(Locale.ROOT);
        if ("active".equals(statusKey)) {
            conditions.add(Criteria.where("status").nin(CaseStatus.inactiveStatuses()));
            conditions.add(Criteria.where("outcome").nin(CaseOutcome.finalOutcomeKeys()));
        } else if ("closed".equals(statusKey)) {
            conditions.add(new Criteria().orOperator(
                Criteria.where("status").in(CaseStatus.terminalStatuses()),
                Criteria.where("outcome").in(CaseOutcome.finalOutcomeKeys())
            ));
        } else if (!"all".equals(statusKey)) {
            throw CaseworkException.validation("Status must be one of active, closed, all", "الحالة غير صالحة");
        }
        Query query = new Query(new Criteria().andOperator(conditions.toArray(new Criteria[0])))
                .with(Sort.by(Sort.Direction.DESC, "updatedAt"));
        List<CaseRecord> cases = caseStore.find(query);
        Map<String, ClientSummary> clients = enrichmentService.clientSummaries(cases.stream().map(CaseRecord::getClientId).filter(Objects::nonNull).toList());
        Instant now = clock.instant();

        Map<String, List<StageBoardCard>> grouped = new LinkedHashMap<>();
        for (CaseRecord record : cases) {
            String stage = vocabulary.effectiveStage(record);
            CaseNote latest = latestVisibleNote(record.getNotes(), user.getId());
            long daysInStage = record.getStageEnteredAt() != null ? wholeDaysBetween(record.getStageEnteredAt(), now) : 0;
            grouped.computeIfAbsent(stage, k -> new ArrayList<>()).add(new StageBoardCard(
                record.getId(),
                record.getTitle(),
                record.getCaseNumber(),
                record.getCategory(),
                record.getStatus(),
                record.getPriority(),
                partyNameResolver.plaintiffName(record),
                partyNameResolver.defendantName(record),
                clients.get(record.getClientId()),
                record.getCourt(),
                record.getClaimAmount(),
                stage,
                record.getStageEnteredAt(),
                daysInStage,
                record.getNextHearing(),
                record.getOutcome(),
                latest != null ? latest.text() : null,
                record.getUpdatedAt(),
                record.getCreatedAt()
            ));
        }
        return grouped;
    }

    public PipelineStatistics statistics(User user, String category, String dateFrom, String dateTo) {
        List<Criteria> conditions = new ArrayList<>();
        conditions.add(accessPolicy.scopeCriteria(user));
        PipelineFilter filter = new PipelineFilter(category, null, null);
        if (filter.category() != null) {
            conditions.add(Criteria.where("category").is(filter.category()));
        }
        Instant from = parseDateParam(dateFrom, "dateFrom");
        Instant to = parseDateParam(dateTo, "dateTo");
        if (from != null || to != null) {
            Criteria createdAt = Criteria.where("createdAt");
            if (from != null) {
                createdAt = createdAt.gte(from);
            }
            if (to != null) {
                createdAt = createdAt.lte(to);
            }
            conditions.add(createdAt);
        }
        Query query = new Query(new Criteria().andOperator(conditions.toArray(new Criteria[0])));
        query.fields().include("category", "currentStage", "pipelineStage", "outcome", "stageEnteredAt", "claimAmount", "endDetails");
        List<CaseRecord> cases = caseStore.find(query);
        return statisticsCalculator.calculate(cases, clock.instant());
    }

    private Criteria filteredScope(User user, PipelineFilter filter) {
        List<Criteria> conditions = new ArrayList<>();
        conditions.add(accessPolicy.scopeCriteria(user));
        if (filter.category() != null) {
            conditions.add(Criteria.where("category").is(filter.category()));
        }
        if (filter.outcome() != null) {
            conditions.add(Criteria.where("outcome").is(filter.outcome()));
        }
        if (filter.priority() != null) {
            conditions.add(Criteria.where("priority").is(filter.priority()));
        }
        return new Criteria().andOperator(conditions.toArray(new Criteria[0]));
    }

    private PipelineCaseView toView(CaseRecord record, User user, LinkedCounts counts, ClientSummary client, Instant now) {
        Instant stageEnteredAt = record.getStageEnteredAt() != null ? record.getStageEnteredAt() : record.getCreatedAt();
        List<CaseNote> notes = record.getNotes() != null ? record.getNotes() : List.of();
        return new PipelineCaseView(
            record.getId(),
            record.getCaseNumber(),
            record.getTitle(),
            record.getCategory(),
            record.getStatus(),
            record.getPriority(),
            record.getOutcome(),
            partyNameResolver.plaintiffName(record),
            partyNameResolver.defendantName(record),
            client,
            record.getCourt(),
            record.getJudge(),
            record.getNextHearing(),
            record.getClaimAmount(),
            record.getExpectedWinAmount(),
            vocabulary.effectiveStage(record),
            stageEnteredAt,
            stageEnteredAt != null ? wholeDaysBetween(stageEnteredAt, now) : 0,
            counts.tasks(),
            counts.notionPages(),
            counts.reminders(),
            counts.events(),
            notes.size(),
            latestVisibleNote(notes, user.getId()),
            record.getCreatedAt(),
            record.getUpdatedAt()
        );
    }

    /**
     * Newest note the caller may see. Notes are stored newest-first, but legacy arrays
     * may be appended, so the note date decides.
     */
    static CaseNote latestVisibleNote(List<CaseNote> notes, String userId) {
        if (notes == null) {
            return null;
        }
        CaseNote latest = null;
        for (CaseNote note : notes) {
            if (note == null || !note.isVisibleTo(userId)) {
                continue;
            }
            if (latest == null || isNewer(note, latest)) {
                latest = note;
            }
        }
        return latest;
    }

    private static boolean isNewer(CaseNote candidate, CaseNote current) {
        Instant candidateDate = candidate.date() != null ? candidate.date() : candidate.createdAt();
        Instant currentDate = current.date() != null ? current.date() : current.createdAt();
        return candidateDate != null && (currentDate == null || candidateDate.isAfter(currentDate));
    }

    static long wholeDaysBetween(Instant from, Instant to) {
        return Math.floorDiv(Duration.between(from, to).toMillis(), Duration.ofDays(1).toMillis());
    }

    private static Instant parseDateParam(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException inner) {
                throw CaseworkException.validation("Invalid " + name, "تاريخ غير صالح", Map.of("parameter", name));
            }
        }
    }
}
