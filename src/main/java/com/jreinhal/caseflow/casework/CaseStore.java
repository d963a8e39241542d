package com.jreinhal.caseflow.casework;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

/**
 * Case persistence over the shared {@code cases} collection. Every write is a
 * compare-and-swap on {@code revision}; documents that predate the field count as
 * revision 0. The case module owns the document, so writes only {@code $set} the fields
 * of one {@link Change} and leave everything else as stored.
 */
@Component
public class CaseStore {
    private static final Logger log = LoggerFactory.getLogger(CaseStore.class);
    public static final String COLLECTION = "cases";

    private final MongoTemplate mongoTemplate;

    public CaseStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Loads a case that is not soft-deleted. No tenant scoping is applied here.
     */
    public Optional<CaseRecord> findActive(String caseId) {
        Query query = new Query(Criteria.where("id").is(caseId).and("deletedAt").is(null));
        return Optional.ofNullable(mongoTemplate.findOne(query, CaseRecord.class, COLLECTION));
    }

    public List<CaseRecord> find(Query query) {
        return mongoTemplate.find(query, CaseRecord.class, COLLECTION);
    }

    public long count(Query query) {
        return mongoTemplate.count(Query.of(query).limit(0).skip(0), CaseRecord.class, COLLECTION);
    }

    /**
     * Writes the fields of {@code change} if the stored revision still matches the revision
     * the record was loaded with.
     *
     * @return the stored record, now at {@code expectedRevision + 1}
     * @throws CaseworkException CONFLICT when another write got there first
     */
    public CaseRecord save(CaseRecord record, long expectedRevision, Change change) {
        Query query = new Query(new Criteria().andOperator(
            Criteria.where("id").is(record.getId()),
            revisionMatches(expectedRevision)
        ));
        Update update = change.toUpdate(record)
            .set("updatedAt", record.getUpdatedAt())
            .set("revision", expectedRevision + 1);
        CaseRecord stored = mongoTemplate.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true), CaseRecord.class, COLLECTION);
        if (stored == null) {
            log.warn("Revision check failed for case {} at revision {}", record.getId(), expectedRevision);
            throw CaseworkException.concurrentModification(record.getId());
        }
        record.setRevision(expectedRevision + 1);
        return stored;
    }

    /**
     * The field groups the pipeline is allowed to write.
     */
    public enum Change {
        STAGE {
            @Override
            Update toUpdate(CaseRecord record) {
                return new Update()
                    .set("currentStage", record.getCurrentStage())
                    .set("pipelineStage", record.getPipelineStage())
                    .set("stageEnteredAt", record.getStageEnteredAt())
                    .set("stageHistory", record.getStageHistory());
            }
        },
        CLOSURE {
            @Override
            Update toUpdate(CaseRecord record) {
                return new Update()
                    .set("status", record.getStatus())
                    .set("outcome", record.getOutcome())
                    .set("endDate", record.getEndDate())
                    .set("endDetails", record.getEndDetails())
                    .set("stageHistory", record.getStageHistory());
            }
        },
        NOTES {
            @Override
            Update toUpdate(CaseRecord record) {
                return new Update().set("notes", record.getNotes());
            }
        };

        abstract Update toUpdate(CaseRecord record);
    }

    private static Criteria revisionMatches(long expectedRevision) {
        if (expectedRevision == 0L) {
            return new Criteria().orOperator(
                Criteria.where("revision").exists(false),
                Criteria.where("revision").is(null),
                Criteria.where("revision").is(0L)
            );
        }
        return Criteria.where("revision").is(expectedRevision);
    }
}
