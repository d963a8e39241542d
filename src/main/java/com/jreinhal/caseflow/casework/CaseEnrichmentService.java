package com.jreinhal.caseflow.casework;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Read-only lookups into collections owned by other modules. A failed lookup degrades
 * to zero counts or a missing client rather than failing the listing.
 */
@Service
public class CaseEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(CaseEnrichmentService.class);
    static final String TASKS_COLLECTION = "tasks";
    static final String NOTION_PAGES_COLLECTION = "casenotionpages";
    static final String REMINDERS_COLLECTION = "reminders";
    static final String EVENTS_COLLECTION = "events";
    static final String CLIENTS_COLLECTION = "clients";

    private final MongoTemplate mongoTemplate;

    public CaseEnrichmentService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public Map<String, LinkedCounts> linkedCounts(Collection<String> caseIds) {
        Map<String, LinkedCounts> result = new HashMap<>();
        if (caseIds.isEmpty()) {
            return result;
        }
        List<ObjectId> ids = toObjectIds(caseIds);
        Map<String, Long> tasks = countByCase(TASKS_COLLECTION, Criteria.where("caseId").in(ids));
        Map<String, Long> pages = countByCase(NOTION_PAGES_COLLECTION, Criteria.where("caseId").in(ids).and("deletedAt").is(null));
        Map<String, Long> reminders = countByCase(REMINDERS_COLLECTION, Criteria.where("caseId").in(ids));
        Map<String, Long> events = countByCase(EVENTS_COLLECTION, Criteria.where("caseId").in(ids));
        for (String caseId : caseIds) {
            result.put(caseId, new LinkedCounts(
                    tasks.getOrDefault(caseId, 0L),
                    pages.getOrDefault(caseId, 0L),
                    reminders.getOrDefault(caseId, 0L),
                    events.getOrDefault(caseId, 0L)));
        }
        return result;
    }

    public Map<String, ClientSummary> clientSummaries(Collection<String> clientIds) {
        Map<String, ClientSummary> result = new HashMap<>();
        List<String> validIds = clientIds.stream().filter(Objects::nonNull).filter(ObjectId::isValid).distinct().toList();
        if (validIds.isEmpty()) {
            return result;
        }
        try {
            Query query = new Query(Criteria.where("_id").in(toObjectIds(validIds)));
            query.fields().include("companyName", "firstName", "lastName", "name", "phone");
            for (Document doc : mongoTemplate.find(query, Document.class, CLIENTS_COLLECTION)) {
                String id = doc.getObjectId("_id").toHexString();
                result.put(id, new ClientSummary(id, displayName(doc), doc.getString("phone")));
            }
        } catch (Exception e) {
            log.warn("Client lookup failed for {} clients: {}", validIds.size(), e.getMessage());
        }
        return result;
    }

    static String displayName(Document client) {
        String companyName = client.getString("companyName");
        if (companyName != null && !companyName.isBlank()) {
            return companyName;
        }
        String firstName = client.getString("firstName");
        String lastName = client.getString("lastName");
        if (firstName != null || lastName != null) {
            return ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        }
        return client.getString("name");
    }

    private Map<String, Long> countByCase(String collection, Criteria match) {
        Map<String, Long> counts = new HashMap<>();
        try {
            Aggregation agg = Aggregation.newAggregation(
                    Aggregation.match(match),
                    Aggregation.group("caseId").count().as("count")
            );
            AggregationResults<Document> results = mongoTemplate.aggregate(agg, collection, Document.class);
            for (Document doc : results.getMappedResults()) {
                Object id = doc.get("_id");
                Object count = doc.get("count");
                if (id != null && count instanceof Number number) {
                    String key = id instanceof ObjectId objectId ? objectId.toHexString() : id.toString();
                    counts.put(key, number.longValue());
                }
            }
        } catch (Exception e) {
            log.warn("Linked count lookup failed for {}: {}", collection, e.getMessage());
        }
        return counts;
    }

    private static List<ObjectId> toObjectIds(Collection<String> ids) {
        return ids.stream().filter(ObjectId::isValid).map(ObjectId::new).toList();
    }
}
