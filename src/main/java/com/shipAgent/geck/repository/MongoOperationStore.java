package com.shipAgent.geck.repository;

import com.shipAgent.geck.operations.model.OperationRecord;
import com.shipAgent.geck.operations.model.OperationUpdate;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * MongoDB-backed operation store.
 * 
 * Grouping runs server side as a {@code $group} on {@code name} that pushes member ids,
 * followed by a {@code $match} on {@code count > 1}. Records without a name are not grouped.
 */
@Slf4j
@Repository
public class MongoOperationStore implements OperationStore {
    
    static final String FIELD_IDS = "ids";
    static final String FIELD_COUNT = "count";
    
    private final MongoTemplate mongoTemplate;
    private final String collection;
    
    public MongoOperationStore(MongoTemplate mongoTemplate,
                               @Value("${geck.operations.collection:operations}") String collection) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
    }
    
    @Override
    public long count() {
        try {
            return mongoTemplate.count(new Query(), collection);
        } catch (DataAccessException e) {
            throw new OperationStoreException("Failed to count operations in " + collection, e);
        }
    }
    
    @Override
    public List<DuplicateNameGroup> findDuplicateNameGroups() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("name").ne(null)),
                Aggregation.group("name").push("_id").as(FIELD_IDS).count().as(FIELD_COUNT),
                Aggregation.match(Criteria.where(FIELD_COUNT).gt(1))
        );
        
        AggregationResults<Document> results;
        try {
            results = mongoTemplate.aggregate(aggregation, collection, Document.class);
        } catch (DataAccessException e) {
            throw new OperationStoreException("Failed to group operations by name in " + collection, e);
        }
        
        List<DuplicateNameGroup> groups = new ArrayList<>();
        for (Document row : results.getMappedResults()) {
            groups.add(toNameGroup(row));
        }
        log.debug("Found {} duplicate names in collection: {}", groups.size(), collection);
        return groups;
    }
    
    @Override
    public List<OperationRecord> findAllById(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        try {
            return mongoTemplate.find(Query.query(Criteria.where("_id").in(ids)), OperationRecord.class, collection);
        } catch (DataAccessException e) {
            throw new OperationStoreException("Failed to fetch " + ids.size() + " operations from " + collection, e);
        }
    }
    
    @Override
    public void update(String id, OperationUpdate update) {
        Update mongoUpdate = toMongoUpdate(update);
        if (mongoUpdate.getUpdateObject().isEmpty()) {
            log.debug("Nothing to update for operation: {}", id);
            return;
        }
        try {
            UpdateResult result = mongoTemplate.updateFirst(
                    Query.query(Criteria.where("_id").is(id)), mongoUpdate, OperationRecord.class, collection);
            if (result.getMatchedCount() == 0) {
                log.warn("Update matched no operation with _id: {}", id);
            }
        } catch (DataAccessException e) {
            throw new OperationStoreException("Failed to update operation " + id, e);
        }
    }
    
    @Override
    public long deleteAllById(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        try {
            DeleteResult result = mongoTemplate.remove(
                    Query.query(Criteria.where("_id").in(ids)), OperationRecord.class, collection);
            return result.getDeletedCount();
        } catch (DataAccessException e) {
            throw new OperationStoreException("Failed to delete " + ids.size() + " operations from " + collection, e);
        }
    }
    
    /**
     * Converts an aggregation row into a name group. Ids are ObjectIds for imported records
     * but may be plain strings for records created by hand.
     */
    static DuplicateNameGroup toNameGroup(Document row) {
        List<String> ids = new ArrayList<>();
        List<?> rawIds = row.get(FIELD_IDS, List.class);
        if (rawIds != null) {
            for (Object rawId : rawIds) {
                ids.add(String.valueOf(rawId));
            }
        }
        Object name = row.get("_id");
        return DuplicateNameGroup.builder()
                .name(name == null ? null : name.toString())
                .ids(ids)
                .build();
    }
    
    static Update toMongoUpdate(OperationUpdate update) {
        Update mongoUpdate = new Update();
        setIfPresent(mongoUpdate, "category", update.getCategory());
        setIfPresent(mongoUpdate, "vendor", update.getVendor());
        setIfPresent(mongoUpdate, "description", update.getDescription());
        setIfPresent(mongoUpdate, "query", update.getQuery());
        setIfPresent(mongoUpdate, "tags", update.getTags());
        setIfPresent(mongoUpdate, "variables", update.getVariables());
        setIfPresent(mongoUpdate, "required", update.getRequired());
        setIfPresent(mongoUpdate, "metadata", update.getMetadata());
        setIfPresent(mongoUpdate, "updatedAt", update.getUpdatedAt());
        return mongoUpdate;
    }
    
    private static void setIfPresent(Update mongoUpdate, String field, Object value) {
        if (value != null) {
            mongoUpdate.set(field, value);
        }
    }
}
