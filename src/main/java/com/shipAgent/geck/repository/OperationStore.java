package com.shipAgent.geck.repository;

import com.shipAgent.geck.operations.model.OperationRecord;
import com.shipAgent.geck.operations.model.OperationUpdate;

import java.util.Collection;
import java.util.List;

/**
 * Access to the operations collection as needed by duplicate analysis and merge.
 * 
 * Implementations report connectivity, read and write failures as
 * {@link OperationStoreException}. All calls block the calling thread.
 */
public interface OperationStore {
    
    /**
     * @return total number of stored operation records
     */
    long count();
    
    /**
     * Groups records by {@code name} and returns only the names carried by more than one record.
     * Member ids are listed in the order the store produced them.
     */
    List<DuplicateNameGroup> findDuplicateNameGroups();
    
    /**
     * Bulk fetch. Ids that no longer exist are silently absent from the result,
     * and the result order is unspecified.
     */
    List<OperationRecord> findAllById(Collection<String> ids);
    
    /**
     * Sets every non-null field of {@code update} on the record with the given id.
     */
    void update(String id, OperationUpdate update);
    
    /**
     * Deletes all records with the given ids. Missing ids are a no-op.
     * 
     * @return number of records actually deleted
     */
    long deleteAllById(Collection<String> ids);
}
