package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.exception.GroupProcessingException;
import com.shipAgent.geck.dedup.model.DuplicateGroup;
import com.shipAgent.geck.dedup.model.GroupMember;
import com.shipAgent.geck.operations.model.OperationRecord;
import com.shipAgent.geck.repository.DuplicateNameGroup;
import com.shipAgent.geck.repository.OperationStore;
import com.shipAgent.geck.repository.OperationStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups stored operations by name for the analyzer and the deduplication engine.
 * 
 * Members are numbered in the order the grouping aggregation listed their ids, so that
 * tie-breaks never depend on the order a bulk fetch happens to return documents in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateGrouper {
    
    private final OperationStore operationStore;
    
    /**
     * @return every name carried by more than one record
     */
    public List<DuplicateNameGroup> findDuplicateNames() {
        return operationStore.findDuplicateNameGroups();
    }
    
    /**
     * Fetches the members of one duplicate name. Members deleted since the grouping ran are
     * dropped; if fewer than two remain the name is no longer duplicated.
     * 
     * @return the group, or empty when at most one member is left
     * @throws GroupProcessingException if a member cannot be read
     * @throws OperationStoreException if the store fails
     */
    public Optional<DuplicateGroup> loadGroup(DuplicateNameGroup nameGroup) {
        String name = nameGroup.getName();
        List<OperationRecord> records;
        try {
            records = operationStore.findAllById(nameGroup.getIds());
        } catch (OperationStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GroupProcessingException(name, "Unreadable member record in group '" + name + "'", e);
        }
        
        Map<String, OperationRecord> byId = new HashMap<>();
        for (OperationRecord record : records) {
            if (record == null || record.getId() == null) {
                throw new GroupProcessingException(name, "Member record without an id in group '" + name + "'");
            }
            byId.put(record.getId(), record);
        }
        
        List<GroupMember> members = new ArrayList<>(nameGroup.getIds().size());
        List<String> vanished = new ArrayList<>();
        for (String id : nameGroup.getIds()) {
            OperationRecord record = byId.get(id);
            if (record == null) {
                vanished.add(id);
            } else {
                members.add(new GroupMember(members.size(), record));
            }
        }
        if (!vanished.isEmpty()) {
            log.warn("Group '{}' - members no longer present, ignoring: {}", name, vanished);
        }
        if (members.size() < 2) {
            log.debug("Group '{}' has {} member(s) left, no longer duplicated", name, members.size());
            return Optional.empty();
        }
        
        log.debug("Loaded duplicate group '{}' with {} members", name, members.size());
        return Optional.of(DuplicateGroup.builder()
                .name(name)
                .members(members)
                .build());
    }
}
