package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.model.DedupStrategy;
import com.shipAgent.geck.dedup.model.DuplicateGroup;
import com.shipAgent.geck.dedup.model.GroupMember;
import com.shipAgent.geck.dedup.model.SurvivorSelection;
import com.shipAgent.geck.operations.model.OperationRecord;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the survivor of a duplicate group.
 * 
 * Members are sorted by the strategy, survivor first. Every ordering ends with the read
 * sequence, so equal timestamps keep the member that was read first.
 */
@Component
public class SurvivorSelector {
    
    static final Comparator<GroupMember> NEWEST_FIRST = Comparator
            .comparing((GroupMember member) -> member.operation().effectiveRecency())
            .reversed()
            .thenComparingInt(GroupMember::sequence);
    
    static final Comparator<GroupMember> IMPORTS_FIRST = Comparator
            .comparing((GroupMember member) -> !member.operation().hasSource(OperationRecord.SOURCE_IMPORT));
    
    static final Comparator<GroupMember> OLDEST_FIRST = Comparator
            .comparing((GroupMember member) -> member.operation().effectiveCreatedAt())
            .thenComparingInt(GroupMember::sequence);
    
    public SurvivorSelection select(DuplicateGroup group, DedupStrategy strategy) {
        List<GroupMember> ordered = group.getMembers().stream()
                .sorted(order(strategy))
                .toList();
        if (ordered.isEmpty()) {
            throw new IllegalArgumentException("Duplicate group has no members");
        }
        return new SurvivorSelection(ordered.get(0), ordered.subList(1, ordered.size()));
    }
    
    /**
     * keep-import puts import-sourced members ahead of the rest, so without any imports it
     * degrades to keep-newest.
     */
    static Comparator<GroupMember> order(DedupStrategy strategy) {
        return switch (strategy) {
            case KEEP_OLDEST -> OLDEST_FIRST;
            case KEEP_IMPORT -> IMPORTS_FIRST.thenComparing(NEWEST_FIRST);
            case KEEP_NEWEST -> NEWEST_FIRST;
        };
    }
}
