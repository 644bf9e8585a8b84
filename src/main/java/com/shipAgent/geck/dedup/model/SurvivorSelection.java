package com.shipAgent.geck.dedup.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying a strategy to one group: the record to keep and the ones to delete,
 * the latter in strategy order.
 */
public record SurvivorSelection(GroupMember survivor, List<GroupMember> removed) {
    
    /**
     * All members in strategy order, survivor first. This is the order metadata is merged in.
     */
    public List<GroupMember> ordered() {
        List<GroupMember> ordered = new ArrayList<>(removed.size() + 1);
        ordered.add(survivor);
        ordered.addAll(removed);
        return ordered;
    }
}
