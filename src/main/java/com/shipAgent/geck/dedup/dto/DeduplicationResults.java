package com.shipAgent.geck.dedup.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters and per-group details of a deduplication run.
 * In a dry run {@code removed} counts the records that would be deleted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationResults {
    
    private int processed;
    private int kept;
    private int removed;
    private int errors;
    
    private List<GroupDetail> details = new ArrayList<>();
    
    public void recordGroup(GroupDetail detail) {
        processed++;
        kept++;
        removed += detail.getRemoved().size();
        details.add(detail);
    }
    
    public void recordError() {
        errors++;
    }
}
