package com.shipAgent.geck.dedup.dto;

import com.shipAgent.geck.dedup.model.DedupStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a deduplication run. {@code dryRun} is always present so a simulated plan
 * cannot be mistaken for an applied one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeduplicationReport {
    
    private boolean dryRun;
    private DedupStrategy strategy;
    private DeduplicationResults results;
    private String message;
}
