package com.shipAgent.geck.dedup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Read-only view of how much of the operations collection is duplicated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisReport {
    
    private long totalOperations;
    
    /**
     * Records beyond the first in every duplicate group, i.e. how many a full run would remove.
     */
    private long totalDuplicates;
    
    private int totalGroups;
    
    /**
     * totalDuplicates / totalOperations as a percentage, two decimals.
     */
    private double percentDuplicated;
    
    private List<DuplicateGroupReport> duplicateGroups;
}
