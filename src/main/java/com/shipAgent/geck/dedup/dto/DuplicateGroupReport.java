package com.shipAgent.geck.dedup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One duplicate group as shown by the analyzer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DuplicateGroupReport {
    
    private String name;
    private int count;
    private int duplicates;
    private List<String> categories;
    private List<String> vendors;
    private List<String> types;
    
    /**
     * Import-sourced members first, then most recently updated first.
     */
    private List<OperationSummary> operations;
}
