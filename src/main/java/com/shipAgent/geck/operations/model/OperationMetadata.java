package com.shipAgent.geck.operations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Merge bookkeeping kept on a surviving operation: every category and vendor the
 * duplicate group carried, and where each merged record came from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OperationMetadata {
    
    private List<String> categories;
    private List<String> vendors;
    private List<ProvenanceSnapshot> sources;
}
