package com.shipAgent.geck.operations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Field-level update applied to a single operation record.
 * Null fields are left untouched; non-null fields are overwritten.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OperationUpdate {
    
    private String category;
    private String vendor;
    private String description;
    private String query;
    private List<String> tags;
    private Map<String, VariableDescriptor> variables;
    private Boolean required;
    private OperationMetadata metadata;
    private Instant updatedAt;
}
