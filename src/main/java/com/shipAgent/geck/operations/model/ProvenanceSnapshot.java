package com.shipAgent.geck.operations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Origin of one record folded into a survivor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProvenanceSnapshot {
    
    private String id;
    private String category;
    private String vendor;
    private String source;
    private Instant createdAt;
    
    public static ProvenanceSnapshot of(OperationRecord operation) {
        return ProvenanceSnapshot.builder()
                .id(operation.getId())
                .category(operation.getCategory())
                .vendor(operation.getVendor())
                .source(operation.getSource())
                .createdAt(operation.getCreatedAt())
                .build();
    }
}
