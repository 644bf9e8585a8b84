package com.shipAgent.geck.dedup.dto;

import com.shipAgent.geck.operations.model.OperationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The survivor of a group as it was before the merge.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KeptOperation {
    
    @JsonProperty("_id")
    private String id;
    private String source;
    private Instant createdAt;
    private Instant updatedAt;
    
    public static KeptOperation of(OperationRecord operation) {
        return new KeptOperation(operation.getId(), operation.getSource(),
                operation.getCreatedAt(), operation.getUpdatedAt());
    }
}
