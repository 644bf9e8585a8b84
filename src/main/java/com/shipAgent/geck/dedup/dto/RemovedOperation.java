package com.shipAgent.geck.dedup.dto;

import com.shipAgent.geck.operations.model.OperationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RemovedOperation {
    
    @JsonProperty("_id")
    private String id;
    private String source;
    private String category;
    private String vendor;
    private Instant createdAt;
    
    public static RemovedOperation of(OperationRecord operation) {
        return new RemovedOperation(operation.getId(), operation.getSource(), operation.getCategory(),
                operation.getVendor(), operation.getCreatedAt());
    }
}
