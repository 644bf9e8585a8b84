package com.shipAgent.geck.dedup.dto;

import com.shipAgent.geck.operations.model.OperationRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationSummary {
    
    @JsonProperty("_id")
    private String id;
    private String name;
    private String vendor;
    private String category;
    private String type;
    private String source;
    private Boolean required;
    private String description;
    private List<String> tags;
    private Instant createdAt;
    private Instant updatedAt;
    
    public static OperationSummary of(OperationRecord operation) {
        return OperationSummary.builder()
                .id(operation.getId())
                .name(operation.getName())
                .vendor(operation.getVendor())
                .category(operation.getCategory())
                .type(operation.getType())
                .source(operation.getSource())
                .required(operation.getRequired())
                .description(operation.getDescription())
                .tags(operation.getTags())
                .createdAt(operation.getCreatedAt())
                .updatedAt(operation.getUpdatedAt())
                .build();
    }
}
