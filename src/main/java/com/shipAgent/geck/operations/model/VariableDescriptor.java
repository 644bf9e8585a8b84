package com.shipAgent.geck.operations.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Describes one GraphQL variable of an operation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariableDescriptor {
    
    /**
     * GraphQL type reference, e.g. "ID!" or "[String]".
     */
    private String type;
    private Boolean required;
    private String description;
    private Object defaultValue;
}
