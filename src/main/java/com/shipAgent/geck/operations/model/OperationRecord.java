package com.shipAgent.geck.operations.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One API operation definition as stored in the operations collection.
 * 
 * The same logical {@code name} may appear on several records, typically because the
 * operation was imported from more than one Postman collection, category or vendor.
 * Timestamps and {@code required} are optional; see {@link #effectiveRecency()} and
 * {@link #effectiveCreatedAt()} for the fallbacks used when ordering records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperationRecord {
    
    public static final String SOURCE_IMPORT = "import";
    
    /**
     * Store-assigned identifier. Never changes once created.
     */
    @Id
    private String id;
    
    /**
     * Logical key that duplicates are grouped by. Not unique.
     */
    private String name;
    
    /**
     * "query", "mutation" or "subscription".
     */
    private String type;
    
    private String category;
    private String vendor;
    private String description;
    
    /**
     * Raw GraphQL operation text.
     */
    private String query;
    
    private Map<String, VariableDescriptor> variables;
    private List<String> tags;
    private Boolean required;
    
    /**
     * Provenance marker such as "import", "manual" or "generated".
     */
    private String source;
    
    private Instant createdAt;
    private Instant updatedAt;
    
    /**
     * Written only by the duplicate merge.
     */
    private OperationMetadata metadata;
    
    /**
     * Last modification time, falling back to creation time, then to the epoch.
     */
    public Instant effectiveRecency() {
        if (updatedAt != null) {
            return updatedAt;
        }
        return effectiveCreatedAt();
    }
    
    /**
     * Creation time, or the epoch when absent so that undated records sort earliest.
     */
    public Instant effectiveCreatedAt() {
        return createdAt != null ? createdAt : Instant.EPOCH;
    }
    
    public boolean hasSource(String candidate) {
        return candidate.equals(source);
    }
}
