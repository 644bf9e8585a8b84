package com.shipAgent.geck.dedup.model;

import com.shipAgent.geck.operations.model.ProvenanceSnapshot;
import com.shipAgent.geck.operations.model.VariableDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Metadata combined from every member of a duplicate group.
 * Lists hold distinct values in merge order, survivor first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MergedFields {
    
    private List<String> categories;
    private List<String> vendors;
    
    /**
     * Longest non-empty description in the group, or null when none has one.
     */
    private String bestDescription;
    
    /**
     * Longest non-empty query text in the group, or null when none has one.
     */
    private String bestQuery;
    
    /**
     * Union of member tags plus every category and normalized vendor.
     */
    private List<String> tags;
    
    /**
     * Union of member variables; the later member in merge order wins on a shared key.
     */
    private Map<String, VariableDescriptor> variables;
    
    private boolean required;
    private List<ProvenanceSnapshot> sources;
}
