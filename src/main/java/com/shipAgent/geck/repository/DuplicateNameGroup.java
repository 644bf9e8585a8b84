package com.shipAgent.geck.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result row of the group-by-name aggregation: a name shared by several records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DuplicateNameGroup {
    
    private String name;
    private List<String> ids;
    
    public int count() {
        return ids == null ? 0 : ids.size();
    }
}
