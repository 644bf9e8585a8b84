package com.shipAgent.geck.dedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * All records sharing one name, ordered by read sequence.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DuplicateGroup {
    
    private String name;
    private List<GroupMember> members;
    
    public int size() {
        return members.size();
    }
}
