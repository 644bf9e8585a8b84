package com.shipAgent.geck.dedup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MergedMetadataSummary {
    
    private List<String> categories;
    private List<String> vendors;
    private int totalSourcesMerged;
}
