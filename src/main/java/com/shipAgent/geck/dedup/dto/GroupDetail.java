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
public class GroupDetail {
    
    private String group;
    private KeptOperation kept;
    private List<RemovedOperation> removed;
    private MergedMetadataSummary mergedMetadata;
}
