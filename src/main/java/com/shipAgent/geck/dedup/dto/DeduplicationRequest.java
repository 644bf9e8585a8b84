package com.shipAgent.geck.dedup.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for a deduplication run. Both fields are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationRequest {
    
    /**
     * "keep-newest" (default), "keep-oldest" or "keep-import".
     */
    @Size(max = 64, message = "strategy must be at most 64 characters")
    private String strategy;
    
    private Boolean dryRun;
}
