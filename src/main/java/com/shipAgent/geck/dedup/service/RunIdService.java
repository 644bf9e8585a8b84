package com.shipAgent.geck.dedup.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating run IDs that tie together the log lines of one deduplication run.
 */
@Service
public class RunIdService {
    
    public String generateRunId() {
        return UUID.randomUUID().toString();
    }
}
