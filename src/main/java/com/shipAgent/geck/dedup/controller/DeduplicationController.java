package com.shipAgent.geck.dedup.controller;

import com.shipAgent.geck.dedup.dto.AnalysisReport;
import com.shipAgent.geck.dedup.dto.DeduplicationReport;
import com.shipAgent.geck.dedup.dto.DeduplicationRequest;
import com.shipAgent.geck.dedup.service.DeduplicationService;
import com.shipAgent.geck.dedup.service.DuplicateAnalyzer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Duplicate operations REST controller - thin HTTP layer over the analyzer and the
 * deduplication engine.
 */
@RestController
@RequestMapping("/api/v1/operations/duplicates")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:8888"})
@RequiredArgsConstructor
public class DeduplicationController {
    
    private final DuplicateAnalyzer duplicateAnalyzer;
    private final DeduplicationService deduplicationService;
    
    /**
     * Reports duplicate groups without changing anything.
     */
    @GetMapping
    public ResponseEntity<AnalysisReport> analyze() {
        return ResponseEntity.ok(duplicateAnalyzer.analyze());
    }
    
    /**
     * Runs deduplication. Without a body this is a live keep-newest run.
     * 
     * @param request optional strategy and dryRun flag
     * @return run report
     */
    @PostMapping("/deduplicate")
    public ResponseEntity<DeduplicationReport> deduplicate(
            @Valid @RequestBody(required = false) DeduplicationRequest request) {
        
        DeduplicationRequest effective = request != null ? request : new DeduplicationRequest();
        return ResponseEntity.ok(deduplicationService.deduplicate(effective.getStrategy(), effective.getDryRun()));
    }
}
