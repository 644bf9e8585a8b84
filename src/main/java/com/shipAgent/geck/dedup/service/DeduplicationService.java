package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.dto.DeduplicationReport;
import com.shipAgent.geck.dedup.dto.DeduplicationResults;
import com.shipAgent.geck.dedup.dto.GroupDetail;
import com.shipAgent.geck.dedup.dto.KeptOperation;
import com.shipAgent.geck.dedup.dto.MergedMetadataSummary;
import com.shipAgent.geck.dedup.dto.RemovedOperation;
import com.shipAgent.geck.dedup.exception.GroupProcessingException;
import com.shipAgent.geck.dedup.exception.InvalidStrategyException;
import com.shipAgent.geck.dedup.model.DedupStrategy;
import com.shipAgent.geck.dedup.model.DuplicateGroup;
import com.shipAgent.geck.dedup.model.GroupMember;
import com.shipAgent.geck.dedup.model.MergedFields;
import com.shipAgent.geck.dedup.model.SurvivorSelection;
import com.shipAgent.geck.operations.model.OperationRecord;
import com.shipAgent.geck.repository.DuplicateNameGroup;
import com.shipAgent.geck.repository.OperationStore;
import com.shipAgent.geck.repository.OperationStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Deduplication engine - collapses every duplicate group into a single merged survivor.
 * 
 * Responsibilities:
 * - Resolve the survivor strategy (fail fast on unknown values)
 * - Select a survivor per group and merge metadata from all members
 * - In a live run, update the survivor and bulk-delete the other members
 * - In a dry run, report the same plan without touching the store
 * 
 * Groups are processed one after another. A group that cannot be merged is counted as an
 * error and skipped. Store failures abort the run; groups applied before the failure stay
 * applied. Update and delete of a group are not atomic: a failure in between leaves the
 * survivor merged with its duplicates still present, which the next run cleans up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {
    
    private final OperationStore operationStore;
    private final DuplicateGrouper duplicateGrouper;
    private final SurvivorSelector survivorSelector;
    private final OperationMerger operationMerger;
    private final RunIdService runIdService;
    private final Clock clock;
    
    /**
     * Runs deduplication over all duplicate groups.
     * 
     * @param strategyValue survivor strategy, null or blank for keep-newest
     * @param dryRun true to only report the plan; null means false
     * @return counters and per-group details
     * @throws InvalidStrategyException if the strategy is unknown, before anything is read
     * @throws OperationStoreException if the store fails mid-run
     */
    public DeduplicationReport deduplicate(String strategyValue, Boolean dryRun) {
        DedupStrategy strategy = DedupStrategy.fromValue(strategyValue);
        boolean simulate = Boolean.TRUE.equals(dryRun);
        String runId = runIdService.generateRunId();
        
        log.info("Deduplication started - runId: {}, strategy: {}, dryRun: {}", runId, strategy.getValue(), simulate);
        
        List<DuplicateNameGroup> names = duplicateGrouper.findDuplicateNames();
        DeduplicationResults results = new DeduplicationResults();
        
        for (DuplicateNameGroup nameGroup : names) {
            try {
                processGroup(nameGroup, strategy, simulate, runId).ifPresent(results::recordGroup);
            } catch (OperationStoreException e) {
                log.error("Store failure, aborting deduplication - runId: {}, group: {}", runId, nameGroup.getName(), e);
                throw e;
            } catch (GroupProcessingException e) {
                log.error("Error processing group - runId: {}, group: {}: {}", runId, e.getGroupName(), e.getMessage(), e);
                results.recordError();
            } catch (RuntimeException e) {
                log.error("Unexpected error processing group - runId: {}, group: {}", runId, nameGroup.getName(), e);
                results.recordError();
            }
        }
        
        log.info("Deduplication finished - runId: {}, processed: {}, kept: {}, removed: {}, errors: {}, dryRun: {}",
                runId, results.getProcessed(), results.getKept(), results.getRemoved(), results.getErrors(), simulate);
        
        return DeduplicationReport.builder()
                .dryRun(simulate)
                .strategy(strategy)
                .results(results)
                .message(simulate
                        ? "Dry run complete. Would remove " + results.getRemoved() + " duplicates."
                        : "Deduplication complete. Removed " + results.getRemoved() + " duplicates.")
                .build();
    }
    
    private Optional<GroupDetail> processGroup(DuplicateNameGroup nameGroup, DedupStrategy strategy,
                                               boolean dryRun, String runId) {
        Optional<DuplicateGroup> loaded = duplicateGrouper.loadGroup(nameGroup);
        if (loaded.isEmpty()) {
            log.debug("Group '{}' no longer duplicated, skipping - runId: {}", nameGroup.getName(), runId);
            return Optional.empty();
        }
        DuplicateGroup group = loaded.get();
        SurvivorSelection selection = survivorSelector.select(group, strategy);
        MergedFields merged = operationMerger.merge(group.getName(), selection);
        
        OperationRecord survivor = selection.survivor().operation();
        List<OperationRecord> removed = selection.removed().stream()
                .map(GroupMember::operation)
                .toList();
        
        if (!dryRun) {
            operationStore.update(survivor.getId(), operationMerger.toUpdate(survivor, merged, Instant.now(clock)));
            
            List<String> removedIds = removed.stream().map(OperationRecord::getId).toList();
            long deleted = operationStore.deleteAllById(removedIds);
            if (deleted != removedIds.size()) {
                log.warn("Group '{}' - expected to delete {} duplicates but store deleted {} - runId: {}",
                        group.getName(), removedIds.size(), deleted, runId);
            }
        }
        
        log.debug("Group '{}' - kept: {}, removed: {}, dryRun: {} - runId: {}",
                group.getName(), survivor.getId(), removed.size(), dryRun, runId);
        
        return Optional.of(GroupDetail.builder()
                .group(group.getName())
                .kept(KeptOperation.of(survivor))
                .removed(removed.stream().map(RemovedOperation::of).toList())
                .mergedMetadata(MergedMetadataSummary.builder()
                        .categories(merged.getCategories())
                        .vendors(merged.getVendors())
                        .totalSourcesMerged(group.size())
                        .build())
                .build());
    }
}
