package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.dto.AnalysisReport;
import com.shipAgent.geck.dedup.dto.DuplicateGroupReport;
import com.shipAgent.geck.dedup.dto.OperationSummary;
import com.shipAgent.geck.dedup.model.DuplicateGroup;
import com.shipAgent.geck.dedup.model.GroupMember;
import com.shipAgent.geck.operations.model.OperationRecord;
import com.shipAgent.geck.repository.DuplicateNameGroup;
import com.shipAgent.geck.repository.OperationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Duplicate analyzer - reports which operation names occur more than once.
 * 
 * Responsibilities:
 * - Group all stored operations by name
 * - Summarize each group (distinct categories, vendors and types)
 * - List members the way a reviewer would pick a keeper: imports first, then newest
 * - Compute corpus-wide duplicate statistics
 * 
 * Never writes to the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateAnalyzer {
    
    static final Comparator<GroupMember> REVIEW_ORDER = SurvivorSelector.IMPORTS_FIRST
            .thenComparing(SurvivorSelector.NEWEST_FIRST);
    
    private static final Comparator<DuplicateGroupReport> LARGEST_FIRST = Comparator
            .comparingInt(DuplicateGroupReport::getCount).reversed()
            .thenComparing(DuplicateGroupReport::getName, Comparator.nullsLast(Comparator.naturalOrder()));
    
    private final OperationStore operationStore;
    private final DuplicateGrouper duplicateGrouper;
    
    public AnalysisReport analyze() {
        long totalOperations = operationStore.count();
        List<DuplicateNameGroup> names = duplicateGrouper.findDuplicateNames();
        
        List<DuplicateGroupReport> groups = new ArrayList<>(names.size());
        long totalDuplicates = 0;
        for (DuplicateNameGroup nameGroup : names) {
            Optional<DuplicateGroup> group = duplicateGrouper.loadGroup(nameGroup);
            if (group.isEmpty()) {
                continue;
            }
            DuplicateGroupReport report = summarize(group.get());
            totalDuplicates += report.getDuplicates();
            groups.add(report);
        }
        groups.sort(LARGEST_FIRST);
        
        log.info("Duplicate analysis - operations: {}, groups: {}, duplicates: {}",
                totalOperations, groups.size(), totalDuplicates);
        
        return AnalysisReport.builder()
                .totalOperations(totalOperations)
                .totalDuplicates(totalDuplicates)
                .totalGroups(groups.size())
                .percentDuplicated(percent(totalDuplicates, totalOperations))
                .duplicateGroups(groups)
                .build();
    }
    
    private DuplicateGroupReport summarize(DuplicateGroup group) {
        List<OperationSummary> operations = group.getMembers().stream()
                .sorted(REVIEW_ORDER)
                .map(member -> OperationSummary.of(member.operation()))
                .toList();
        
        return DuplicateGroupReport.builder()
                .name(group.getName())
                .count(group.size())
                .duplicates(group.size() - 1)
                .categories(distinct(group, OperationRecord::getCategory))
                .vendors(distinct(group, OperationRecord::getVendor))
                .types(distinct(group, OperationRecord::getType))
                .operations(operations)
                .build();
    }
    
    private static List<String> distinct(DuplicateGroup group, Function<OperationRecord, String> field) {
        Set<String> values = new LinkedHashSet<>();
        for (GroupMember member : group.getMembers()) {
            String value = field.apply(member.operation());
            if (StringUtils.hasLength(value)) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }
    
    static double percent(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
