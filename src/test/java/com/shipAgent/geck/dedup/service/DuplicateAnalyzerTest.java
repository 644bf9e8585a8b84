package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.dto.AnalysisReport;
import com.shipAgent.geck.dedup.dto.DuplicateGroupReport;
import com.shipAgent.geck.dedup.dto.OperationSummary;
import com.shipAgent.geck.repository.InMemoryOperationStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.shipAgent.geck.OperationFixtures.T1;
import static com.shipAgent.geck.OperationFixtures.T2;
import static com.shipAgent.geck.OperationFixtures.T3;
import static com.shipAgent.geck.OperationFixtures.operation;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateAnalyzerTest {
    
    private static DuplicateAnalyzer analyzerOver(InMemoryOperationStore store) {
        return new DuplicateAnalyzer(store, new DuplicateGrouper(store));
    }
    
    @Test
    void reportsOnlyNamesOccurringMoreThanOnce() {
        InMemoryOperationStore store = new InMemoryOperationStore().save(
                operation("1", "GetCard").build(),
                operation("2", "ListCards").build(),
                operation("3", "GetCard").build(),
                operation("4", "IssueCard").build(),
                operation("5", "IssueCard").build(),
                operation("6", "IssueCard").build(),
                operation("7", "Ping").build());
        
        AnalysisReport report = analyzerOver(store).analyze();
        
        assertEquals(7, report.getTotalOperations());
        assertEquals(2, report.getTotalGroups());
        assertEquals(3, report.getTotalDuplicates());
        assertEquals(42.86, report.getPercentDuplicated());
        assertEquals(List.of("IssueCard", "GetCard"),
                report.getDuplicateGroups().stream().map(DuplicateGroupReport::getName).toList());
        assertEquals(3, report.getDuplicateGroups().get(0).getCount());
        assertEquals(2, report.getDuplicateGroups().get(0).getDuplicates());
    }
    
    @Test
    void equalSizedGroupsAreOrderedByName() {
        InMemoryOperationStore store = new InMemoryOperationStore().save(
                operation("1", "b").build(), operation("2", "b").build(),
                operation("3", "a").build(), operation("4", "a").build());
        
        AnalysisReport report = analyzerOver(store).analyze();
        
        assertEquals(List.of("a", "b"), report.getDuplicateGroups().stream().map(DuplicateGroupReport::getName).toList());
    }
    
    @Test
    void summarizesDistinctValuesAndOrdersMembersForReview() {
        InMemoryOperationStore store = new InMemoryOperationStore().save(
                operation("generated", "GetCard").type("query").category("cards").vendor("Highnote")
                        .source("generated").createdAt(T2).build(),
                operation("manual", "GetCard").type("query").category("").vendor("Highnote")
                        .source("manual").createdAt(T1).updatedAt(T3).build(),
                operation("imported", "GetCard").type("mutation").category("funding")
                        .source("import").updatedAt(T1).build());
        
        DuplicateGroupReport group = analyzerOver(store).analyze().getDuplicateGroups().get(0);
        
        assertEquals(List.of("cards", "funding"), group.getCategories());
        assertEquals(List.of("Highnote"), group.getVendors());
        assertEquals(List.of("query", "mutation"), group.getTypes());
        assertEquals(List.of("imported", "manual", "generated"),
                group.getOperations().stream().map(OperationSummary::getId).toList());
    }
    
    @Test
    void recordsDeletedDuringAnalysisAreLeftOut() {
        InMemoryOperationStore store = new InMemoryOperationStore().save(
                operation("1", "A").build(), operation("2", "A").build(), operation("3", "A").build(),
                operation("4", "B").build(), operation("5", "B").build());
        store.deleteAfterGrouping("3");
        store.deleteAfterGrouping("5");
        
        AnalysisReport report = analyzerOver(store).analyze();
        
        assertEquals(1, report.getTotalGroups());
        assertEquals(1, report.getTotalDuplicates());
        DuplicateGroupReport group = report.getDuplicateGroups().get(0);
        assertEquals("A", group.getName());
        assertEquals(2, group.getCount());
        assertEquals(List.of("1", "2"), group.getOperations().stream().map(OperationSummary::getId).toList());
    }
    
    @Test
    void emptyStoreReportsNothing() {
        AnalysisReport report = analyzerOver(new InMemoryOperationStore()).analyze();
        
        assertEquals(0, report.getTotalOperations());
        assertEquals(0, report.getTotalGroups());
        assertEquals(0.0, report.getPercentDuplicated());
        assertTrue(report.getDuplicateGroups().isEmpty());
    }
    
    @Test
    void analysisDoesNotTouchTheStore() {
        InMemoryOperationStore store = new InMemoryOperationStore().save(
                operation("1", "GetCard").build(), operation("2", "GetCard").build());
        
        analyzerOver(store).analyze();
        
        assertEquals(2, store.count());
        assertEquals(0, store.getUpdateCalls());
        assertEquals(0, store.getDeleteCalls());
    }
}
