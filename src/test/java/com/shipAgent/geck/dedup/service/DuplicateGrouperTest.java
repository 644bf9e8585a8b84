package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.exception.GroupProcessingException;
import com.shipAgent.geck.dedup.model.DuplicateGroup;
import com.shipAgent.geck.dedup.model.GroupMember;
import com.shipAgent.geck.repository.DuplicateNameGroup;
import com.shipAgent.geck.repository.InMemoryOperationStore;
import com.shipAgent.geck.repository.OperationStore;
import com.shipAgent.geck.repository.OperationStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static com.shipAgent.geck.OperationFixtures.operation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DuplicateGrouperTest {
    
    private InMemoryOperationStore store;
    private DuplicateGrouper grouper;
    
    @BeforeEach
    void setUp() {
        store = new InMemoryOperationStore().save(
                operation("1", "GetCard").build(),
                operation("2", "ListCards").build(),
                operation("3", "GetCard").build(),
                operation("4", "GetCard").build());
        grouper = new DuplicateGrouper(store);
    }
    
    @Test
    void numbersMembersInAggregationOrderNotFetchOrder() {
        DuplicateNameGroup nameGroup = grouper.findDuplicateNames().get(0);
        
        DuplicateGroup group = grouper.loadGroup(nameGroup).orElseThrow();
        
        assertEquals("GetCard", group.getName());
        assertEquals(List.of("1", "3", "4"), group.getMembers().stream().map(m -> m.operation().getId()).toList());
        assertEquals(List.of(0, 1, 2), group.getMembers().stream().map(GroupMember::sequence).toList());
    }
    
    @Test
    void vanishedMembersAreDroppedAndRemainingOnesRenumbered() {
        DuplicateNameGroup nameGroup = new DuplicateNameGroup("GetCard", List.of("1", "gone", "4"));
        
        DuplicateGroup group = grouper.loadGroup(nameGroup).orElseThrow();
        
        assertEquals(List.of("1", "4"), group.getMembers().stream().map(m -> m.operation().getId()).toList());
        assertEquals(List.of(0, 1), group.getMembers().stream().map(GroupMember::sequence).toList());
    }
    
    @Test
    void groupWithOneMemberLeftIsNoLongerDuplicated() {
        DuplicateNameGroup nameGroup = new DuplicateNameGroup("GetCard", List.of("gone", "3"));
        
        assertTrue(grouper.loadGroup(nameGroup).isEmpty());
    }
    
    @Test
    void unreadableMemberFailsTheGroup() {
        store.markCorrupt("3");
        DuplicateNameGroup nameGroup = grouper.findDuplicateNames().get(0);
        
        GroupProcessingException ex = assertThrows(GroupProcessingException.class, () -> grouper.loadGroup(nameGroup));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }
    
    @Test
    void storeFailurePropagatesUnchanged() {
        OperationStore failing = mock(OperationStore.class);
        OperationStoreException failure = new OperationStoreException("down", new DataAccessResourceFailureException("down"));
        when(failing.findAllById(any())).thenThrow(failure);
        
        DuplicateGrouper failingGrouper = new DuplicateGrouper(failing);
        DuplicateNameGroup nameGroup = new DuplicateNameGroup("GetCard", List.of("1", "3"));
        
        assertSame(failure, assertThrows(OperationStoreException.class, () -> failingGrouper.loadGroup(nameGroup)));
    }
}
