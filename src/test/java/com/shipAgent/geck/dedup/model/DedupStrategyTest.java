package com.shipAgent.geck.dedup.model;

import com.shipAgent.geck.dedup.exception.InvalidStrategyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DedupStrategyTest {
    
    @Test
    void resolvesWireValues() {
        assertEquals(DedupStrategy.KEEP_NEWEST, DedupStrategy.fromValue("keep-newest"));
        assertEquals(DedupStrategy.KEEP_OLDEST, DedupStrategy.fromValue("keep-oldest"));
        assertEquals(DedupStrategy.KEEP_IMPORT, DedupStrategy.fromValue(" keep-import "));
    }
    
    @Test
    void missingValueSelectsKeepNewest() {
        assertEquals(DedupStrategy.KEEP_NEWEST, DedupStrategy.fromValue(null));
        assertEquals(DedupStrategy.KEEP_NEWEST, DedupStrategy.fromValue("  "));
    }
    
    @Test
    void unknownValueIsRejected() {
        InvalidStrategyException ex = assertThrows(InvalidStrategyException.class,
                () -> DedupStrategy.fromValue("keep-random"));
        assertTrue(ex.getMessage().contains("keep-random"));
        assertTrue(ex.getMessage().contains("keep-import"));
    }
}
