/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.docindex.server.cache;

import com.docindex.server.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MemoryCacheTest {
    
    private MutableClock clock;
    private MemoryCache<String, String> cache;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        cache = new MemoryCache<>(3, 60, clock);
    }
    
    @Test
    void getReturnsStoredValueAndCountsHits() {
        assertTrue(cache.get("a").isEmpty());
        cache.set("a", "alpha");
        
        assertEquals("alpha", cache.get("a").orElseThrow());
        
        MemoryCacheStatistics stats = cache.getStatistics();
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getSize());
        assertEquals(3, stats.getMaxSize());
    }
    
    @Test
    void fullCacheEvictsLeastRecentlyAccessedEntry() {
        cache.set("a", "1");
        clock.advance(Duration.ofSeconds(1));
        cache.set("b", "2");
        clock.advance(Duration.ofSeconds(1));
        cache.set("c", "3");
        clock.advance(Duration.ofSeconds(1));
        cache.get("a");
        
        cache.set("d", "4");
        
        assertEquals(3, cache.size());
        assertTrue(cache.get("b").isEmpty());
        assertTrue(cache.get("a").isPresent());
        assertTrue(cache.get("d").isPresent());
    }
    
    @Test
    void overwritingExistingKeyDoesNotEvict() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");
        
        cache.set("a", "updated");
        
        assertEquals(3, cache.size());
        assertEquals("updated", cache.get("a").orElseThrow());
    }
    
    @Test
    void entriesExpireAfterTtl() {
        cache.set("a", "1");
        
        clock.advance(Duration.ofSeconds(61));
        
        assertTrue(cache.get("a").isEmpty());
        assertEquals(0, cache.size());
    }
    
    @Test
    void backwardClockJumpKeepsEntry() {
        cache.set("a", "1");
        
        clock.rewind(Duration.ofHours(5));
        
        assertEquals("1", cache.get("a").orElseThrow());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(cache.get("a").isPresent());
    }
    
    @Test
    void updateTimestampExtendsAccessButNotCreation() {
        cache.set("a", "1");
        clock.advance(Duration.ofSeconds(50));
        assertTrue(cache.updateTimestamp("a"));
        
        clock.advance(Duration.ofSeconds(50));
        
        assertTrue(cache.get("a").isPresent());
        assertFalse(cache.updateTimestamp("missing"));
    }
    
    @Test
    void removeExpiredSweepsOnlyStaleEntries() {
        cache.set("old", "1");
        clock.advance(Duration.ofSeconds(120));
        cache.set("new", "2");
        
        assertEquals(1, cache.removeExpired());
        assertEquals(1, cache.size());
    }
    
    @Test
    void clearResetsEntriesAndCounters() {
        cache.set("a", "1");
        cache.get("a");
        cache.get("b");
        
        cache.clear();
        
        MemoryCacheStatistics stats = cache.getStatistics();
        assertEquals(0, stats.getSize());
        assertEquals(0, stats.getHits());
        assertEquals(0, stats.getMisses());
        assertFalse(cache.invalidate("a"));
    }
}
