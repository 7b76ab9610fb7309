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
import com.docindex.server.store.IndexedDataset;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CacheMaintenanceTaskTest {
    
    @Test
    void sweepDropsExpiredDatasets() {
        MutableClock clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        MemoryCache<String, IndexedDataset> cache = new MemoryCache<>(4, 60, clock);
        cache.set("home-manager_data", new IndexedDataset(null, null));
        CacheMaintenanceTask task = new CacheMaintenanceTask(cache);
        
        task.removeExpiredEntries();
        assertEquals(1, cache.size());
        
        clock.advance(Duration.ofMinutes(5));
        task.removeExpiredEntries();
        assertEquals(0, cache.size());
    }
}
