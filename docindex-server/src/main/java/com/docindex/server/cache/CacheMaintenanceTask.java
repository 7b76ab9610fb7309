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

import com.docindex.server.store.IndexedDataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired entries from the index memory cache.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenanceTask {
    
    private final MemoryCache<String, IndexedDataset> indexMemoryCache;
    
    @Scheduled(fixedDelayString = "${docindex.cache.cleanup-interval-ms:600000}")
    public void removeExpiredEntries() {
        int removed = indexMemoryCache.removeExpired();
        if (removed > 0) {
            log.info("Removed {} expired index cache entries", removed);
        }
    }
}
