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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of memory cache counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryCacheStatistics {
    private int size;
    private int maxSize;
    private long ttlSeconds;
    private long hits;
    private long misses;
    private double hitRatio;
    private String instanceId;
    private long uptimeMillis;
}
