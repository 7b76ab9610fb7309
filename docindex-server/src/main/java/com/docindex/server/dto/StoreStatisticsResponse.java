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
package com.docindex.server.dto;

import com.docindex.core.model.LoadSource;
import com.docindex.core.model.LoadStatus;
import com.docindex.server.cache.MemoryCacheStatistics;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics of a loaded store.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class StoreStatisticsResponse extends StoreResponse {
    
    private int totalOptions;
    
    private int totalCategories;
    
    private int totalTypes;
    
    private Map<String, Integer> bySource;
    
    private Map<String, Integer> byType;
    
    private Map<String, Integer> byCategory;
    
    private Map<String, Object> indexStats;
    
    private LoadStatus status;
    
    private LoadSource loadedFrom;
    
    private Instant lastLoadedAt;
    
    private Long lastLoadMillis;
    
    private MemoryCacheStatistics memoryCache;
}
