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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of disk cache counters and on-disk footprint.
 * {@code hits}, {@code misses} and {@code writes} cover every payload kind;
 * the {@code data*} counters cover record and binary payloads only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheStatistics {
    
    private long hits;
    private long misses;
    private long dataHits;
    private long dataMisses;
    private long writes;
    private long dataWrites;
    private long errors;
    private double hitRatio;
    private double dataHitRatio;
    
    private long entryCount;
    private long textFiles;
    private long recordFiles;
    private long binaryFiles;
    private long totalBytes;
    
    private String directory;
    private long ttlSeconds;
    private boolean degraded;
    private String initializationError;
}
