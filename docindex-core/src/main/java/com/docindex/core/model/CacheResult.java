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
package com.docindex.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a cache read: the value on a hit plus diagnostic metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheResult<T> {
    
    private String key;
    
    private T value;
    
    private boolean hit;
    
    private boolean expired;
    
    private String path;
    
    /**
     * Set when the read failed for a reason other than absence or expiry
     */
    private String error;
    
    /**
     * True when the read gave up because another holder kept the file locked
     */
    private boolean lockError;
    
    private Long creationTimestamp;
    
    private String instanceId;
    
    public static <T> CacheResult<T> miss(String key, String path) {
        return CacheResult.<T>builder().key(key).path(path).build();
    }
    
    public static <T> CacheResult<T> failure(String key, String path, String error) {
        return CacheResult.<T>builder().key(key).path(path).error(error).build();
    }
    
    public boolean isPresent() {
        return hit && value != null;
    }
}
