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

import com.docindex.core.util.DualTimestampExpiry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single cached value with its dual timestamp.
 * 
 * <p>{@code creationTime <= lastAccessTime} holds after construction and after every
 * {@link #refresh(long)}.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<V> {
    
    public static final int FORMAT_VERSION = 1;
    
    private String key;
    
    private PayloadKind payloadKind;
    
    /**
     * Epoch millis of the last successful read or write
     */
    private long lastAccessTime;
    
    /**
     * Epoch millis of the first write of this entry
     */
    private long creationTime;
    
    private V value;
    
    @Builder.Default
    private int formatVersion = FORMAT_VERSION;
    
    public static <V> CacheEntry<V> create(String key, PayloadKind kind, V value, long nowMillis) {
        return CacheEntry.<V>builder()
                .key(key)
                .payloadKind(kind)
                .value(value)
                .lastAccessTime(nowMillis)
                .creationTime(nowMillis)
                .build();
    }
    
    public DualTimestampExpiry.Verdict evaluate(long nowMillis, long ttlMillis) {
        return DualTimestampExpiry.evaluate(lastAccessTime, creationTime, nowMillis, ttlMillis);
    }
    
    public boolean isExpired(long nowMillis, long ttlMillis) {
        return evaluate(nowMillis, ttlMillis).isExpired();
    }
    
    /**
     * Slide the access window to {@code nowMillis}. A clock that went back past the
     * creation time pulls the creation time back with it.
     */
    public void refresh(long nowMillis) {
        this.lastAccessTime = nowMillis;
        if (creationTime > nowMillis) {
            creationTime = nowMillis;
        }
    }
}
