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

import com.docindex.core.model.CacheEntry;
import com.docindex.core.model.PayloadKind;
import com.docindex.core.util.DualTimestampExpiry;
import com.docindex.core.util.InstanceIdentity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-process cache placed in front of the {@link DiskCache}.
 * 
 * <p>Characteristics:
 * <ul>
 *   <li>Same dual-timestamp expiry as the disk cache</li>
 *   <li>When full, inserting a new key evicts the entry with the oldest access time</li>
 *   <li>One lock guards the whole map; entries are few and large</li>
 * </ul>
 * 
 * @param <K> key type
 * @param <V> value type
 * @version 1.0.0
 */
@Slf4j
public class MemoryCache<K, V> {
    
    private final Map<K, CacheEntry<V>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxSize;
    private final long ttlSeconds;
    private final long ttlMillis;
    private final Clock clock;
    private final long startedAt;
    
    private long hits;
    private long misses;
    
    public MemoryCache(int maxSize, long ttlSeconds, Clock clock) {
        this.maxSize = Math.max(1, maxSize);
        this.ttlSeconds = ttlSeconds;
        this.ttlMillis = ttlSeconds < 0 ? -1L : ttlSeconds * 1000L;
        this.clock = clock;
        this.startedAt = clock.millis();
    }
    
    public Optional<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            long now = clock.millis();
            DualTimestampExpiry.Verdict verdict = entry.evaluate(now, ttlMillis);
            if (verdict.isAccessClockSkew()) {
                log.debug("Clock moved backwards for memory cache key {}; resetting access time", key);
            }
            if (verdict.isExpired()) {
                entries.remove(key);
                misses++;
                return Optional.empty();
            }
            entry.refresh(now);
            hits++;
            return Optional.ofNullable(entry.getValue());
        } finally {
            lock.unlock();
        }
    }
    
    public void set(K key, V value) {
        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<V> existing = entries.get(key);
            if (existing == null && entries.size() >= maxSize) {
                evictOldest();
            }
            CacheEntry<V> entry = CacheEntry.create(String.valueOf(key), PayloadKind.OBJECT, value, now);
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Slide the access time of {@code key} to now.
     * 
     * @return false if the key is absent
     */
    public boolean updateTimestamp(K key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            entry.refresh(clock.millis());
            return true;
        } finally {
            lock.unlock();
        }
    }
    
    public boolean invalidate(K key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * @return number of entries removed
     */
    public int removeExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now, ttlMillis)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Removed {} expired memory cache entries", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }
    
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }
    
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
    
    public MemoryCacheStatistics getStatistics() {
        lock.lock();
        try {
            long total = hits + misses;
            return MemoryCacheStatistics.builder()
                    .size(entries.size())
                    .maxSize(maxSize)
                    .ttlSeconds(ttlSeconds)
                    .hits(hits)
                    .misses(misses)
                    .hitRatio(total == 0 ? 0.0 : (double) hits / total)
                    .instanceId(InstanceIdentity.current())
                    .uptimeMillis(Math.max(0L, clock.millis() - startedAt))
                    .build();
        } finally {
            lock.unlock();
        }
    }
    
    private void evictOldest() {
        K oldestKey = null;
        long oldestAccess = Long.MAX_VALUE;
        for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getValue().getLastAccessTime() < oldestAccess) {
                oldestAccess = e.getValue().getLastAccessTime();
                oldestKey = e.getKey();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
            log.debug("Evicted memory cache entry {}", oldestKey);
        }
    }
}
