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
package com.docindex.server.store;

import com.docindex.core.constants.DocIndexConstants;
import com.docindex.core.model.CacheResult;
import com.docindex.core.model.OptionRecord;
import com.docindex.core.model.StoreData;
import com.docindex.core.model.WriteResult;
import com.docindex.server.cache.DiskCache;
import com.docindex.server.cache.MemoryCache;
import com.docindex.server.index.IndexSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and writes one store's indexed dataset through the memory and disk caches.
 * 
 * <p>On disk the dataset is split in two payloads under the same logical key:
 * the options and counts as a record, the derived indices as a binary blob. Loaded data
 * is validated before use and invalid entries are removed. Datasets smaller than the
 * minimum viable size are never written anywhere.</p>
 */
@Slf4j
public class IndexCache {
    
    private final String storeName;
    private final String cacheKey;
    private final MemoryCache<String, IndexedDataset> memoryCache;
    private final DiskCache diskCache;
    private final int minViableDatasetSize;
    
    public IndexCache(String storeName, MemoryCache<String, IndexedDataset> memoryCache, 
                      DiskCache diskCache, int minViableDatasetSize) {
        this.storeName = storeName;
        this.cacheKey = storeName + DocIndexConstants.DATA_KEY_SUFFIX;
        this.memoryCache = memoryCache;
        this.diskCache = diskCache;
        this.minViableDatasetSize = minViableDatasetSize;
    }
    
    public Optional<IndexedDataset> loadFromMemory() {
        Optional<IndexedDataset> cached = memoryCache.get(cacheKey);
        cached.ifPresent(d -> log.info("Loaded {} options for {} from memory cache", 
                d.getData().getOptions().size(), storeName));
        return cached;
    }
    
    public Optional<IndexedDataset> loadFromDisk() {
        CacheResult<StoreData> data = diskCache.getRecord(cacheKey, StoreData.class);
        if (!data.isPresent()) {
            log.debug("No usable {} data on disk (expired={}, error={})", storeName, data.isExpired(), data.getError());
            return Optional.empty();
        }
        CacheResult<IndexSnapshot> binary = diskCache.getBinary(cacheKey, IndexSnapshot.class);
        if (!binary.isPresent()) {
            log.debug("No usable {} indices on disk (expired={}, error={})", storeName, binary.isExpired(), binary.getError());
            return Optional.empty();
        }
        
        if (!isValid(data.getValue(), binary.getValue())) {
            log.warn("Invalid {} data in disk cache; invalidating", storeName);
            diskCache.invalidateData(cacheKey);
            return Optional.empty();
        }
        
        IndexedDataset dataset = new IndexedDataset(data.getValue(), binary.getValue());
        memoryCache.set(cacheKey, dataset);
        log.info("Loaded {} options for {} from disk cache", data.getValue().getOptions().size(), storeName);
        return Optional.of(dataset);
    }
    
    /**
     * Store the dataset in both caches unless it is below the minimum viable size.
     */
    public WriteResult persist(Map<String, OptionRecord> options, IndexSnapshot snapshot, int categories) {
        if (options.size() < minViableDatasetSize) {
            log.warn("Not caching {} data: only {} options (minimum {})", 
                    storeName, options.size(), minViableDatasetSize);
            return WriteResult.rejected(cacheKey, "Dataset too small to cache: " + options.size() 
                    + " options, minimum " + minViableDatasetSize);
        }
        
        StoreData data = StoreData.builder()
                .options(new LinkedHashMap<>(options))
                .optionsCount(options.size())
                .categoriesCount(categories)
                .lastUpdated(Instant.now())
                .source(storeName)
                .build();
        memoryCache.set(cacheKey, new IndexedDataset(data, snapshot));
        
        WriteResult record = diskCache.setRecord(cacheKey, data);
        if (!record.isStored()) {
            log.warn("Failed to write {} data to disk cache: {}", storeName, record.getError());
            return record;
        }
        WriteResult binary = diskCache.setBinary(cacheKey, snapshot);
        if (!binary.isStored()) {
            log.warn("Failed to write {} indices to disk cache: {}", storeName, binary.getError());
            diskCache.invalidateData(cacheKey);
            return binary;
        }
        log.info("Cached {} options for {} (memory and disk)", options.size(), storeName);
        return record;
    }
    
    public void invalidate() {
        memoryCache.invalidate(cacheKey);
        diskCache.invalidateData(cacheKey);
        log.info("Invalidated cached {} data", storeName);
    }
    
    boolean isValid(StoreData data, IndexSnapshot snapshot) {
        if (data == null || data.getOptions() == null || snapshot == null) {
            return false;
        }
        int actual = data.getOptions().size();
        if (actual < minViableDatasetSize) {
            log.warn("Cached {} data has only {} options (minimum {})", storeName, actual, minViableDatasetSize);
            return false;
        }
        if (data.getOptionsCount() != actual) {
            log.warn("Cached {} option count {} does not match {} options; correcting", 
                    storeName, data.getOptionsCount(), actual);
            data.setOptionsCount(actual);
        }
        if (snapshot.getNameIndex().isEmpty() || snapshot.getWordIndex().isEmpty() 
                || snapshot.getPrefixIndex().isEmpty() || snapshot.getHierarchicalIndex() == null) {
            log.warn("Cached {} indices are incomplete", storeName);
            return false;
        }
        Set<String> dangling = snapshot.danglingNames(data.getOptions());
        if (!dangling.isEmpty()) {
            log.warn("Cached {} indices reference {} unknown options", storeName, dangling.size());
            return false;
        }
        return true;
    }
    
    public String getCacheKey() {
        return cacheKey;
    }
}
