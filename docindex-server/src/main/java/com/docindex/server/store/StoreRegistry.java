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

import com.docindex.core.exception.SourceException;
import com.docindex.server.cache.DiskCache;
import com.docindex.server.cache.MemoryCache;
import com.docindex.server.config.DocIndexProperties;
import com.docindex.server.index.SearchIndex;
import com.docindex.server.source.DocumentFetcher;
import com.docindex.server.source.DocumentSource;
import com.docindex.server.source.JsonOptionParser;
import com.docindex.server.state.ServerStatePersistence;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates one {@link DocumentStore} per configured documentation source and owns their
 * lifecycle.
 */
@Slf4j
@Component
public class StoreRegistry {
    
    private final Map<String, DocumentStore> stores = new LinkedHashMap<>();
    private final MemoryCache<String, IndexedDataset> memoryCache;
    private final DiskCache diskCache;
    private final int defaultSearchLimit;
    
    public StoreRegistry(DocIndexProperties properties, DocumentFetcher httpDocumentFetcher,
                         MemoryCache<String, IndexedDataset> indexMemoryCache, DiskCache diskCache,
                         ServerStatePersistence statePersistence) {
        this.memoryCache = indexMemoryCache;
        this.diskCache = diskCache;
        this.defaultSearchLimit = properties.getSearch().getDefaultLimit();
        
        for (Map.Entry<String, DocIndexProperties.Source> entry : properties.getSources().entrySet()) {
            String name = entry.getKey();
            DocIndexProperties.Source config = entry.getValue();
            if (!"json".equalsIgnoreCase(config.getFormat())) {
                log.warn("Skipping source {}: unsupported format '{}'", name, config.getFormat());
                continue;
            }
            String label = config.getLabel() != null ? config.getLabel() : name;
            DocumentSource source = DocumentSource.builder()
                    .name(name)
                    .label(label)
                    .documents(config.getDocuments())
                    .fetcher(httpDocumentFetcher)
                    .parser(new JsonOptionParser(label))
                    .build();
            register(createStore(source, properties), statePersistence);
        }
        log.info("Registered {} documentation stores: {}", stores.size(), stores.keySet());
    }
    
    private DocumentStore createStore(DocumentSource source, DocIndexProperties properties) {
        IndexCache indexCache = new IndexCache(source.getName(), memoryCache, diskCache, 
                properties.getCache().getMinViableDatasetSize());
        return new DocumentStore(source, new SearchIndex(properties.getSearch()), indexCache,
                memoryCache::getStatistics,
                Duration.ofSeconds(properties.getLoading().getWaitTimeoutSeconds()),
                Duration.ofSeconds(properties.getLoading().getShutdownWaitSeconds()));
    }
    
    void register(DocumentStore store, ServerStatePersistence statePersistence) {
        if (statePersistence != null) {
            store.addLoadListener(statePersistence);
        }
        stores.put(store.getName(), store);
    }
    
    public DocumentStore getStore(String name) {
        DocumentStore store = stores.get(name);
        if (store == null) {
            throw SourceException.notFound(name);
        }
        return store;
    }
    
    public Collection<DocumentStore> getStores() {
        return Collections.unmodifiableCollection(stores.values());
    }
    
    public List<String> getStoreNames() {
        return new ArrayList<>(stores.keySet());
    }
    
    public int getDefaultSearchLimit() {
        return defaultSearchLimit;
    }
    
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} documentation stores...", stores.size());
        for (DocumentStore store : stores.values()) {
            store.shutdown();
        }
    }
}
