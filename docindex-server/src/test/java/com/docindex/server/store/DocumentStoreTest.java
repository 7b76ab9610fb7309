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
import com.docindex.core.exception.StoreNotReadyException;
import com.docindex.core.model.LoadSource;
import com.docindex.core.model.LoadStatus;
import com.docindex.server.cache.DiskCache;
import com.docindex.server.cache.MemoryCache;
import com.docindex.server.dto.CategoriesResponse;
import com.docindex.server.dto.OptionResponse;
import com.docindex.server.dto.PrefixResponse;
import com.docindex.server.dto.SearchResponse;
import com.docindex.server.dto.StoreStatisticsResponse;
import com.docindex.server.index.SearchIndex;
import com.docindex.server.index.SearchScoring;
import com.docindex.server.source.DocumentFetcher;
import com.docindex.server.source.DocumentSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStoreTest {
    
    private static final String DOCUMENT = "https://example.org/options.json";
    
    @TempDir
    Path tempDir;
    
    private DiskCache diskCache;
    private MemoryCache<String, IndexedDataset> memoryCache;
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger forcedFetches = new AtomicInteger();
    private final AtomicInteger invalidations = new AtomicInteger();
    private final AtomicBoolean failing = new AtomicBoolean(false);
    private final List<DocumentStore> stores = new ArrayList<>();
    
    private final DocumentFetcher fetcher = new DocumentFetcher() {
        @Override
        public String fetch(String documentId, boolean forceRefresh) {
            fetches.incrementAndGet();
            if (forceRefresh) {
                forcedFetches.incrementAndGet();
            }
            if (failing.get()) {
                throw SourceException.fetchFailed(documentId, "HTTP 503");
            }
            return "raw";
        }
        
        @Override
        public void invalidate(String documentId) {
            invalidations.incrementAndGet();
        }
    };
    
    @BeforeEach
    void setUp() {
        diskCache = StoreFixtures.diskCache(tempDir, Clock.systemUTC());
        memoryCache = new MemoryCache<>(4, 3600, Clock.systemUTC());
    }
    
    @AfterEach
    void tearDown() {
        stores.forEach(DocumentStore::shutdown);
    }
    
    @Test
    void firstLoadFetchesThenMemoryThenDisk() throws Exception {
        DocumentStore first = newStore(fetcher, memoryCache);
        assertEquals(LoadStatus.LOADED, first.loadInBackground().get(10, TimeUnit.SECONDS));
        assertEquals(LoadSource.FETCH, first.getStoreStatus().getLoadedFrom());
        assertEquals(1, fetches.get());
        
        DocumentStore second = newStore(fetcher, memoryCache);
        assertEquals(LoadStatus.LOADED, second.loadInBackground().get(10, TimeUnit.SECONDS));
        assertEquals(LoadSource.MEMORY, second.getStoreStatus().getLoadedFrom());
        
        DocumentStore third = newStore(fetcher, new MemoryCache<>(4, 3600, Clock.systemUTC()));
        assertEquals(LoadStatus.LOADED, third.loadInBackground().get(10, TimeUnit.SECONDS));
        assertEquals(LoadSource.DISK, third.getStoreStatus().getLoadedFrom());
        
        assertEquals(1, fetches.get());
        assertEquals(12, third.getStoreStatus().getOptions());
    }
    
    @Test
    void queriesWhileLoadingReportLoading() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        DocumentStore store = newStore((documentId, force) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "raw";
        }, memoryCache);
        
        CompletableFuture<LoadStatus> load = store.loadInBackground();
        SearchResponse pending = store.search("git", 10);
        
        assertTrue(store.isLoading());
        assertFalse(pending.isFound());
        assertTrue(pending.isLoading());
        assertNotNull(pending.getError());
        assertSame(load, store.loadInBackground());
        
        release.countDown();
        assertEquals(LoadStatus.LOADED, load.get(10, TimeUnit.SECONDS));
        
        SearchResponse ready = store.search("git", 10);
        assertTrue(ready.isFound());
        assertFalse(ready.isLoading());
        assertEquals("programs.git.enable", ready.getOptions().get(0).getOption().getName());
    }
    
    @Test
    void firstQueryStartsLoad() throws Exception {
        DocumentStore store = newStore(fetcher, memoryCache);
        
        CategoriesResponse response = store.listCategories();
        
        assertFalse(response.isFound());
        assertTrue(response.isLoading());
        store.ensureLoaded(false);
        assertTrue(store.listCategories().isFound());
    }
    
    @Test
    void failedLoadIsReportedAndRecoveredByRefresh() throws Exception {
        failing.set(true);
        DocumentStore store = newStore(fetcher, memoryCache);
        
        assertEquals(LoadStatus.ERROR, store.loadInBackground().get(10, TimeUnit.SECONDS));
        assertTrue(store.getError().orElseThrow().contains("HTTP 503"));
        
        OptionResponse response = store.getOption("programs.git.enable");
        assertFalse(response.isFound());
        assertFalse(response.isLoading());
        assertTrue(response.getError().contains("HTTP 503"));
        assertThrows(StoreNotReadyException.class, () -> store.ensureLoaded(false));
        
        failing.set(false);
        assertTrue(store.forceRefresh());
        assertEquals(LoadStatus.LOADED, store.getStatus());
        assertTrue(store.getError().isEmpty());
        assertTrue(store.getOption("programs.git.enable").isFound());
    }
    
    @Test
    void failedRefreshKeepsServingPreviousIndex() throws Exception {
        DocumentStore store = newStore(fetcher, memoryCache);
        store.ensureLoaded(false);
        
        failing.set(true);
        assertFalse(store.forceRefresh());
        
        assertEquals(LoadStatus.LOADED, store.getStatus());
        assertTrue(store.getError().orElseThrow().contains("HTTP 503"));
        assertTrue(store.getOption("programs.git.enable").isFound());
        assertTrue(store.search("git", 10).isFound());
        
        failing.set(false);
        assertTrue(store.forceRefresh());
        assertTrue(store.getError().isEmpty());
    }
    
    @Test
    void forceRefreshBypassesCaches() throws Exception {
        DocumentStore store = newStore(fetcher, memoryCache);
        store.ensureLoaded(false);
        
        assertTrue(store.forceRefresh());
        
        assertEquals(2, fetches.get());
        assertEquals(1, forcedFetches.get());
        assertEquals(1, invalidations.get());
        assertEquals(LoadSource.FETCH, store.getStoreStatus().getLoadedFrom());
    }
    
    @Test
    void emptyParseResultIsAnError() throws Exception {
        DocumentSource source = DocumentSource.builder()
                .name("empty")
                .document(DOCUMENT)
                .fetcher(fetcher)
                .parser((documentId, raw) -> List.of())
                .build();
        DocumentStore store = track(new DocumentStore(source, new SearchIndex(new SearchScoring()),
                new IndexCache("empty", memoryCache, diskCache, 10), memoryCache::getStatistics,
                Duration.ofSeconds(10), Duration.ofSeconds(1)));
        
        assertEquals(LoadStatus.ERROR, store.loadInBackground().get(10, TimeUnit.SECONDS));
    }
    
    @Test
    void optionLookupIncludesRelatedOptionsAndSuggestions() throws Exception {
        DocumentStore store = newStore(fetcher, memoryCache);
        store.ensureLoaded(false);
        
        OptionResponse found = store.getOption("programs.git.enable");
        assertTrue(found.isFound());
        assertEquals("boolean", found.getOption().getType());
        assertEquals(List.of("programs.git.package", "programs.git.userEmail", "programs.git.userName"),
                found.getRelatedOptions().stream().map(OptionResponse.RelatedOption::getName)
                        .collect(Collectors.toList()));
        
        OptionResponse missing = store.getOption("programs.git.enabled");
        assertFalse(missing.isFound());
        assertEquals(4, missing.getSuggestions().size());
        assertTrue(missing.getError().startsWith("Option not found"));
    }
    
    @Test
    void prefixListingSummarisesTypesAndEnableFlags() throws Exception {
        DocumentStore store = newStore(fetcher, memoryCache);
        store.ensureLoaded(false);
        
        PrefixResponse response = store.getOptionsByPrefix("programs.git");
        
        assertTrue(response.isFound());
        assertEquals(4, response.getCount());
        assertEquals(2, response.getTypes().get("string"));
        assertEquals(1, response.getEnableOptions().size());
        assertEquals("git", response.getEnableOptions().get(0).getParent());
        
        assertFalse(store.getOptionsByPrefix("nothing.here").isFound());
    }
    
    @Test
    void statisticsBreakDownOptions() throws Exception {
        DocumentStore store = newStore(fetcher, memoryCache);
        store.ensureLoaded(false);
        
        StoreStatisticsResponse stats = store.getStatistics();
        
        assertTrue(stats.isFound());
        assertEquals(12, stats.getTotalOptions());
        assertEquals(3, stats.getTotalCategories());
        assertEquals(4, stats.getByType().get("boolean"));
        assertEquals(12, stats.getBySource().get("Home Manager"));
        assertEquals(LoadStatus.LOADED, stats.getStatus());
        assertNotNull(stats.getMemoryCache());
    }
    
    @Test
    void listenersHearAboutCompletedLoads() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        DocumentStore store = newStore(fetcher, memoryCache);
        store.addLoadListener((name, from, options, millis) -> events.add(name + ":" + from + ":" + options));
        
        store.ensureLoaded(false);
        
        assertEquals(List.of("home-manager:FETCH:12"), events);
    }
    
    @Test
    void shutdownStopsFurtherLoads() {
        DocumentStore store = newStore(fetcher, memoryCache);
        store.shutdown();
        
        SearchResponse response = store.search("git", 5);
        
        assertFalse(response.isFound());
        assertFalse(response.isLoading());
        assertEquals(0, fetches.get());
    }
    
    private DocumentStore newStore(DocumentFetcher documentFetcher, MemoryCache<String, IndexedDataset> memory) {
        DocumentSource source = DocumentSource.builder()
                .name("home-manager")
                .label("Home Manager")
                .document(DOCUMENT)
                .fetcher(documentFetcher)
                .parser((documentId, raw) -> StoreFixtures.homeManagerOptions())
                .build();
        IndexCache indexCache = new IndexCache(source.getName(), memory, diskCache, 10);
        return track(new DocumentStore(source, new SearchIndex(new SearchScoring()), indexCache,
                memory::getStatistics, Duration.ofSeconds(10), Duration.ofSeconds(1)));
    }
    
    private DocumentStore track(DocumentStore store) {
        stores.add(store);
        return store;
    }
}
