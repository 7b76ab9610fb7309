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
import com.docindex.core.exception.DocIndexException;
import com.docindex.core.exception.IndexNotBuiltException;
import com.docindex.core.exception.SourceException;
import com.docindex.core.exception.StoreNotReadyException;
import com.docindex.core.model.LoadSource;
import com.docindex.core.model.LoadStatus;
import com.docindex.core.model.OptionRecord;
import com.docindex.server.cache.MemoryCacheStatistics;
import com.docindex.server.dto.CategoriesResponse;
import com.docindex.server.dto.OptionResponse;
import com.docindex.server.dto.PrefixResponse;
import com.docindex.server.dto.SearchResponse;
import com.docindex.server.dto.StoreResponse;
import com.docindex.server.dto.StoreStatisticsResponse;
import com.docindex.server.dto.StoreStatus;
import com.docindex.server.index.SearchIndex;
import com.docindex.server.index.SearchResult;
import com.docindex.server.source.DocumentSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the search index of one documentation source and drives its loading.
 * 
 * <h3>Load state machine</h3>
 * <pre>
 *   NOT_STARTED -&gt; LOADING -&gt; LOADED | ERROR
 *   ERROR -&gt; LOADING            (explicit refresh only)
 *   LOADED -&gt; LOADING -&gt; LOADED (refresh; a failed refresh keeps the previous index)
 * </pre>
 * 
 * <h3>Load order</h3>
 * <ol>
 *   <li>memory cache</li>
 *   <li>disk cache (validated, invalidated if unusable)</li>
 *   <li>fetch and parse every document, build the index, persist it</li>
 * </ol>
 * A refresh invalidates both caches and the raw document cache first.
 * 
 * <p>Loads run on a dedicated worker thread. At most one load is in flight; callers
 * either wait for it with a bounded timeout ({@link #ensureLoaded(boolean)}) or get a
 * "still loading" response from the query methods. Cancellation is cooperative and
 * checked between fetch, parse and build.</p>
 * 
 * @version 1.0.0
 */
@Slf4j
public class DocumentStore {
    
    private final DocumentSource source;
    private final SearchIndex index;
    private final IndexCache indexCache;
    private final Supplier<MemoryCacheStatistics> memoryStatistics;
    private final Duration waitTimeout;
    private final Duration shutdownWait;
    private final ExecutorService loader;
    private final ReentrantLock loadLock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<LoadListener> listeners = new CopyOnWriteArrayList<>();
    
    private volatile LoadStatus status = LoadStatus.NOT_STARTED;
    private volatile String lastError;
    private volatile LoadSource loadedFrom;
    private volatile Instant lastLoadedAt;
    private volatile Long lastLoadMillis;
    
    // Guarded by loadLock
    private CompletableFuture<LoadStatus> inFlight;
    
    public DocumentStore(DocumentSource source, SearchIndex index, IndexCache indexCache,
                         Supplier<MemoryCacheStatistics> memoryStatistics,
                         Duration waitTimeout, Duration shutdownWait) {
        this.source = source;
        this.index = index;
        this.indexCache = indexCache;
        this.memoryStatistics = memoryStatistics;
        this.waitTimeout = waitTimeout;
        this.shutdownWait = shutdownWait;
        this.loader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "docindex-loader-" + source.getName());
            t.setDaemon(true);
            return t;
        });
    }
    
    // ==================== Loading ====================
    
    /**
     * Start loading without waiting. Returns the in-flight load if one is running.
     */
    public CompletableFuture<LoadStatus> loadInBackground() {
        return startLoad(false);
    }
    
    /**
     * Block until the store is loaded, waiting at most the configured timeout for an
     * in-flight load.
     * 
     * @param forceRefresh discard cached data and fetch again
     * @throws StoreNotReadyException if the load failed or did not finish in time
     */
    public void ensureLoaded(boolean forceRefresh) {
        if (status == LoadStatus.LOADED && !forceRefresh) {
            return;
        }
        if (status == LoadStatus.ERROR && !forceRefresh) {
            throw StoreNotReadyException.failed(source.getDisplayName(), lastError);
        }
        
        CompletableFuture<LoadStatus> load = startLoad(forceRefresh);
        try {
            LoadStatus result = load.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result != LoadStatus.LOADED) {
                throw result == LoadStatus.ERROR
                        ? StoreNotReadyException.failed(source.getDisplayName(), lastError)
                        : StoreNotReadyException.notLoaded(source.getDisplayName());
            }
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for {} to load", source.getName());
            throw StoreNotReadyException.timedOut(source.getDisplayName(), waitTimeout.getSeconds());
        } catch (ExecutionException e) {
            throw new StoreNotReadyException("Failed to load " + source.getDisplayName() + " data: " 
                    + e.getCause().getMessage(), false, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreNotReadyException("Interrupted while waiting for " 
                    + source.getDisplayName() + " data", true, e);
        }
    }
    
    /**
     * Invalidate all cached data and reload.
     * 
     * @return true if the reload succeeded
     */
    public boolean forceRefresh() {
        log.info("Forcing refresh of {}", source.getName());
        try {
            ensureLoaded(true);
            return true;
        } catch (StoreNotReadyException e) {
            log.error("Refresh of {} failed: {}", source.getName(), e.getMessage());
            return false;
        }
    }
    
    private CompletableFuture<LoadStatus> startLoad(boolean forceRefresh) {
        loadLock.lock();
        try {
            if (inFlight != null && !inFlight.isDone()) {
                if (forceRefresh) {
                    log.info("Refresh of {} requested while loading; joining the in-flight load", source.getName());
                }
                return inFlight;
            }
            if (!forceRefresh && (status == LoadStatus.LOADED || status == LoadStatus.ERROR)) {
                return CompletableFuture.completedFuture(status);
            }
            if (cancelled.get()) {
                return CompletableFuture.completedFuture(status);
            }
            
            LoadStatus previous = status;
            status = LoadStatus.LOADING;
            try {
                inFlight = CompletableFuture.supplyAsync(() -> runLoad(forceRefresh), loader);
            } catch (RejectedExecutionException e) {
                status = previous;
                log.warn("Cannot load {}: loader is shut down", source.getName());
                return CompletableFuture.completedFuture(previous);
            }
            return inFlight;
        } finally {
            loadLock.unlock();
        }
    }
    
    private LoadStatus runLoad(boolean forceRefresh) {
        long start = System.currentTimeMillis();
        try {
            LoadSource from = load(forceRefresh);
            if (from == null) {
                log.info("Load of {} cancelled", source.getName());
                status = index.isBuilt() ? LoadStatus.LOADED : LoadStatus.NOT_STARTED;
                return status;
            }
            long duration = System.currentTimeMillis() - start;
            lastError = null;
            loadedFrom = from;
            lastLoadedAt = Instant.now();
            lastLoadMillis = duration;
            status = LoadStatus.LOADED;
            log.info("Loaded {} options for {} from {} in {} ms", index.size(), source.getName(), from, duration);
            notifyListeners(from, duration);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            if (forceRefresh && index.isBuilt()) {
                status = LoadStatus.LOADED;
                log.error("Refresh of {} failed, still serving the previous index: {}", 
                        source.getName(), e.getMessage(), e);
                return LoadStatus.ERROR;
            }
            status = LoadStatus.ERROR;
            log.error("Failed to load {} data: {}", source.getName(), e.getMessage(), e);
        }
        return status;
    }
    
    /**
     * @return where the data came from, or {@code null} if cancelled
     */
    private LoadSource load(boolean forceRefresh) {
        if (forceRefresh) {
            indexCache.invalidate();
            source.getDocuments().forEach(source.getFetcher()::invalidate);
        } else {
            Optional<IndexedDataset> memory = indexCache.loadFromMemory();
            if (memory.isPresent() && adopt(memory.get())) {
                return LoadSource.MEMORY;
            }
            Optional<IndexedDataset> disk = indexCache.loadFromDisk();
            if (disk.isPresent() && adopt(disk.get())) {
                return LoadSource.DISK;
            }
        }
        
        List<OptionRecord> records = new ArrayList<>();
        for (String document : source.getDocuments()) {
            if (cancelled.get()) {
                return null;
            }
            String raw = source.getFetcher().fetch(document, forceRefresh);
            if (cancelled.get()) {
                return null;
            }
            List<OptionRecord> parsed = source.getParser().parse(document, raw);
            log.info("Parsed {} options from {}", parsed.size(), document);
            records.addAll(parsed);
        }
        if (records.isEmpty()) {
            throw new SourceException(DocIndexException.ErrorCode.PARSE_FAILED, 
                    "No options found in " + source.getDocuments());
        }
        if (cancelled.get()) {
            return null;
        }
        
        index.build(records);
        indexCache.persist(index.getOptions(), index.getSnapshot(), index.getCategoryCounts().size());
        return LoadSource.FETCH;
    }
    
    private boolean adopt(IndexedDataset dataset) {
        try {
            index.adopt(dataset.getData().getOptions(), dataset.getSnapshot());
            return true;
        } catch (DocIndexException e) {
            log.warn("Discarding cached {} data: {}", source.getName(), e.getMessage());
            indexCache.invalidate();
            return false;
        }
    }
    
    // ==================== Queries ====================
    
    public SearchResponse search(String query, int limit) {
        SearchResponse response = new SearchResponse();
        response.setSource(source.getName());
        response.setQuery(query);
        response.setLimit(limit);
        if (!checkReady(response, "search options")) {
            return response;
        }
        try {
            SearchResult result = index.search(query, limit);
            response.setOptions(result.getHits());
            response.setCount(result.getTotalMatches());
            response.setFound(true);
        } catch (IndexNotBuiltException e) {
            response.markNotReady(StoreNotReadyException.notLoaded(source.getDisplayName()));
        }
        return response;
    }
    
    public OptionResponse getOption(String name) {
        OptionResponse response = new OptionResponse();
        response.setSource(source.getName());
        response.setName(name);
        if (!checkReady(response, "get option")) {
            return response;
        }
        
        Optional<OptionRecord> option = index.get(name);
        if (option.isPresent()) {
            response.setOption(option.get());
            response.setFound(true);
            String parent = OptionRecord.parentOf(name);
            if (parent != null) {
                List<OptionResponse.RelatedOption> related = new ArrayList<>();
                for (String sibling : index.namesBelow(parent)) {
                    if (related.size() >= DocIndexConstants.MAX_RELATED_OPTIONS) {
                        break;
                    }
                    if (!sibling.equals(name) && sibling.startsWith(parent + ".")) {
                        index.get(sibling).ifPresent(r -> related.add(
                                new OptionResponse.RelatedOption(r.getName(), r.getType(), r.getDescription())));
                    }
                }
                if (!related.isEmpty()) {
                    response.setRelatedOptions(related);
                }
            }
            return response;
        }
        
        List<String> suggestions = index.namesBelow(name);
        if (suggestions.isEmpty()) {
            String parent = OptionRecord.parentOf(name);
            if (parent != null) {
                suggestions = index.namesBelow(parent);
            }
        }
        String error = "Option not found";
        if (!suggestions.isEmpty()) {
            suggestions = suggestions.subList(0, Math.min(DocIndexConstants.MAX_SUGGESTIONS, suggestions.size()));
            response.setSuggestions(suggestions);
            error += ". Did you mean one of: " + String.join(", ", suggestions) + "?";
        }
        response.setError(error);
        return response;
    }
    
    public PrefixResponse getOptionsByPrefix(String prefix) {
        PrefixResponse response = new PrefixResponse();
        response.setSource(source.getName());
        response.setPrefix(prefix);
        if (!checkReady(response, "get options by prefix")) {
            return response;
        }
        
        List<OptionRecord> options = index.optionsUnder(prefix);
        if (options.isEmpty()) {
            response.setError("No options found with prefix '" + prefix + "'");
            return response;
        }
        Map<String, Integer> types = new TreeMap<>();
        List<PrefixResponse.EnableOption> enableOptions = new ArrayList<>();
        for (OptionRecord option : options) {
            types.merge(option.getType() != null ? option.getType() : "unknown", 1, Integer::sum);
            if (option.isEnableFlag()) {
                enableOptions.add(new PrefixResponse.EnableOption(
                        option.getName(), option.getOwnerSegment(), option.getDescription()));
            }
        }
        response.setOptions(options);
        response.setCount(options.size());
        response.setTypes(types);
        response.setEnableOptions(enableOptions);
        response.setFound(true);
        return response;
    }
    
    public CategoriesResponse listCategories() {
        CategoriesResponse response = new CategoriesResponse();
        response.setSource(source.getName());
        if (!checkReady(response, "list categories")) {
            return response;
        }
        Map<String, Integer> categories = index.getCategoryCounts();
        response.setCategories(categories);
        response.setCount(categories.size());
        response.setFound(true);
        return response;
    }
    
    public StoreStatisticsResponse getStatistics() {
        StoreStatisticsResponse response = new StoreStatisticsResponse();
        response.setSource(source.getName());
        response.setStatus(status);
        response.setLoadedFrom(loadedFrom);
        response.setLastLoadedAt(lastLoadedAt);
        response.setLastLoadMillis(lastLoadMillis);
        response.setIndexStats(index.getStatistics());
        response.setMemoryCache(memoryStatistics.get());
        if (!checkReady(response, "get statistics")) {
            return response;
        }
        
        Map<String, Integer> bySource = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        for (OptionRecord option : index.getOptions().values()) {
            bySource.merge(option.getSource() != null ? option.getSource() : "unknown", 1, Integer::sum);
            byType.merge(option.getType() != null ? option.getType() : "unknown", 1, Integer::sum);
        }
        Map<String, Integer> byCategory = index.getCategoryCounts();
        response.setTotalOptions(index.size());
        response.setTotalCategories(byCategory.size());
        response.setTotalTypes(byType.size());
        response.setBySource(bySource);
        response.setByType(byType);
        response.setByCategory(byCategory);
        response.setFound(true);
        return response;
    }
    
    public StoreStatus getStoreStatus() {
        return StoreStatus.builder()
                .name(source.getName())
                .label(source.getDisplayName())
                .status(status)
                .loading(isLoading())
                .loaded(isLoaded())
                .error(lastError)
                .options(index.size())
                .loadedFrom(loadedFrom)
                .lastLoadedAt(lastLoadedAt)
                .build();
    }
    
    // ==================== Status ====================
    
    public boolean isLoading() {
        return status == LoadStatus.LOADING;
    }
    
    public boolean isLoaded() {
        return status == LoadStatus.LOADED;
    }
    
    public Optional<String> getError() {
        return Optional.ofNullable(lastError);
    }
    
    public LoadStatus getStatus() {
        return status;
    }
    
    public String getName() {
        return source.getName();
    }
    
    public void addLoadListener(LoadListener listener) {
        listeners.add(listener);
    }
    
    /**
     * Cancel any in-flight load and stop the loader, waiting briefly for it to finish.
     */
    public void shutdown() {
        cancelled.set(true);
        loader.shutdown();
        try {
            if (!loader.awaitTermination(shutdownWait.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> pending = loader.shutdownNow();
                log.warn("Loader for {} did not stop in {}s; abandoned {} pending tasks", 
                        source.getName(), shutdownWait.getSeconds(), pending.size());
            }
        } catch (InterruptedException e) {
            loader.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Store {} shut down", source.getName());
    }
    
    // ==================== Helper Methods ====================
    
    private boolean checkReady(StoreResponse response, String operation) {
        if (status == LoadStatus.LOADED && index.isBuilt()) {
            return true;
        }
        StoreNotReadyException reason;
        switch (status) {
            case LOADING:
                reason = StoreNotReadyException.loading(source.getDisplayName());
                break;
            case ERROR:
                reason = StoreNotReadyException.failed(source.getDisplayName(), lastError);
                break;
            case NOT_STARTED:
                if (cancelled.get()) {
                    reason = StoreNotReadyException.notLoaded(source.getDisplayName());
                } else {
                    loadInBackground();
                    reason = StoreNotReadyException.loading(source.getDisplayName());
                }
                break;
            default:
                reason = StoreNotReadyException.notLoaded(source.getDisplayName());
        }
        log.warn("Cannot {} on {}: {}", operation, source.getName(), reason.getMessage());
        response.markNotReady(reason);
        return false;
    }
    
    private void notifyListeners(LoadSource from, long duration) {
        for (LoadListener listener : listeners) {
            try {
                listener.onLoaded(source.getName(), from, index.size(), duration);
            } catch (RuntimeException e) {
                log.warn("Load listener failed for {}: {}", source.getName(), e.getMessage());
            }
        }
    }
}
