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
package com.docindex.server.controller;

import com.docindex.core.exception.DocIndexException;
import com.docindex.server.cache.CacheStatistics;
import com.docindex.server.cache.DiskCache;
import com.docindex.server.dto.CategoriesResponse;
import com.docindex.server.dto.OptionResponse;
import com.docindex.server.dto.PrefixResponse;
import com.docindex.server.dto.SearchResponse;
import com.docindex.server.dto.StoreStatisticsResponse;
import com.docindex.server.dto.StoreStatus;
import com.docindex.server.store.DocumentStore;
import com.docindex.server.store.StoreRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for option lookups.
 * 
 * <p>Store queries always answer 200 with a structured body; {@code found=false} together
 * with {@code loading=true} tells the caller to retry once indexing finishes.</p>
 * 
 * @version 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class OptionsApiController {
    
    private final StoreRegistry storeRegistry;
    private final DiskCache diskCache;
    
    // ==================== Sources ====================
    
    @GetMapping("/sources")
    public ResponseEntity<List<StoreStatus>> listSources() {
        return ResponseEntity.ok(storeRegistry.getStores().stream()
                .map(DocumentStore::getStoreStatus)
                .collect(Collectors.toList()));
    }
    
    @GetMapping("/sources/{source}/search")
    public ResponseEntity<SearchResponse> search(
            @PathVariable String source,
            @RequestParam("q") String query,
            @RequestParam(required = false) Integer limit) {
        
        int effectiveLimit = limit != null ? limit : storeRegistry.getDefaultSearchLimit();
        if (effectiveLimit <= 0) {
            throw new DocIndexException(DocIndexException.ErrorCode.INVALID_ARGUMENT, 
                    "limit must be positive: " + effectiveLimit);
        }
        return ResponseEntity.ok(storeRegistry.getStore(source).search(query, effectiveLimit));
    }
    
    @GetMapping("/sources/{source}/options/{name:.+}")
    public ResponseEntity<OptionResponse> getOption(@PathVariable String source, @PathVariable String name) {
        return ResponseEntity.ok(storeRegistry.getStore(source).getOption(name));
    }
    
    @GetMapping("/sources/{source}/prefix/{prefix:.+}")
    public ResponseEntity<PrefixResponse> getOptionsByPrefix(@PathVariable String source, 
                                                             @PathVariable String prefix) {
        return ResponseEntity.ok(storeRegistry.getStore(source).getOptionsByPrefix(prefix));
    }
    
    @GetMapping("/sources/{source}/categories")
    public ResponseEntity<CategoriesResponse> listCategories(@PathVariable String source) {
        return ResponseEntity.ok(storeRegistry.getStore(source).listCategories());
    }
    
    @GetMapping("/sources/{source}/stats")
    public ResponseEntity<StoreStatisticsResponse> getStatistics(@PathVariable String source) {
        return ResponseEntity.ok(storeRegistry.getStore(source).getStatistics());
    }
    
    @PostMapping("/sources/{source}/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@PathVariable String source) {
        DocumentStore store = storeRegistry.getStore(source);
        boolean refreshed = store.forceRefresh();
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", refreshed);
        response.put("source", store.getName());
        response.put("status", store.getStatus());
        store.getError().ifPresent(error -> response.put("error", error));
        return ResponseEntity.ok(response);
    }
    
    // ==================== Disk Cache ====================
    
    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> getCacheStatistics() {
        return ResponseEntity.ok(diskCache.getStatistics());
    }
    
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int removed = diskCache.invalidateAll();
        log.info("Disk cache cleared via API: {} files removed", removed);
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("removed", removed);
        return ResponseEntity.ok(response);
    }
}
