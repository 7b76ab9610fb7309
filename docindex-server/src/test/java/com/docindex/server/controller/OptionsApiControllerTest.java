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

import com.docindex.core.exception.SourceException;
import com.docindex.core.model.LoadStatus;
import com.docindex.core.model.OptionRecord;
import com.docindex.server.cache.CacheStatistics;
import com.docindex.server.cache.DiskCache;
import com.docindex.server.dto.OptionResponse;
import com.docindex.server.dto.SearchResponse;
import com.docindex.server.dto.StoreStatus;
import com.docindex.server.index.SearchHit;
import com.docindex.server.store.DocumentStore;
import com.docindex.server.store.StoreRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class OptionsApiControllerTest {
    
    private StoreRegistry registry;
    private DiskCache diskCache;
    private DocumentStore store;
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        registry = mock(StoreRegistry.class);
        diskCache = mock(DiskCache.class);
        store = mock(DocumentStore.class);
        when(registry.getDefaultSearchLimit()).thenReturn(20);
        when(registry.getStore(anyString())).thenThrow(SourceException.notFound("unknown"));
        doReturn(store).when(registry).getStore("home-manager");
        
        mockMvc = MockMvcBuilders.standaloneSetup(new OptionsApiController(registry, diskCache))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }
    
    @Test
    void searchUsesDefaultLimit() throws Exception {
        SearchResponse response = new SearchResponse();
        response.setSource("home-manager");
        response.setQuery("git");
        response.setLimit(20);
        response.setFound(true);
        response.setCount(1);
        response.setOptions(List.of(new SearchHit(
                OptionRecord.builder().name("programs.git.enable").type("boolean").build(), 60)));
        when(store.search("git", 20)).thenReturn(response);
        
        mockMvc.perform(get("/api/v1/sources/home-manager/search").param("q", "git"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.options[0].option.name").value("programs.git.enable"))
                .andExpect(jsonPath("$.options[0].score").value(60));
    }
    
    @Test
    void loadingStoreStillAnswersOk() throws Exception {
        SearchResponse response = new SearchResponse();
        response.setLoading(true);
        response.setError("Home Manager data is still loading");
        when(store.search("git", 5)).thenReturn(response);
        
        mockMvc.perform(get("/api/v1/sources/home-manager/search").param("q", "git").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false))
                .andExpect(jsonPath("$.loading").value(true));
    }
    
    @Test
    void nonPositiveLimitIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/sources/home-manager/search").param("q", "git").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        verify(store, never()).search(anyString(), anyInt());
    }
    
    @Test
    void missingQueryIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/sources/home-manager/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
    
    @Test
    void unknownSourceIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/sources/nixpkgs/categories"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SOURCE_NOT_FOUND"));
    }
    
    @Test
    void dottedOptionNameIsKeptWhole() throws Exception {
        OptionResponse response = new OptionResponse();
        response.setName("programs.git.enable");
        response.setFound(true);
        when(store.getOption("programs.git.enable")).thenReturn(response);
        
        mockMvc.perform(get("/api/v1/sources/home-manager/options/programs.git.enable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("programs.git.enable"));
    }
    
    @Test
    void refreshReportsOutcome() throws Exception {
        when(store.forceRefresh()).thenReturn(false);
        when(store.getName()).thenReturn("home-manager");
        when(store.getStatus()).thenReturn(LoadStatus.ERROR);
        when(store.getError()).thenReturn(Optional.of("Failed to fetch"));
        
        mockMvc.perform(post("/api/v1/sources/home-manager/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.error").value("Failed to fetch"));
    }
    
    @Test
    void listsSources() throws Exception {
        when(registry.getStores()).thenReturn(List.of(store));
        when(store.getStoreStatus()).thenReturn(StoreStatus.builder()
                .name("home-manager").label("Home Manager").status(LoadStatus.LOADED).loaded(true).options(12).build());
        
        mockMvc.perform(get("/api/v1/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("home-manager"))
                .andExpect(jsonPath("$[0].options").value(12));
    }
    
    @Test
    void cacheEndpoints() throws Exception {
        when(diskCache.getStatistics()).thenReturn(CacheStatistics.builder().hits(3).misses(1).hitRatio(0.75).build());
        when(diskCache.invalidateAll()).thenReturn(6);
        
        mockMvc.perform(get("/api/v1/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits").value(3))
                .andExpect(jsonPath("$.hitRatio").value(0.75));
        mockMvc.perform(post("/api/v1/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(6));
    }
}
