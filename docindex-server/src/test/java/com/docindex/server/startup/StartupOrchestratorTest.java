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
package com.docindex.server.startup;

import com.docindex.core.model.LoadStatus;
import com.docindex.server.cache.AdvisoryFileLock;
import com.docindex.server.cache.AtomicFileWriter;
import com.docindex.server.config.DocIndexProperties;
import com.docindex.server.state.ServerStatePersistence;
import com.docindex.server.store.DocumentStore;
import com.docindex.server.store.StoreRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StartupOrchestratorTest {
    
    @TempDir
    Path tempDir;
    
    private StoreRegistry registry;
    private DocumentStore store;
    private ServerStatePersistence state;
    private DocIndexProperties properties;
    
    @BeforeEach
    void setUp() {
        registry = mock(StoreRegistry.class);
        store = mock(DocumentStore.class);
        when(registry.getStores()).thenReturn(List.of(store));
        when(store.getName()).thenReturn("home-manager");
        when(store.getError()).thenReturn(Optional.empty());
        state = new ServerStatePersistence(tempDir.resolve("server-state.json"), 
                new AtomicFileWriter(new AdvisoryFileLock(), 1, Duration.ofMillis(1), 
                        Duration.ofSeconds(1), Duration.ofMillis(5)));
        properties = new DocIndexProperties();
    }
    
    @Test
    void eagerStartupWaitsForStores() {
        when(store.loadInBackground()).thenReturn(CompletableFuture.completedFuture(LoadStatus.LOADED));
        when(store.isLoaded()).thenReturn(true);
        when(store.getStatus()).thenReturn(LoadStatus.LOADED);
        StartupOrchestrator orchestrator = new StartupOrchestrator(registry, state, properties);
        
        assertTrue(orchestrator.runStartupSequence());
        
        assertTrue(orchestrator.isStartupComplete());
        assertEquals(1L, state.get(ServerStatePersistence.STARTS));
    }
    
    @Test
    void slowStoresKeepLoadingInBackground() {
        properties.getLoading().setEagerTimeoutSeconds(0);
        when(store.loadInBackground()).thenReturn(new CompletableFuture<>());
        when(store.getStatus()).thenReturn(LoadStatus.LOADING);
        StartupOrchestrator orchestrator = new StartupOrchestrator(registry, state, properties);
        
        assertFalse(orchestrator.runStartupSequence());
        
        assertTrue(orchestrator.isStartupComplete());
        verify(store).loadInBackground();
    }
    
    @Test
    void lazyModeDoesNotLoad() {
        properties.getLoading().setEager(false);
        StartupOrchestrator orchestrator = new StartupOrchestrator(registry, state, properties);
        
        assertFalse(orchestrator.runStartupSequence());
        
        verify(store, never()).loadInBackground();
        assertEquals(1L, state.get(ServerStatePersistence.STARTS));
    }
}
