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
import com.docindex.server.config.DocIndexProperties;
import com.docindex.server.state.ServerStatePersistence;
import com.docindex.server.store.DocumentStore;
import com.docindex.server.store.StoreRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates the startup sequence.
 * 
 * <p>Startup Sequence:
 * <ol>
 *   <li>Spring context fully loads (ApplicationReadyEvent)</li>
 *   <li>Record the start in the server state file</li>
 *   <li>Start a background load of every store (when eager loading is enabled)</li>
 *   <li>Wait up to the eager timeout, then leave unfinished loads running</li>
 * </ol>
 * 
 * <p>Queries arriving before a store finishes loading get a "still loading" response.
 * 
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StartupOrchestrator {
    
    private final StoreRegistry storeRegistry;
    private final ServerStatePersistence statePersistence;
    private final DocIndexProperties properties;
    
    private final AtomicBoolean startupComplete = new AtomicBoolean(false);
    
    /**
     * Listen for ApplicationReadyEvent and orchestrate startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void onApplicationReady(ApplicationReadyEvent event) {
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Spring context ready - starting initialization sequence...        ║");
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        
        // Run initialization in a separate thread to not block the event
        Thread initThread = new Thread(this::runStartupSequence, "docindex-startup-orchestrator");
        initThread.setDaemon(true);
        initThread.start();
    }
    
    /**
     * Execute the startup sequence.
     * 
     * @return true if every store finished loading within the eager timeout
     */
    boolean runStartupSequence() {
        long starts = statePersistence.increment(ServerStatePersistence.STARTS);
        statePersistence.save();
        log.info("Server start #{}", starts);
        
        if (!properties.getLoading().isEager()) {
            log.info("Eager loading disabled; stores load on first use");
            startupComplete.set(true);
            return false;
        }
        
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase 1: Documentation Store Loading                              ║");
        log.info("║           Loading indices from cache or source...                  ║");
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        
        long start = System.currentTimeMillis();
        List<CompletableFuture<LoadStatus>> loads = new ArrayList<>();
        for (DocumentStore store : storeRegistry.getStores()) {
            loads.add(store.loadInBackground());
        }
        
        long timeout = properties.getLoading().getEagerTimeoutSeconds();
        boolean allLoaded;
        try {
            CompletableFuture.allOf(loads.toArray(new CompletableFuture[0])).get(timeout, TimeUnit.SECONDS);
            allLoaded = storeRegistry.getStores().stream().allMatch(DocumentStore::isLoaded);
        } catch (TimeoutException e) {
            log.warn("Stores not loaded within {}s; continuing to load in the background", timeout);
            allLoaded = false;
        } catch (ExecutionException e) {
            log.error("Store loading failed: {}", e.getCause().getMessage());
            allLoaded = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Startup interrupted while waiting for stores");
            allLoaded = false;
        }
        
        for (DocumentStore store : storeRegistry.getStores()) {
            log.info("  - {}: {}{}", store.getName(), store.getStatus(), 
                    store.getError().map(err -> " (" + err + ")").orElse(""));
        }
        
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  DocIndex ready                                                    ║");
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("Startup phase completed in {} ms", System.currentTimeMillis() - start);
        startupComplete.set(true);
        return allLoaded;
    }
    
    public boolean isStartupComplete() {
        return startupComplete.get();
    }
}
