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
package com.docindex.server.state;

import com.docindex.core.exception.DocIndexException;
import com.docindex.core.model.LoadSource;
import com.docindex.core.util.JsonUtils;
import com.docindex.server.cache.AtomicFileWriter;
import com.docindex.server.store.LoadListener;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Small JSON state file that survives restarts: start counts, per-store load counts
 * and the time of each store's last successful load.
 * 
 * <p>Writes go through {@link AtomicFileWriter}; an unreadable file is replaced by an
 * empty state on the next save.</p>
 */
@Slf4j
public class ServerStatePersistence implements LoadListener {
    
    public static final String STARTS = "server.starts";
    public static final String LOADS_PREFIX = "loads.";
    public static final String LAST_LOAD_PREFIX = "lastLoad.";
    public static final String LAST_SOURCE_PREFIX = "lastSource.";
    
    private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE = new TypeReference<>() {};
    
    private final Path stateFile;
    private final AtomicFileWriter writer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Object> state = new LinkedHashMap<>();
    
    public ServerStatePersistence(Path stateFile, AtomicFileWriter writer) {
        this.stateFile = stateFile;
        this.writer = writer;
    }
    
    /**
     * Replace the in-memory state with the file's contents.
     */
    public void load() {
        lock.lock();
        try {
            state.clear();
            if (!Files.exists(stateFile)) {
                log.debug("No state file at {}", stateFile);
                return;
            }
            String json = Files.readString(stateFile, StandardCharsets.UTF_8);
            if (!json.isBlank()) {
                state.putAll(JsonUtils.fromJson(json, STATE_TYPE));
            }
            log.info("Loaded {} state entries from {}", state.size(), stateFile);
        } catch (IOException | DocIndexException e) {
            log.warn("Ignoring unreadable state file {}: {}", stateFile, e.getMessage());
        } finally {
            lock.unlock();
        }
    }
    
    public boolean save() {
        byte[] bytes;
        lock.lock();
        try {
            bytes = JsonUtils.toPrettyJson(state).getBytes(StandardCharsets.UTF_8);
        } finally {
            lock.unlock();
        }
        boolean saved = writer.write(stateFile, bytes);
        if (!saved) {
            log.warn("Failed to save state file {}", stateFile);
        }
        return saved;
    }
    
    public long increment(String counter) {
        lock.lock();
        try {
            Object current = state.get(counter);
            long next = (current instanceof Number ? ((Number) current).longValue() : 0L) + 1;
            state.put(counter, next);
            return next;
        } finally {
            lock.unlock();
        }
    }
    
    public void set(String key, Object value) {
        lock.lock();
        try {
            state.put(key, value);
        } finally {
            lock.unlock();
        }
    }
    
    public Object get(String key) {
        lock.lock();
        try {
            return state.get(key);
        } finally {
            lock.unlock();
        }
    }
    
    public Map<String, Object> snapshot() {
        lock.lock();
        try {
            return new LinkedHashMap<>(state);
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void onLoaded(String store, LoadSource source, int options, long durationMillis) {
        increment(LOADS_PREFIX + store);
        set(LAST_LOAD_PREFIX + store, Instant.now().toString());
        set(LAST_SOURCE_PREFIX + store, source.name());
        save();
    }
    
    public Path getStateFile() {
        return stateFile;
    }
}
