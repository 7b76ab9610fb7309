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

import com.docindex.core.model.LoadSource;
import com.docindex.server.cache.AdvisoryFileLock;
import com.docindex.server.cache.AtomicFileWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ServerStatePersistenceTest {
    
    @TempDir
    Path tempDir;
    
    private final AtomicFileWriter writer = new AtomicFileWriter(new AdvisoryFileLock(), 2, 
            Duration.ofMillis(1), Duration.ofSeconds(1), Duration.ofMillis(5));
    
    @Test
    void countersSurviveRestart() {
        Path file = tempDir.resolve("server-state.json");
        ServerStatePersistence first = new ServerStatePersistence(file, writer);
        first.load();
        assertEquals(1L, first.increment(ServerStatePersistence.STARTS));
        assertTrue(first.save());
        
        ServerStatePersistence second = new ServerStatePersistence(file, writer);
        second.load();
        
        assertEquals(2L, second.increment(ServerStatePersistence.STARTS));
    }
    
    @Test
    void loadEventsAreRecorded() {
        Path file = tempDir.resolve("state/server-state.json");
        ServerStatePersistence state = new ServerStatePersistence(file, writer);
        
        state.onLoaded("home-manager", LoadSource.DISK, 12, 40);
        state.onLoaded("home-manager", LoadSource.MEMORY, 12, 1);
        
        assertTrue(Files.exists(file));
        assertEquals(2L, state.get("loads.home-manager"));
        assertEquals("MEMORY", state.get("lastSource.home-manager"));
        assertNotNull(state.get("lastLoad.home-manager"));
    }
    
    @Test
    void corruptFileIsIgnored() throws Exception {
        Path file = Files.writeString(tempDir.resolve("server-state.json"), "{ definitely not json");
        ServerStatePersistence state = new ServerStatePersistence(file, writer);
        
        state.load();
        
        assertTrue(state.snapshot().isEmpty());
    }
}
