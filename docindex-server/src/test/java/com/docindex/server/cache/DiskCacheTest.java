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
package com.docindex.server.cache;

import com.docindex.core.model.CacheResult;
import com.docindex.core.model.OptionRecord;
import com.docindex.core.model.PayloadKind;
import com.docindex.core.model.WriteResult;
import com.docindex.server.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DiskCacheTest {
    
    private static final long TTL_SECONDS = 3600;
    
    @TempDir
    Path tempDir;
    
    private MutableClock clock;
    private AdvisoryFileLock fileLock;
    private DiskCache cache;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        fileLock = new AdvisoryFileLock(Duration.ofMillis(20));
        CacheDirectory directory = CacheDirectory.builder()
                .path(tempDir)
                .ttlSeconds(TTL_SECONDS)
                .initialized(true)
                .build();
        AtomicFileWriter writer = new AtomicFileWriter(fileLock, 3, Duration.ofMillis(1), 
                Duration.ofSeconds(2), Duration.ofMillis(5));
        cache = new DiskCache(directory, writer, fileLock, Duration.ofMillis(100), Duration.ofMillis(5), clock);
    }
    
    @Test
    void missThenHitCountsEachOnce() {
        assertFalse(cache.getText("https://example.org/doc").isHit());
        
        WriteResult written = cache.setText("https://example.org/doc", "<html>doc</html>");
        CacheResult<String> result = cache.getText("https://example.org/doc");
        
        assertTrue(written.isStored());
        assertTrue(result.isHit());
        assertEquals("<html>doc</html>", result.getValue());
        assertEquals(clock.millis(), result.getCreationTimestamp());
        
        CacheStatistics stats = cache.getStatistics();
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getWrites());
        assertEquals(0, stats.getDataWrites());
        assertEquals(1, stats.getTextFiles());
        assertEquals(0.5, stats.getHitRatio(), 1e-9);
    }
    
    @Test
    void fileNamesAreDerivedFromKeyAndKind() {
        cache.setText("key", "text");
        cache.setRecord("key", new HashMap<>());
        
        Path text = cache.pathFor("key", PayloadKind.TEXT);
        Path record = cache.pathFor("key", PayloadKind.RECORD);
        
        assertNotEquals(text, record);
        assertTrue(text.getFileName().toString().endsWith(".html"));
        assertTrue(record.getFileName().toString().endsWith(".data.json"));
        assertTrue(Files.exists(text.resolveSibling(text.getFileName() + ".meta")));
        assertTrue(Files.exists(record.resolveSibling(record.getFileName() + ".meta")));
    }
    
    @Test
    void entryExpiresOnceBothTimestampsAreOlderThanTtl() {
        cache.setText("doc", "content");
        
        clock.advance(Duration.ofSeconds(TTL_SECONDS - 10));
        assertTrue(cache.getText("doc").isHit());
        
        clock.advance(Duration.ofSeconds(TTL_SECONDS + 10));
        CacheResult<String> result = cache.getText("doc");
        assertFalse(result.isHit());
        assertTrue(result.isExpired());
    }
    
    @Test
    void recentAccessKeepsOldEntryAlive() throws Exception {
        cache.setText("doc", "content");
        clock.advance(Duration.ofSeconds(2 * TTL_SECONDS));
        // Another process read the entry a moment ago
        Files.setLastModifiedTime(cache.pathFor("doc", PayloadKind.TEXT), FileTime.fromMillis(clock.millis() - 1000));
        
        assertTrue(cache.getText("doc").isHit());
    }
    
    @Test
    void backwardClockJumpIsNotExpiry() throws Exception {
        cache.setText("doc", "content");
        
        clock.rewind(Duration.ofDays(30));
        CacheResult<String> result = cache.getText("doc");
        
        assertTrue(result.isHit());
        Path payload = cache.pathFor("doc", PayloadKind.TEXT);
        assertEquals(clock.millis(), Files.getLastModifiedTime(payload).toMillis());
        
        // Creation time was reset to the rewound clock, so the entry ages normally from here
        clock.advance(Duration.ofSeconds(TTL_SECONDS + 1));
        assertFalse(cache.getText("doc").isHit());
    }
    
    @Test
    void missingSidecarFallsBackToAccessTime() throws Exception {
        cache.setText("doc", "content");
        Path payload = cache.pathFor("doc", PayloadKind.TEXT);
        Files.delete(payload.resolveSibling(payload.getFileName() + ".meta"));
        
        assertTrue(cache.getText("doc").isHit());
        
        clock.advance(Duration.ofSeconds(TTL_SECONDS + 1));
        assertTrue(cache.getText("doc").isExpired());
    }
    
    @Test
    void negativeTtlNeverExpires() {
        CacheDirectory directory = CacheDirectory.builder().path(tempDir).ttlSeconds(-1).initialized(true).build();
        DiskCache forever = new DiskCache(directory, 
                new AtomicFileWriter(fileLock, 1, Duration.ofMillis(1), Duration.ofSeconds(1), Duration.ofMillis(5)),
                fileLock, Duration.ofMillis(100), Duration.ofMillis(5), clock);
        forever.setText("doc", "content");
        
        clock.advance(Duration.ofDays(3650));
        
        assertTrue(forever.getText("doc").isHit());
    }
    
    @Test
    void recordAndBinaryPayloadsCountAsData() {
        OptionRecord option = OptionRecord.builder().name("programs.git.enable").type("boolean").build();
        
        cache.setRecord("store_data", option);
        cache.setBinary("store_data", option);
        
        assertEquals(option, cache.getRecord("store_data", OptionRecord.class).getValue());
        assertEquals(option, cache.getBinary("store_data", OptionRecord.class).getValue());
        
        CacheStatistics stats = cache.getStatistics();
        assertEquals(2, stats.getDataHits());
        assertEquals(2, stats.getDataWrites());
        assertEquals(1, stats.getRecordFiles());
        assertEquals(1, stats.getBinaryFiles());
        assertEquals(1.0, stats.getDataHitRatio(), 1e-9);
    }
    
    @Test
    void malformedPayloadIsDiscarded() throws Exception {
        Path record = cache.pathFor("broken", PayloadKind.RECORD);
        Files.writeString(record, "{not json");
        
        CacheResult<OptionRecord> result = cache.getRecord("broken", OptionRecord.class);
        
        assertFalse(result.isHit());
        assertNotNull(result.getError());
        assertFalse(Files.exists(record));
        assertEquals(1, cache.getStatistics().getErrors());
    }
    
    @Test
    void binaryPayloadWithForeignClassIsRejected() {
        cache.setBinary("foreign", new java.net.InetSocketAddress(80).getAddress());
        
        CacheResult<java.net.InetAddress> result = cache.getBinary("foreign", java.net.InetAddress.class);
        
        assertFalse(result.isHit());
        assertNotNull(result.getError());
    }
    
    @Test
    void lockedPayloadReportsLockError() throws Exception {
        cache.setText("doc", "content");
        Path payload = cache.pathFor("doc", PayloadKind.TEXT);
        
        try (FileChannel channel = FileChannel.open(payload, StandardOpenOption.WRITE)) {
            FileLock held = fileLock.acquire(channel, true, false, null, Duration.ofMillis(5));
            assertNotNull(held);
            
            CacheResult<String> result = cache.getText("doc");
            
            assertFalse(result.isHit());
            assertTrue(result.isLockError());
            fileLock.release(held);
        }
        assertTrue(cache.getText("doc").isHit());
    }
    
    @Test
    void invalidateRemovesPayloadAndSidecar() throws Exception {
        cache.setText("doc", "content");
        cache.setRecord("doc", new HashMap<>());
        
        assertTrue(cache.invalidate("doc"));
        
        assertFalse(cache.getText("doc").isHit());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(2, files.count());
        }
        assertTrue(cache.invalidateData("doc"));
        assertTrue(cache.invalidate("never-written"));
    }
    
    @Test
    void invalidateAllClearsFilesAndCounters() throws Exception {
        cache.setText("a", "1");
        cache.setText("b", "2");
        cache.getText("a");
        Path foreignTemp = Files.writeString(tempDir.resolve(".x.html.1-ab.tmp"), "in flight");
        
        int removed = cache.invalidateAll();
        
        assertEquals(4, removed);
        assertTrue(Files.exists(foreignTemp));
        CacheStatistics stats = cache.getStatistics();
        assertEquals(0, stats.getEntryCount());
        assertEquals(0, stats.getHits());
        assertEquals(0, stats.getWrites());
    }
}
