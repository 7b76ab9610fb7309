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

import com.docindex.core.exception.DocIndexException;
import com.docindex.core.model.CacheMetadata;
import com.docindex.core.model.CacheResult;
import com.docindex.core.model.PayloadKind;
import com.docindex.core.model.WriteResult;
import com.docindex.core.util.DualTimestampExpiry;
import com.docindex.core.util.HashUtils;
import com.docindex.core.util.InstanceIdentity;
import com.docindex.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Persistent keyed cache safe to share between processes.
 * 
 * <h3>Layout</h3>
 * Each logical key maps to one file per payload kind, named by the MD5 of
 * {@code <kind>:<key>}:
 * <ul>
 *   <li>text: {@code <hash>.html}</li>
 *   <li>record: {@code <hash>.data.json} (Jackson)</li>
 *   <li>binary: {@code <hash>.data.bin} (gzipped Java serialization)</li>
 * </ul>
 * Every payload has a {@code .meta} sidecar holding its creation timestamp and the
 * writing instance.
 * 
 * <h3>Expiry</h3>
 * The payload's modification time is the last-access time and is slid forward on each
 * hit. An entry expires only when both access and creation ages exceed the TTL. Expired
 * files are reported as misses and left in place for the next write.
 * 
 * <h3>Failures</h3>
 * I/O and lock failures are reported through {@link CacheResult#getError()} and
 * {@link WriteResult#isStored()}; nothing is thrown. Payloads that cannot be decoded
 * are invalidated.
 * 
 * @version 1.0.0
 */
@Slf4j
public class DiskCache {
    
    private static final String BINARY_FILTER = 
            "maxdepth=64;com.docindex.**;java.util.**;java.lang.**;java.time.**;!*";
    
    @FunctionalInterface
    private interface Decoder<T> {
        T decode(byte[] bytes) throws IOException;
    }
    
    private final CacheDirectory cacheDirectory;
    private final Path directory;
    private final long ttlMillis;
    private final AtomicFileWriter writer;
    private final AdvisoryFileLock fileLock;
    private final Duration readLockTimeout;
    private final Duration lockRetryInterval;
    private final Clock clock;
    private final String instanceId;
    
    // Statistics
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong dataHits = new AtomicLong(0);
    private final AtomicLong dataMisses = new AtomicLong(0);
    private final AtomicLong writes = new AtomicLong(0);
    private final AtomicLong dataWrites = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);
    
    public DiskCache(CacheDirectory cacheDirectory, AtomicFileWriter writer, AdvisoryFileLock fileLock,
                     Duration readLockTimeout, Duration lockRetryInterval, Clock clock) {
        this.cacheDirectory = cacheDirectory;
        this.directory = cacheDirectory.getPath();
        long ttlSeconds = cacheDirectory.getTtlSeconds();
        this.ttlMillis = ttlSeconds < 0 ? -1L : ttlSeconds * 1000L;
        this.writer = writer;
        this.fileLock = fileLock;
        this.readLockTimeout = readLockTimeout;
        this.lockRetryInterval = lockRetryInterval;
        this.clock = clock;
        this.instanceId = InstanceIdentity.current();
        
        log.info("Disk cache initialized at {} (ttl={}s{})", directory, ttlSeconds, 
                cacheDirectory.isDegraded() ? ", DEGRADED" : "");
    }
    
    // ==================== Text Payloads ====================
    
    public CacheResult<String> getText(String key) {
        return read(key, PayloadKind.TEXT, bytes -> new String(bytes, StandardCharsets.UTF_8));
    }
    
    public WriteResult setText(String key, String content) {
        return write(key, PayloadKind.TEXT, content.getBytes(StandardCharsets.UTF_8));
    }
    
    /**
     * Remove the text payload for {@code key}.
     */
    public boolean invalidate(String key) {
        return invalidate(key, PayloadKind.TEXT);
    }
    
    // ==================== Record Payloads ====================
    
    public <T> CacheResult<T> getRecord(String key, Class<T> type) {
        return read(key, PayloadKind.RECORD, bytes -> JsonUtils.fromJson(bytes, type));
    }
    
    public WriteResult setRecord(String key, Object value) {
        byte[] bytes;
        try {
            bytes = JsonUtils.toJsonBytes(value);
        } catch (DocIndexException e) {
            errors.incrementAndGet();
            log.error("Cannot serialize record for key {}: {}", key, e.getMessage());
            return WriteResult.rejected(key, e.getMessage());
        }
        return write(key, PayloadKind.RECORD, bytes);
    }
    
    // ==================== Binary Payloads ====================
    
    public <T extends Serializable> CacheResult<T> getBinary(String key, Class<T> type) {
        return read(key, PayloadKind.BINARY, bytes -> type.cast(deserialize(bytes)));
    }
    
    public WriteResult setBinary(String key, Serializable value) {
        byte[] bytes;
        try {
            bytes = serialize(value);
        } catch (IOException e) {
            errors.incrementAndGet();
            log.error("Cannot serialize binary payload for key {}: {}", key, e.getMessage());
            return WriteResult.rejected(key, e.getMessage());
        }
        return write(key, PayloadKind.BINARY, bytes);
    }
    
    /**
     * Remove the record and binary payloads for {@code key}.
     */
    public boolean invalidateData(String key) {
        boolean record = invalidate(key, PayloadKind.RECORD);
        boolean binary = invalidate(key, PayloadKind.BINARY);
        return record && binary;
    }
    
    // ==================== Maintenance ====================
    
    /**
     * Delete the payload and sidecar for one key and kind. Absent files are not an error.
     * 
     * @return true if neither file remains
     */
    public boolean invalidate(String key, PayloadKind kind) {
        Path path = pathFor(key, kind);
        try {
            Files.deleteIfExists(path);
            Files.deleteIfExists(metadataPath(path));
            log.debug("Invalidated {} cache entry for {}", kind, key);
            return true;
        } catch (IOException e) {
            errors.incrementAndGet();
            log.warn("Failed to invalidate {} cache entry for {}: {}", kind, key, e.getMessage());
            return false;
        }
    }
    
    /**
     * Delete every payload and sidecar in the cache directory and reset counters.
     * In-flight temporary files of other writers are left alone.
     * 
     * @return number of files deleted
     */
    public int invalidateAll() {
        int deleted = 0;
        for (Path file : listCacheFiles()) {
            try {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                }
            } catch (IOException e) {
                errors.incrementAndGet();
                log.warn("Failed to delete cache file {}: {}", file, e.getMessage());
            }
        }
        resetStatistics();
        log.info("Cleared disk cache at {} ({} files removed)", directory, deleted);
        return deleted;
    }
    
    public CacheStatistics getStatistics() {
        long text = 0;
        long record = 0;
        long binary = 0;
        long bytes = 0;
        for (Path file : listCacheFiles()) {
            try {
                bytes += Files.size(file);
            } catch (IOException e) {
                // Removed between listing and sizing
                continue;
            }
            PayloadKind kind = PayloadKind.fromFileName(file.getFileName().toString());
            if (kind == PayloadKind.TEXT) {
                text++;
            } else if (kind == PayloadKind.RECORD) {
                record++;
            } else if (kind == PayloadKind.BINARY) {
                binary++;
            }
        }
        
        long h = hits.get();
        long m = misses.get();
        long dh = dataHits.get();
        long dm = dataMisses.get();
        return CacheStatistics.builder()
                .hits(h)
                .misses(m)
                .dataHits(dh)
                .dataMisses(dm)
                .writes(writes.get())
                .dataWrites(dataWrites.get())
                .errors(errors.get())
                .hitRatio(ratio(h, m))
                .dataHitRatio(ratio(dh, dm))
                .entryCount(text + record + binary)
                .textFiles(text)
                .recordFiles(record)
                .binaryFiles(binary)
                .totalBytes(bytes)
                .directory(directory.toString())
                .ttlSeconds(cacheDirectory.getTtlSeconds())
                .degraded(cacheDirectory.isDegraded())
                .initializationError(cacheDirectory.getError())
                .build();
    }
    
    public CacheDirectory getCacheDirectory() {
        return cacheDirectory;
    }
    
    /**
     * File backing {@code key} for the given payload kind.
     */
    public Path pathFor(String key, PayloadKind kind) {
        if (!kind.isPersistent()) {
            throw new DocIndexException(DocIndexException.ErrorCode.INVALID_ARGUMENT, 
                    "Payload kind " + kind + " is not stored on disk");
        }
        return directory.resolve(HashUtils.md5Hex(kind.name() + ":" + key) + kind.getSuffix());
    }
    
    // ==================== Read / Write Core ====================
    
    private <T> CacheResult<T> read(String key, PayloadKind kind, Decoder<T> decoder) {
        Path path = pathFor(key, kind);
        if (!Files.exists(path)) {
            recordMiss(kind);
            log.debug("Disk cache miss ({}) for {}", kind, key);
            return CacheResult.miss(key, path.toString());
        }
        
        long now = clock.millis();
        try {
            CacheMetadata metadata = readMetadata(path);
            Long creation = metadata != null ? metadata.getCreationTimestamp() : null;
            long lastAccess = Files.getLastModifiedTime(path).toMillis();
            DualTimestampExpiry.Verdict verdict = DualTimestampExpiry.evaluate(lastAccess, creation, now, ttlMillis);
            
            if (verdict.isAccessClockSkew()) {
                log.debug("Clock moved backwards for {}; resetting access time", path);
            }
            if (verdict.isExpired()) {
                recordMiss(kind);
                log.debug("Disk cache entry expired ({}) for {}", kind, key);
                return CacheResult.<T>builder().key(key).path(path.toString()).expired(true).build();
            }
            
            byte[] bytes = readLocked(path);
            if (bytes == null) {
                recordMiss(kind);
                errors.incrementAndGet();
                log.warn("Timed out waiting for read lock on {}", path);
                return CacheResult.<T>builder().key(key).path(path.toString())
                        .lockError(true).error("Cache file is locked by another writer").build();
            }
            
            T value;
            try {
                value = decoder.decode(bytes);
            } catch (IOException | RuntimeException e) {
                recordMiss(kind);
                errors.incrementAndGet();
                log.warn("Discarding malformed {} cache entry for {}: {}", kind, key, e.getMessage());
                invalidate(key, kind);
                return CacheResult.failure(key, path.toString(), "Malformed cached payload: " + e.getMessage());
            }
            
            touch(path, now);
            if (verdict.isCreationClockSkew() && metadata != null) {
                metadata.setCreationTimestamp(now);
                writer.write(metadataPath(path), JsonUtils.toJsonBytes(metadata));
            }
            recordHit(kind);
            log.debug("Disk cache hit ({}) for {}", kind, key);
            return CacheResult.<T>builder()
                    .key(key)
                    .value(value)
                    .hit(true)
                    .path(path.toString())
                    .creationTimestamp(creation)
                    .instanceId(metadata != null ? metadata.getInstanceId() : null)
                    .build();
        } catch (NoSuchFileException e) {
            recordMiss(kind);
            return CacheResult.miss(key, path.toString());
        } catch (IOException e) {
            recordMiss(kind);
            errors.incrementAndGet();
            log.warn("Error reading {} cache entry for {}: {}", kind, key, e.getMessage());
            return CacheResult.failure(key, path.toString(), e.getMessage());
        }
    }
    
    private WriteResult write(String key, PayloadKind kind, byte[] payload) {
        Path path = pathFor(key, kind);
        long now = clock.millis();
        
        CacheMetadata prior = Files.exists(path) ? readMetadata(path) : null;
        long creation = prior != null ? Math.min(prior.getCreationTimestamp(), now) : now;
        
        if (!writer.write(path, payload)) {
            errors.incrementAndGet();
            return WriteResult.builder().key(key).path(path.toString()).stored(false)
                    .error("Atomic write failed for " + path.getFileName()).build();
        }
        touch(path, now);
        
        CacheMetadata metadata = CacheMetadata.builder()
                .creationTimestamp(creation)
                .instanceId(instanceId)
                .key(key)
                .payloadKind(kind)
                .build();
        if (!writer.write(metadataPath(path), JsonUtils.toJsonBytes(metadata))) {
            errors.incrementAndGet();
            log.warn("Stored {} payload for {} without metadata", kind, key);
        }
        
        writes.incrementAndGet();
        if (kind != PayloadKind.TEXT) {
            dataWrites.incrementAndGet();
        }
        log.debug("Stored {} cache entry for {} ({} bytes)", kind, key, payload.length);
        return WriteResult.builder()
                .key(key)
                .stored(true)
                .path(path.toString())
                .instanceId(instanceId)
                .creationTimestamp(creation)
                .build();
    }
    
    // ==================== Helper Methods ====================
    
    private byte[] readLocked(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            FileLock lock = fileLock.acquire(channel, false, true, readLockTimeout, lockRetryInterval);
            if (lock == null) {
                return null;
            }
            try {
                return Channels.newInputStream(channel).readAllBytes();
            } finally {
                fileLock.release(lock);
            }
        }
    }
    
    private CacheMetadata readMetadata(Path payload) {
        Path metaPath = metadataPath(payload);
        if (!Files.exists(metaPath)) {
            return null;
        }
        try {
            byte[] bytes = readLocked(metaPath);
            return bytes != null ? JsonUtils.fromJson(bytes, CacheMetadata.class) : null;
        } catch (IOException | DocIndexException e) {
            log.debug("Ignoring unreadable cache metadata {}: {}", metaPath, e.getMessage());
            return null;
        }
    }
    
    private void touch(Path path, long nowMillis) {
        try {
            Files.setLastModifiedTime(path, FileTime.fromMillis(nowMillis));
        } catch (IOException e) {
            log.debug("Could not refresh access time of {}: {}", path, e.getMessage());
        }
    }
    
    private static Path metadataPath(Path payload) {
        return payload.resolveSibling(payload.getFileName() + PayloadKind.METADATA_SUFFIX);
    }
    
    private List<Path> listCacheFiles() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return PayloadKind.fromFileName(name) != null || name.endsWith(PayloadKind.METADATA_SUFFIX);
                    })
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list cache directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }
    
    private static byte[] serialize(Serializable value) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(new GZIPOutputStream(buffer))) {
            out.writeObject(value);
        }
        return buffer.toByteArray();
    }
    
    private static Object deserialize(byte[] bytes) throws IOException {
        try (ObjectInputStream in = new ObjectInputStream(new GZIPInputStream(new ByteArrayInputStream(bytes)))) {
            in.setObjectInputFilter(ObjectInputFilter.Config.createFilter(BINARY_FILTER));
            return in.readObject();
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown class in binary payload: " + e.getMessage(), e);
        }
    }
    
    private void recordHit(PayloadKind kind) {
        hits.incrementAndGet();
        if (kind != PayloadKind.TEXT) {
            dataHits.incrementAndGet();
        }
    }
    
    private void recordMiss(PayloadKind kind) {
        misses.incrementAndGet();
        if (kind != PayloadKind.TEXT) {
            dataMisses.incrementAndGet();
        }
    }
    
    private void resetStatistics() {
        hits.set(0);
        misses.set(0);
        dataHits.set(0);
        dataMisses.set(0);
        writes.set(0);
        dataWrites.set(0);
        errors.set(0);
    }
    
    private static double ratio(long hit, long miss) {
        long total = hit + miss;
        return total == 0 ? 0.0 : (double) hit / total;
    }
}
