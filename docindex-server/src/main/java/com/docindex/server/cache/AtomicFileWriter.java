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

import com.docindex.core.util.InstanceIdentity;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Crash-consistent file writer.
 * 
 * <p>Content is staged in a uniquely named temporary sibling of the destination
 * ({@code .<name>.<instance>.<random>.tmp}), written under an exclusive lock, forced to
 * durable storage and then renamed over the destination. Readers see either the previous
 * file or the complete new one.</p>
 * 
 * <p>A failed attempt removes its temporary file and is retried with linearly growing,
 * jittered delays. When the file system cannot rename atomically, the destination is
 * locked and replaced while the lock is held.</p>
 * 
 * @version 1.0.0
 */
@Slf4j
public class AtomicFileWriter {
    
    /**
     * Populates the locked temporary file. The stream must not be closed.
     */
    @FunctionalInterface
    public interface ContentWriter {
        void write(OutputStream out) throws IOException;
    }
    
    private final AdvisoryFileLock fileLock;
    private final int maxRetries;
    private final Duration retryBaseDelay;
    private final Duration lockTimeout;
    private final Duration lockRetryInterval;
    private final String instanceId;
    
    private volatile boolean atomicMoveSupported = true;
    
    public AtomicFileWriter(AdvisoryFileLock fileLock, int maxRetries, Duration retryBaseDelay,
                            Duration lockTimeout, Duration lockRetryInterval) {
        this.fileLock = fileLock;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBaseDelay = retryBaseDelay;
        this.lockTimeout = lockTimeout;
        this.lockRetryInterval = lockRetryInterval;
        this.instanceId = InstanceIdentity.current();
    }
    
    /**
     * Write {@code destination} atomically.
     * 
     * @return true once the new content is in place, false after all attempts failed;
     *         no partial destination file is left behind either way
     */
    public boolean write(Path destination, ContentWriter writer) {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                writeOnce(destination, writer);
                return true;
            } catch (IOException | RuntimeException e) {
                if (attempt == maxRetries) {
                    log.error("Atomic write of {} failed after {} attempts: {}", 
                            destination, maxRetries, e.getMessage());
                    return false;
                }
                log.warn("Atomic write of {} failed (attempt {}/{}): {}", 
                        destination, attempt, maxRetries, e.getMessage());
                if (!backoff(attempt)) {
                    return false;
                }
            }
        }
        return false;
    }
    
    /**
     * Write UTF-8 or binary content in one call.
     */
    public boolean write(Path destination, byte[] content) {
        return write(destination, out -> out.write(content));
    }
    
    private void writeOnce(Path destination, ContentWriter writer) throws IOException {
        Path target = destination.toAbsolutePath();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(tempName(target));
        
        boolean moved = false;
        try {
            try (FileChannel channel = FileChannel.open(temp, 
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                FileLock lock = fileLock.acquire(channel, true, true, lockTimeout, lockRetryInterval);
                if (lock == null) {
                    lock = fileLock.acquire(channel, true, true, Duration.ZERO, lockRetryInterval);
                }
                if (lock == null) {
                    throw new IOException("Could not lock temporary file " + temp);
                }
                try {
                    OutputStream out = new BufferedOutputStream(Channels.newOutputStream(channel));
                    writer.write(out);
                    out.flush();
                    channel.force(true);
                } finally {
                    fileLock.release(lock);
                }
            }
            replace(temp, target);
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }
    
    private void replace(Path temp, Path target) throws IOException {
        if (atomicMoveSupported) {
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                return;
            } catch (AtomicMoveNotSupportedException e) {
                atomicMoveSupported = false;
                log.warn("Atomic rename not supported under {}; replacing files under lock", target.getParent());
            }
        }
        replaceUnderLock(temp, target);
    }
    
    private void replaceUnderLock(Path temp, Path target) throws IOException {
        if (Files.notExists(target)) {
            Files.move(temp, target);
            return;
        }
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.WRITE)) {
            FileLock lock = fileLock.acquire(channel, true, true, lockTimeout, lockRetryInterval);
            if (lock == null) {
                throw new IOException("Could not lock destination " + target);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                fileLock.release(lock);
            }
        }
    }
    
    // ==================== Helper Methods ====================
    
    private String tempName(Path target) {
        return "." + target.getFileName() + "." + instanceId + "." 
                + Long.toHexString(ThreadLocalRandom.current().nextLong()) + ".tmp";
    }
    
    private boolean backoff(int attempt) {
        long base = retryBaseDelay.toMillis();
        long delay = base * attempt + ThreadLocalRandom.current().nextLong(base / 10 + 1);
        try {
            TimeUnit.MILLISECONDS.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while retrying atomic write");
            return false;
        }
    }
}
