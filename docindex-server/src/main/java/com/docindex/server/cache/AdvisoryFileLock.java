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

import com.docindex.core.constants.DocIndexConstants;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.FileLockInterruptionException;
import java.nio.channels.OverlappingFileLockException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Advisory whole-file lock shared between processes using the same cache directory.
 * 
 * <p>Three acquisition modes:
 * <ul>
 *   <li><b>Non-blocking</b> - a single attempt, {@code null} on contention</li>
 *   <li><b>Blocking, no timeout</b> ({@code timeout <= 0}) - waits until granted</li>
 *   <li><b>Blocking with timeout</b> - polls with exponential backoff
 *       (interval x 1.5, capped, +/-10% jitter) until granted or timed out</li>
 * </ul>
 * 
 * <p>Locks held by another thread of this JVM surface as
 * {@link OverlappingFileLockException}; they are treated like a lock held by another
 * process. Any other I/O failure is propagated to the caller.
 * 
 * <p>Shared locks need a channel opened for reading, exclusive locks one opened for writing.
 * 
 * @version 1.0.0
 */
@Slf4j
public class AdvisoryFileLock {
    
    private final Duration maxRetryInterval;
    
    public AdvisoryFileLock() {
        this(Duration.ofMillis(DocIndexConstants.DEFAULT_LOCK_MAX_RETRY_INTERVAL_MS));
    }
    
    public AdvisoryFileLock(Duration maxRetryInterval) {
        this.maxRetryInterval = maxRetryInterval;
    }
    
    /**
     * Acquire a lock on the whole file behind {@code channel}.
     * 
     * @param channel the open file channel
     * @param exclusive exclusive (write) lock when true, shared (read) lock otherwise
     * @param blocking whether to wait for the lock at all
     * @param timeout maximum wait when blocking; zero or negative waits indefinitely
     * @param retryInterval initial polling interval
     * @return the granted lock, or {@code null} if it could not be acquired
     * @throws IOException on any failure other than contention
     */
    public FileLock acquire(FileChannel channel, boolean exclusive, boolean blocking,
                            Duration timeout, Duration retryInterval) throws IOException {
        boolean shared = !exclusive;
        if (!blocking) {
            return tryOnce(channel, shared);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return lockIndefinitely(channel, shared, retryInterval);
        }
        return lockWithBackoff(channel, shared, timeout, retryInterval);
    }
    
    /**
     * Release a lock. Never throws; failures are logged.
     * 
     * @return true if the lock is no longer held
     */
    public boolean release(FileLock lock) {
        if (lock == null) {
            return false;
        }
        try {
            if (lock.isValid()) {
                lock.release();
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to release file lock: {}", e.getMessage());
            return false;
        }
    }
    
    // ==================== Acquisition Modes ====================
    
    private FileLock tryOnce(FileChannel channel, boolean shared) throws IOException {
        try {
            return channel.tryLock(0L, Long.MAX_VALUE, shared);
        } catch (OverlappingFileLockException e) {
            // Held by another thread of this JVM
            return null;
        }
    }
    
    private FileLock lockIndefinitely(FileChannel channel, boolean shared, Duration retryInterval)
            throws IOException {
        long intervalNanos = retryInterval.toNanos();
        while (true) {
            try {
                return channel.lock(0L, Long.MAX_VALUE, shared);
            } catch (OverlappingFileLockException e) {
                if (!pause(jitter(intervalNanos))) {
                    return null;
                }
                intervalNanos = nextInterval(intervalNanos);
            } catch (FileLockInterruptionException e) {
                log.warn("Interrupted while waiting for file lock");
                return null;
            }
        }
    }
    
    private FileLock lockWithBackoff(FileChannel channel, boolean shared, Duration timeout,
                                     Duration retryInterval) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long intervalNanos = retryInterval.toNanos();
        
        while (true) {
            FileLock lock = tryOnce(channel, shared);
            if (lock != null) {
                return lock;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.debug("Timed out after {} ms waiting for {} file lock", 
                        timeout.toMillis(), shared ? "shared" : "exclusive");
                return null;
            }
            if (!pause(Math.min(jitter(intervalNanos), remaining))) {
                return null;
            }
            intervalNanos = nextInterval(intervalNanos);
        }
    }
    
    // ==================== Helper Methods ====================
    
    private long nextInterval(long intervalNanos) {
        long next = (long) (intervalNanos * DocIndexConstants.LOCK_BACKOFF_MULTIPLIER);
        return Math.min(Math.max(next, 1L), maxRetryInterval.toNanos());
    }
    
    static long jitter(long intervalNanos) {
        double factor = 1.0 + ThreadLocalRandom.current().nextDouble(
                -DocIndexConstants.LOCK_JITTER, DocIndexConstants.LOCK_JITTER);
        return Math.max(1L, (long) (intervalNanos * factor));
    }
    
    private boolean pause(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for file lock");
            return false;
        }
    }
}
