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
package com.docindex.core.constants;

/**
 * Constants used throughout DocIndex.
 */
public final class DocIndexConstants {
    
    private DocIndexConstants() {
        // Prevent instantiation
    }
    
    // Version
    public static final String VERSION = "1.0.0";
    
    // Cache defaults
    public static final long DEFAULT_TTL_SECONDS = 86400;
    public static final int DEFAULT_MAX_MEMORY_ENTRIES = 16;
    public static final int DEFAULT_MIN_VIABLE_DATASET_SIZE = 10;
    public static final String CACHE_DIR_ENV = "DOCINDEX_CACHE_DIR";
    public static final String TEMP_DIR_PREFIX = "docindex-cache-";
    public static final String CACHE_DIR_PERMISSIONS = "rwx------";
    
    // Cache key suffixes for a store's persisted index
    public static final String DATA_KEY_SUFFIX = "_data";
    
    // Lock defaults
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 5000;
    public static final long DEFAULT_LOCK_RETRY_INTERVAL_MS = 50;
    public static final long DEFAULT_LOCK_MAX_RETRY_INTERVAL_MS = 1000;
    public static final double LOCK_BACKOFF_MULTIPLIER = 1.5;
    public static final double LOCK_JITTER = 0.1;
    
    // Writer defaults
    public static final int DEFAULT_WRITE_RETRIES = 3;
    public static final long DEFAULT_WRITE_RETRY_DELAY_MS = 100;
    
    // Search defaults
    public static final int DEFAULT_SEARCH_LIMIT = 20;
    public static final int MIN_INDEXED_WORD_LENGTH = 3;
    public static final int MAX_RELATED_OPTIONS = 5;
    public static final int MAX_SUGGESTIONS = 5;
}
