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
package com.docindex.server.config;

import com.docindex.core.constants.DocIndexConstants;
import com.docindex.server.index.SearchScoring;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the DocIndex server.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "docindex")
@Validated
public class DocIndexProperties {
    
    /**
     * Cache configuration
     */
    @Valid
    private Cache cache = new Cache();
    
    /**
     * Directory for rolling log files (read by logback-spring.xml)
     */
    private String logs = "./logs";
    
    /**
     * File lock configuration
     */
    @Valid
    private Lock lock = new Lock();
    
    /**
     * Atomic writer configuration
     */
    @Valid
    private Writer writer = new Writer();
    
    /**
     * Store loading configuration
     */
    @Valid
    private Loading loading = new Loading();
    
    /**
     * HTTP client configuration for document fetching
     */
    @Valid
    private Http http = new Http();
    
    /**
     * Search scoring constants
     */
    @Valid
    private SearchScoring search = new SearchScoring();
    
    /**
     * Documentation sources keyed by store name
     */
    private Map<String, Source> sources = new LinkedHashMap<>();
    
    /**
     * Server state file configuration
     */
    private State state = new State();
    
    @Data
    public static class Cache {
        /**
         * Cache directory. Created with owner-only permissions; a temporary
         * directory is used if it cannot be prepared.
         */
        private String directory;
        
        /**
         * Entry time-to-live in seconds; negative disables expiry
         */
        private long ttlSeconds = DocIndexConstants.DEFAULT_TTL_SECONDS;
        
        @Min(1)
        private int maxMemoryEntries = DocIndexConstants.DEFAULT_MAX_MEMORY_ENTRIES;
        
        /**
         * Datasets with fewer options are never persisted
         */
        @Min(1)
        private int minViableDatasetSize = DocIndexConstants.DEFAULT_MIN_VIABLE_DATASET_SIZE;
        
        /**
         * Interval between sweeps of expired memory cache entries
         */
        @Min(1000)
        private long cleanupIntervalMs = 600000;
    }
    
    @Data
    public static class Lock {
        @Min(0)
        private long timeoutMs = DocIndexConstants.DEFAULT_LOCK_TIMEOUT_MS;
        
        @Min(1)
        private long retryIntervalMs = DocIndexConstants.DEFAULT_LOCK_RETRY_INTERVAL_MS;
        
        @Min(1)
        private long maxRetryIntervalMs = DocIndexConstants.DEFAULT_LOCK_MAX_RETRY_INTERVAL_MS;
        
        /**
         * Wait for a shared lock when reading a cache file
         */
        @Min(1)
        private long readTimeoutMs = 1000;
    }
    
    @Data
    public static class Writer {
        @Min(1)
        private int maxRetries = DocIndexConstants.DEFAULT_WRITE_RETRIES;
        
        @Min(0)
        private long retryBaseDelayMs = DocIndexConstants.DEFAULT_WRITE_RETRY_DELAY_MS;
    }
    
    @Data
    public static class Loading {
        /**
         * Start loading every store when the application is ready
         */
        private boolean eager = true;
        
        /**
         * How long startup waits for eager loads before continuing in the background
         */
        @Min(0)
        private long eagerTimeoutSeconds = 10;
        
        /**
         * Upper bound for callers waiting on an in-flight load
         */
        @Min(1)
        private long waitTimeoutSeconds = 30;
        
        @Min(0)
        private long shutdownWaitSeconds = 5;
    }
    
    @Data
    public static class Http {
        @Min(1)
        private int connectTimeoutMs = 10000;
        
        @Min(1)
        private int readTimeoutMs = 30000;
        
        private String userAgent = "DocIndex/" + DocIndexConstants.VERSION;
    }
    
    @Data
    public static class Source {
        /**
         * Human readable name used in messages and as the record source label
         */
        private String label;
        
        /**
         * Document URLs fetched and parsed for this store
         */
        private List<String> documents = new ArrayList<>();
        
        /**
         * Document format understood by the parser
         */
        private String format = "json";
    }
    
    @Data
    public static class State {
        /**
         * State file; defaults to {@code server-state.json} inside the cache directory
         */
        private String file;
    }
}
