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

import com.docindex.server.cache.AdvisoryFileLock;
import com.docindex.server.cache.AtomicFileWriter;
import com.docindex.server.cache.CacheDirectory;
import com.docindex.server.cache.CacheDirectoryInitializer;
import com.docindex.server.cache.DiskCache;
import com.docindex.server.cache.MemoryCache;
import com.docindex.server.source.HttpDocumentFetcher;
import com.docindex.server.state.ServerStatePersistence;
import com.docindex.server.store.IndexedDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the cache layer, the HTTP fetcher and the state file from {@link DocIndexProperties}.
 */
@Slf4j
@Configuration
public class CacheConfig {
    
    @Autowired
    private DocIndexProperties properties;
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public CacheDirectory cacheDirectory() {
        DocIndexProperties.Cache cache = properties.getCache();
        CacheDirectory directory = new CacheDirectoryInitializer()
                .initialize(cache.getDirectory(), cache.getTtlSeconds());
        if (directory.isDegraded()) {
            log.warn("Cache running in degraded mode at {}: {}", directory.getPath(), directory.getError());
        }
        return directory;
    }
    
    @Bean
    public AdvisoryFileLock advisoryFileLock() {
        return new AdvisoryFileLock(Duration.ofMillis(properties.getLock().getMaxRetryIntervalMs()));
    }
    
    @Bean
    public AtomicFileWriter atomicFileWriter(AdvisoryFileLock fileLock) {
        DocIndexProperties.Lock lock = properties.getLock();
        return new AtomicFileWriter(fileLock,
                properties.getWriter().getMaxRetries(),
                Duration.ofMillis(properties.getWriter().getRetryBaseDelayMs()),
                Duration.ofMillis(lock.getTimeoutMs()),
                Duration.ofMillis(lock.getRetryIntervalMs()));
    }
    
    @Bean
    public DiskCache diskCache(CacheDirectory cacheDirectory, AtomicFileWriter writer, 
                               AdvisoryFileLock fileLock, Clock clock) {
        DocIndexProperties.Lock lock = properties.getLock();
        return new DiskCache(cacheDirectory, writer, fileLock,
                Duration.ofMillis(lock.getReadTimeoutMs()),
                Duration.ofMillis(lock.getRetryIntervalMs()),
                clock);
    }
    
    @Bean
    public MemoryCache<String, IndexedDataset> indexMemoryCache(Clock clock) {
        DocIndexProperties.Cache cache = properties.getCache();
        return new MemoryCache<>(cache.getMaxMemoryEntries(), cache.getTtlSeconds(), clock);
    }
    
    @Bean
    public RestTemplate documentRestTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }
    
    @Bean
    public HttpDocumentFetcher httpDocumentFetcher(RestTemplate documentRestTemplate, DiskCache diskCache) {
        return new HttpDocumentFetcher(documentRestTemplate, diskCache, properties.getHttp().getUserAgent());
    }
    
    @Bean
    public ServerStatePersistence serverStatePersistence(CacheDirectory cacheDirectory, AtomicFileWriter writer) {
        String configured = properties.getState().getFile();
        Path file = configured != null && !configured.isBlank()
                ? Paths.get(configured)
                : cacheDirectory.getPath().resolve("server-state.json");
        ServerStatePersistence state = new ServerStatePersistence(file, writer);
        state.load();
        return state;
    }
}
