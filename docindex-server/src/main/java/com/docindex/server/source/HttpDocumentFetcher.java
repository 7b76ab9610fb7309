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
package com.docindex.server.source;

import com.docindex.core.exception.SourceException;
import com.docindex.core.model.CacheResult;
import com.docindex.core.model.WriteResult;
import com.docindex.server.cache.DiskCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Fetches documents over HTTP, keeping each response body in the disk cache as a
 * text payload keyed by URL.
 */
@Slf4j
public class HttpDocumentFetcher implements DocumentFetcher {
    
    private final RestTemplate restTemplate;
    private final DiskCache diskCache;
    private final String userAgent;
    
    public HttpDocumentFetcher(RestTemplate restTemplate, DiskCache diskCache, String userAgent) {
        this.restTemplate = restTemplate;
        this.diskCache = diskCache;
        this.userAgent = userAgent;
    }
    
    @Override
    public String fetch(String url, boolean forceRefresh) {
        if (!forceRefresh) {
            CacheResult<String> cached = diskCache.getText(url);
            if (cached.isPresent()) {
                log.debug("Fetched {} from cache", url);
                return cached.getValue();
            }
        }
        
        log.info("Fetching {}", url);
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (RestClientException e) {
            log.error("Error fetching {}: {}", url, e.getMessage());
            throw SourceException.fetchFailed(url, e);
        }
        
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw SourceException.fetchFailed(url, "HTTP " + response.getStatusCode().value());
        }
        
        String body = response.getBody();
        WriteResult stored = diskCache.setText(url, body);
        if (!stored.isStored()) {
            log.warn("Could not cache {}: {}", url, stored.getError());
        }
        return body;
    }
    
    @Override
    public void invalidate(String url) {
        diskCache.invalidate(url);
    }
}
