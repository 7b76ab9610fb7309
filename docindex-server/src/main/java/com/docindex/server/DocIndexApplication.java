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
package com.docindex.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the DocIndex documentation search server.
 * 
 * DocIndex fetches option documentation, indexes it for multi-strategy search and
 * serves lookups over HTTP:
 * - Persistent, multi-process safe disk cache with clock-skew tolerant expiry
 * - In-memory cache in front of the disk cache
 * - Exact, hierarchical, word, fuzzy and phrase search with score merging
 * 
 * Startup sequence is managed by StartupOrchestrator.
 * 
 * @author Ashutosh Sinha
 * @version 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class DocIndexApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(DocIndexApplication.class, args);
    }
}
