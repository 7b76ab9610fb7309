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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A documentation source: the documents making up one store plus the pair of
 * functions used to fetch and parse them.
 */
@Value
@Builder
public class DocumentSource {
    
    /**
     * Store name; also the logical cache key of the store's persisted index
     */
    String name;
    
    String label;
    
    @Singular
    List<String> documents;
    
    DocumentFetcher fetcher;
    
    OptionParser parser;
    
    public String getDisplayName() {
        return label != null ? label : name;
    }
}
