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

/**
 * Fetches the raw text of a documentation document.
 */
@FunctionalInterface
public interface DocumentFetcher {
    
    /**
     * @param documentId identity of the document, usually a URL
     * @param forceRefresh bypass any cached copy
     * @throws com.docindex.core.exception.SourceException if the document cannot be fetched
     */
    String fetch(String documentId, boolean forceRefresh);
    
    /**
     * Drop any cached copy of {@code documentId}.
     */
    default void invalidate(String documentId) {
    }
}
