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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Resolved cache directory and the condition it was initialized in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheDirectory {
    
    private Path path;
    
    private long ttlSeconds;
    
    /**
     * True when some directory, requested or fallback, is usable
     */
    private boolean initialized;
    
    /**
     * True when the requested directory could not be used and a temporary one was substituted
     */
    private boolean degraded;
    
    private String error;
}
