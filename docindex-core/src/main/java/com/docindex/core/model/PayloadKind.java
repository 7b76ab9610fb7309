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
package com.docindex.core.model;

/**
 * Kinds of payload a cache entry can hold. Each persistent kind maps to its own
 * file suffix so that payloads for the same logical key never collide on disk.
 */
public enum PayloadKind {
    TEXT(".html"),
    RECORD(".data.json"),
    BINARY(".data.bin"),
    /** Live object held in process memory; never written to disk. */
    OBJECT("");
    
    public static final String METADATA_SUFFIX = ".meta";
    
    private final String suffix;
    
    PayloadKind(String suffix) {
        this.suffix = suffix;
    }
    
    public String getSuffix() {
        return suffix;
    }
    
    public boolean isPersistent() {
        return this != OBJECT;
    }
    
    /**
     * Resolve the payload kind from a cache file name, or {@code null} when the file is
     * a sidecar, a temporary file or unrelated.
     */
    public static PayloadKind fromFileName(String fileName) {
        if (fileName.endsWith(METADATA_SUFFIX) || fileName.endsWith(".tmp")) {
            return null;
        }
        for (PayloadKind kind : values()) {
            if (kind.isPersistent() && fileName.endsWith(kind.suffix)) {
                return kind;
            }
        }
        return null;
    }
}
