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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sidecar record stored next to every disk cache payload as {@code <payload>.meta}.
 * The payload file's modification time is the access-time proxy; this record carries
 * the creation time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheMetadata {
    
    /**
     * Epoch millis of the first write
     */
    private long creationTimestamp;
    
    /**
     * Identifier of the process instance that last wrote the payload
     */
    private String instanceId;
    
    private String key;
    
    private PayloadKind payloadKind;
    
    @Builder.Default
    private int formatVersion = CacheEntry.FORMAT_VERSION;
}
