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
package com.docindex.server.dto;

import com.docindex.core.exception.StoreNotReadyException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Common fields of every store query response. A response with {@code found=false}
 * and {@code loading=true} means the store is still indexing.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class StoreResponse {
    
    private String source;
    
    private boolean found;
    
    private boolean loading;
    
    private String error;
    
    public void markNotReady(StoreNotReadyException e) {
        this.found = false;
        this.loading = e.isLoading();
        this.error = e.getMessage();
    }
}
