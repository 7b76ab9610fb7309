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
package com.docindex.core.exception;

/**
 * Exception raised when a document store cannot serve a request because its
 * data is still loading or the last load failed.
 */
public class StoreNotReadyException extends DocIndexException {
    
    private final boolean loading;
    
    public StoreNotReadyException(String message, boolean loading) {
        super(ErrorCode.STORE_NOT_READY, message);
        this.loading = loading;
    }
    
    public StoreNotReadyException(String message, boolean loading, Throwable cause) {
        super(ErrorCode.STORE_NOT_READY, message, cause);
        this.loading = loading;
    }
    
    public boolean isLoading() {
        return loading;
    }
    
    public static StoreNotReadyException loading(String store) {
        return new StoreNotReadyException(
                store + " data is still loading. Please try again shortly.", true);
    }
    
    public static StoreNotReadyException failed(String store, String reason) {
        return new StoreNotReadyException("Failed to load " + store + " data: " + reason, false);
    }
    
    public static StoreNotReadyException notLoaded(String store) {
        return new StoreNotReadyException(store + " data not loaded.", false);
    }
    
    public static StoreNotReadyException timedOut(String store, long waitSeconds) {
        return new StoreNotReadyException("Timed out after " + waitSeconds
                + "s waiting for " + store + " data to load", true);
    }
}
