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
 * Base exception for all DocIndex errors.
 */
public class DocIndexException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final ErrorCode errorCode;
    
    public DocIndexException(String message) {
        super(message);
        this.errorCode = ErrorCode.INTERNAL_ERROR;
    }
    
    public DocIndexException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = ErrorCode.INTERNAL_ERROR;
    }
    
    public DocIndexException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public DocIndexException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    /**
     * Error codes for DocIndex operations
     */
    public enum ErrorCode {
        INTERNAL_ERROR("ERR"),
        INVALID_ARGUMENT("INVALIDARG"),
        CACHE_IO_ERROR("CACHEIO"),
        CACHE_LOCK_TIMEOUT("LOCKTIMEOUT"),
        JSON_PARSE_ERROR("JSONERR"),
        SERIALIZATION_ERROR("SERIALERR"),
        FETCH_FAILED("FETCHERR"),
        PARSE_FAILED("PARSEERR"),
        INDEX_NOT_BUILT("NOINDEX"),
        STORE_NOT_READY("NOTREADY"),
        SOURCE_NOT_FOUND("NOSOURCE");
        
        private final String prefix;
        
        ErrorCode(String prefix) {
            this.prefix = prefix;
        }
        
        public String getPrefix() {
            return prefix;
        }
    }
    
    /**
     * Message prefixed with the error code, as shown to API clients.
     */
    public String getCodedMessage() {
        return errorCode.getPrefix() + " " + getMessage();
    }
}
