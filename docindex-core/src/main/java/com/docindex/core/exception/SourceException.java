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
 * Exception thrown when a documentation source cannot be resolved, fetched or parsed.
 */
public class SourceException extends DocIndexException {
    
    public SourceException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public SourceException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
    
    public static SourceException notFound(String source) {
        return new SourceException(ErrorCode.SOURCE_NOT_FOUND, "Documentation source not found: " + source);
    }
    
    public static SourceException fetchFailed(String documentId, String reason) {
        return new SourceException(ErrorCode.FETCH_FAILED, 
                "Failed to fetch " + documentId + ": " + reason);
    }
    
    public static SourceException fetchFailed(String documentId, Throwable cause) {
        return new SourceException(ErrorCode.FETCH_FAILED, 
                "Failed to fetch " + documentId + ": " + cause.getMessage(), cause);
    }
    
    public static SourceException parseFailed(String documentId, Throwable cause) {
        return new SourceException(ErrorCode.PARSE_FAILED, 
                "Failed to parse " + documentId + ": " + cause.getMessage(), cause);
    }
}
