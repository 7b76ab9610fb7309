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
 * Thrown when a search index is queried before it has been built.
 * Lets callers tell "not loaded yet" apart from "loaded, no matches".
 */
public class IndexNotBuiltException extends DocIndexException {
    
    public IndexNotBuiltException(String message) {
        super(ErrorCode.INDEX_NOT_BUILT, message);
    }
    
    public static IndexNotBuiltException forOperation(String operation) {
        return new IndexNotBuiltException("Search index has not been built; cannot " + operation);
    }
}
