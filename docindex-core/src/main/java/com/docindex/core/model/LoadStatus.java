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
 * Load state of a document store.
 * {@code ERROR} may move back to {@code LOADING} only on an explicit refresh.
 */
public enum LoadStatus {
    NOT_STARTED,
    LOADING,
    LOADED,
    ERROR
}
