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
package com.docindex.server.index;

import lombok.Value;

import java.io.Serializable;

/**
 * Key of the hierarchical index: a parent path and the next segment below it.
 */
@Value
public class HierarchyKey implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    String parentPath;
    
    String childSegment;
}
