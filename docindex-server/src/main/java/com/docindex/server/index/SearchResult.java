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

import java.util.List;

/**
 * Ranked, truncated hits plus the number of options that matched before truncation.
 */
@Value
public class SearchResult {
    
    List<SearchHit> hits;
    
    int totalMatches;
    
    public static SearchResult empty() {
        return new SearchResult(List.of(), 0);
    }
}
