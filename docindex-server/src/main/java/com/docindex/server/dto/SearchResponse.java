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

import com.docindex.server.index.SearchHit;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ranked search hits; {@code count} is the number of matches before truncation.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class SearchResponse extends StoreResponse {
    
    private String query;
    
    private int limit;
    
    private int count;
    
    private List<SearchHit> options;
}
