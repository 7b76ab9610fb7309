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

import com.docindex.core.model.OptionRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Options under a dotted prefix, with a type breakdown and the boolean
 * {@code .enable} switches among them.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class PrefixResponse extends StoreResponse {
    
    private String prefix;
    
    private int count;
    
    private List<OptionRecord> options;
    
    private Map<String, Integer> types;
    
    private List<EnableOption> enableOptions;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnableOption {
        private String name;
        private String parent;
        private String description;
    }
}
