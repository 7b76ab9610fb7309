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

/**
 * A single option lookup. When the option is missing, {@code suggestions} lists
 * nearby names.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class OptionResponse extends StoreResponse {
    
    private String name;
    
    private OptionRecord option;
    
    private List<RelatedOption> relatedOptions;
    
    private List<String> suggestions;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RelatedOption {
        private String name;
        private String type;
        private String description;
    }
}
