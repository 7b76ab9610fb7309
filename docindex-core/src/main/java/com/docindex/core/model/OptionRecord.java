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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;

/**
 * A documented configuration option, identified by its dot-separated name
 * (for example {@code services.nginx.enable}).
 * 
 * <p>Records are immutable; the owning search index replaces them wholesale on rebuild.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptionRecord implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    String name;
    
    String description;
    
    String type;
    
    @JsonProperty("default")
    String defaultValue;
    
    String example;
    
    String declaredBy;
    
    /**
     * Dotted path of the enclosing option set, absent for top-level names
     */
    String parent;
    
    @Builder.Default
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, OptionRecord> subOptions = Collections.emptyMap();
    
    /**
     * First path segment, used for category listings
     */
    String category;
    
    /**
     * Label of the documentation source the record was parsed from
     */
    String source;
    
    Boolean readOnly;
    
    String manualUrl;
    
    @JsonIgnore
    public boolean isEnableFlag() {
        return name != null && name.endsWith(".enable") && "boolean".equals(type);
    }
    
    /**
     * Second-to-last path segment, the thing an {@code .enable} flag switches on.
     */
    @JsonIgnore
    public String getOwnerSegment() {
        if (name == null) {
            return null;
        }
        String[] parts = name.split("\\.");
        return parts.length >= 2 ? parts[parts.length - 2] : null;
    }
    
    public static String parentOf(String name) {
        int idx = name.lastIndexOf('.');
        return idx > 0 ? name.substring(0, idx) : null;
    }
    
    public static String categoryOf(String name) {
        int idx = name.indexOf('.');
        return idx > 0 ? name.substring(0, idx) : name;
    }
}
