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
package com.docindex.core.util;

import com.docindex.core.exception.DocIndexException;
import com.docindex.core.model.OptionRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {
    
    @Test
    void optionDefaultIsWrittenUnderDefaultKey() {
        OptionRecord option = OptionRecord.builder()
                .name("programs.git.enable")
                .type("boolean")
                .defaultValue("false")
                .build();
        
        JsonNode node = JsonUtils.parse(JsonUtils.toJson(option));
        
        assertEquals("false", node.get("default").asText());
        assertFalse(node.has("defaultValue"));
        assertFalse(node.has("subOptions"));
        assertFalse(node.has("enableFlag"));
    }
    
    @Test
    void unknownPropertiesAreIgnored() {
        byte[] json = "{\"name\":\"a.b\",\"unexpected\":1}".getBytes(StandardCharsets.UTF_8);
        
        OptionRecord option = JsonUtils.fromJson(json, OptionRecord.class);
        
        assertEquals("a.b", option.getName());
    }
    
    @Test
    void malformedJsonRaisesParseError() {
        DocIndexException e = assertThrows(DocIndexException.class, () -> JsonUtils.parse("{not json"));
        
        assertEquals(DocIndexException.ErrorCode.JSON_PARSE_ERROR, e.getErrorCode());
    }
}
