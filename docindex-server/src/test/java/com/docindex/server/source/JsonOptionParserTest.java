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
package com.docindex.server.source;

import com.docindex.core.exception.DocIndexException;
import com.docindex.core.exception.SourceException;
import com.docindex.core.model.OptionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonOptionParserTest {
    
    private static final String OPTIONS_JSON = """
            {
              "programs.git.enable": {
                "type": "boolean",
                "description": "Whether to enable Git.",
                "default": {"_type": "literalExpression", "text": "false"},
                "example": {"_type": "literalExpression", "text": "true"},
                "declarations": [{"name": "<home-manager/modules/programs/git.nix>", "url": "https://example.org/git.nix"}],
                "readOnly": false
              },
              "home.stateVersion": {
                "type": "string",
                "description": "State version.",
                "declarations": ["modules/home-environment.nix"]
              },
              "broken": "not an option object"
            }
            """;
    
    private final JsonOptionParser parser = new JsonOptionParser("Home Manager");
    
    @Test
    void parsesOptionsAndUnwrapsLiteralExpressions() {
        List<OptionRecord> options = parser.parse("options.json", OPTIONS_JSON);
        
        assertEquals(2, options.size());
        OptionRecord git = options.get(0);
        assertEquals("programs.git.enable", git.getName());
        assertEquals("boolean", git.getType());
        assertEquals("false", git.getDefaultValue());
        assertEquals("true", git.getExample());
        assertEquals("<home-manager/modules/programs/git.nix>", git.getDeclaredBy());
        assertEquals("programs.git", git.getParent());
        assertEquals("programs", git.getCategory());
        assertEquals("Home Manager", git.getSource());
        assertEquals(Boolean.FALSE, git.getReadOnly());
        assertTrue(git.isEnableFlag());
        
        OptionRecord state = options.get(1);
        assertEquals("modules/home-environment.nix", state.getDeclaredBy());
        assertNull(state.getDefaultValue());
        assertNull(state.getReadOnly());
        assertEquals("home", state.getParent());
    }
    
    @Test
    void invalidJsonIsAParseFailure() {
        SourceException e = assertThrows(SourceException.class, () -> parser.parse("options.json", "{oops"));
        
        assertEquals(DocIndexException.ErrorCode.PARSE_FAILED, e.getErrorCode());
    }
    
    @Test
    void nonObjectRootIsAParseFailure() {
        assertThrows(SourceException.class, () -> parser.parse("options.json", "[1, 2, 3]"));
    }
}
