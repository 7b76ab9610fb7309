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
import com.docindex.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses a machine-readable options document: a JSON object mapping each option name
 * to its {@code description}, {@code type}, {@code default}, {@code example},
 * {@code declarations} and {@code readOnly} attributes.
 * 
 * <p>Description, default and example may be plain values or literal wrappers such as
 * {@code {"_type": "literalExpression", "text": "false"}}; wrappers are unwrapped to
 * their text. Non-string values are rendered as JSON.</p>
 */
@Slf4j
public class JsonOptionParser implements OptionParser {
    
    private final String sourceLabel;
    
    public JsonOptionParser(String sourceLabel) {
        this.sourceLabel = sourceLabel;
    }
    
    @Override
    public List<OptionRecord> parse(String documentId, String rawText) {
        JsonNode root;
        try {
            root = JsonUtils.parse(rawText);
        } catch (DocIndexException e) {
            throw SourceException.parseFailed(documentId, e);
        }
        if (root == null || !root.isObject()) {
            throw SourceException.parseFailed(documentId, 
                    new IllegalArgumentException("expected a JSON object of options"));
        }
        
        List<OptionRecord> records = new ArrayList<>(root.size());
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode option = field.getValue();
            if (name == null || name.isBlank() || !option.isObject()) {
                continue;
            }
            records.add(OptionRecord.builder()
                    .name(name)
                    .description(text(option.get("description")))
                    .type(text(option.get("type")))
                    .defaultValue(text(option.get("default")))
                    .example(text(option.get("example")))
                    .declaredBy(firstDeclaration(option.get("declarations")))
                    .readOnly(option.has("readOnly") ? option.get("readOnly").asBoolean() : null)
                    .parent(OptionRecord.parentOf(name))
                    .category(OptionRecord.categoryOf(name))
                    .source(sourceLabel)
                    .build());
        }
        log.debug("Parsed {} options from {}", records.size(), documentId);
        return records;
    }
    
    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject() && node.has("text")) {
            return text(node.get("text"));
        }
        return node.toString();
    }
    
    private static String firstDeclaration(JsonNode declarations) {
        if (declarations == null || !declarations.isArray() || declarations.isEmpty()) {
            return null;
        }
        JsonNode first = declarations.get(0);
        if (first.isObject()) {
            JsonNode name = first.get("name");
            JsonNode url = first.get("url");
            return name != null ? name.asText() : (url != null ? url.asText() : null);
        }
        return first.asText();
    }
}
