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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.docindex.core.exception.DocIndexException;

import java.io.IOException;

/**
 * Utility class for JSON operations shared by the caches, the option parser and the
 * state file.
 */
public final class JsonUtils {
    
    private static final ObjectMapper objectMapper;
    
    static {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    private JsonUtils() {
        // Prevent instantiation
    }
    
    /**
     * Get the shared ObjectMapper instance
     */
    public static ObjectMapper getObjectMapper() {
        return objectMapper;
    }
    
    /**
     * Parse JSON string to JsonNode
     */
    public static JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.JSON_PARSE_ERROR, 
                    "Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Parse JSON string to specified type using TypeReference
     */
    public static <T> T fromJson(String json, TypeReference<T> typeReference) {
        try {
            return objectMapper.readValue(json, typeReference);
        } catch (JsonProcessingException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.JSON_PARSE_ERROR, 
                    "Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Parse UTF-8 JSON bytes to the given type
     */
    public static <T> T fromJson(byte[] json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.JSON_PARSE_ERROR, 
                    "Failed to parse JSON: " + e.getMessage(), e);
        }
    }
    
    /**
     * Convert object to JSON string
     */
    public static String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.JSON_PARSE_ERROR, 
                    "Failed to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Convert object to UTF-8 JSON bytes
     */
    public static byte[] toJsonBytes(Object obj) {
        try {
            return objectMapper.writeValueAsBytes(obj);
        } catch (JsonProcessingException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.JSON_PARSE_ERROR, 
                    "Failed to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Convert object to pretty JSON string
     */
    public static String toPrettyJson(Object obj) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.JSON_PARSE_ERROR, 
                    "Failed to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }
}
