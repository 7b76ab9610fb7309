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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashing helpers used to turn logical cache keys into file-system safe names.
 */
public final class HashUtils {
    
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    
    private HashUtils() {
        // Prevent instantiation
    }
    
    /**
     * 128-bit MD5 digest of the UTF-8 bytes of {@code value}, as lowercase hex.
     * Used purely for file naming, never for security.
     */
    public static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return toHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new DocIndexException(DocIndexException.ErrorCode.INTERNAL_ERROR, 
                    "MD5 digest not available", e);
        }
    }
    
    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
