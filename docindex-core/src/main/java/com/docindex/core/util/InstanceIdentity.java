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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifier of this running process, written into cache metadata and temp file names
 * so that concurrent writers from different processes can be told apart.
 */
public final class InstanceIdentity {
    
    private static final String CURRENT = ProcessHandle.current().pid() + "-" 
            + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000, 0xFFFFF));
    
    private InstanceIdentity() {
        // Prevent instantiation
    }
    
    public static String current() {
        return CURRENT;
    }
}
