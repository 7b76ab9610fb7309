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

import lombok.Value;

/**
 * Expiry rule shared by the memory and disk caches.
 * 
 * <p>An entry is expired only when <b>both</b> its last-access age and its creation
 * age exceed the TTL. A single clock anomaly that moves one reference point cannot
 * expire a live entry or keep a dead one alive.</p>
 * 
 * <ul>
 *   <li>{@code now < lastAccess}: backward clock jump, reported via
 *       {@link Verdict#isAccessClockSkew()} and never expired</li>
 *   <li>{@code now < creation}: creation age clamped to zero</li>
 *   <li>no creation time known: decided on access age alone</li>
 *   <li>negative TTL: never expires</li>
 * </ul>
 * 
 * @version 1.0.0
 */
public final class DualTimestampExpiry {
    
    private DualTimestampExpiry() {
        // Prevent instantiation
    }
    
    public static Verdict evaluate(long lastAccessMillis, Long creationMillis, long nowMillis, long ttlMillis) {
        boolean accessSkew = nowMillis < lastAccessMillis;
        long accessAge = accessSkew ? 0L : nowMillis - lastAccessMillis;
        
        boolean creationSkew = creationMillis != null && nowMillis < creationMillis;
        long creationAge = creationMillis == null ? accessAge : Math.max(0L, nowMillis - creationMillis);
        
        if (ttlMillis < 0) {
            return new Verdict(false, accessSkew, creationSkew, accessAge, creationAge);
        }
        
        boolean accessExpired = !accessSkew && accessAge > ttlMillis;
        boolean creationExpired = creationMillis == null || creationAge > ttlMillis;
        return new Verdict(accessExpired && creationExpired, accessSkew, creationSkew, accessAge, creationAge);
    }
    
    /**
     * Outcome of an expiry evaluation.
     */
    @Value
    public static class Verdict {
        boolean expired;
        boolean accessClockSkew;
        boolean creationClockSkew;
        long accessAgeMillis;
        long creationAgeMillis;
    }
}
