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
package com.docindex.server.index;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinDistanceTest {
    
    @Test
    void classicExamples() {
        assertEquals(3, LevenshteinDistance.compute("kitten", "sitting"));
        assertEquals(1, LevenshteinDistance.compute("servces", "services"));
        assertEquals(0, LevenshteinDistance.compute("nginx", "nginx"));
    }
    
    @Test
    void emptyInputCostsTheOtherLength() {
        assertEquals(5, LevenshteinDistance.compute("", "nginx"));
        assertEquals(5, LevenshteinDistance.compute("nginx", ""));
        assertEquals(0, LevenshteinDistance.compute("", ""));
    }
    
    @Test
    void isSymmetric() {
        assertEquals(LevenshteinDistance.compute("enable", "disable"), 
                LevenshteinDistance.compute("disable", "enable"));
    }
}
