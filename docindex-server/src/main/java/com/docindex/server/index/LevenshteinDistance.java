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

/**
 * Edit distance with a single rolling row, so memory is linear in the shorter input.
 */
public final class LevenshteinDistance {
    
    private LevenshteinDistance() {
        // Prevent instantiation
    }
    
    public static int compute(CharSequence a, CharSequence b) {
        CharSequence longer = a.length() >= b.length() ? a : b;
        CharSequence shorter = longer == a ? b : a;
        int n = shorter.length();
        if (n == 0) {
            return longer.length();
        }
        
        int[] row = new int[n + 1];
        for (int j = 0; j <= n; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= longer.length(); i++) {
            int diagonal = row[0];
            row[0] = i;
            char c = longer.charAt(i - 1);
            for (int j = 1; j <= n; j++) {
                int above = row[j];
                int cost = c == shorter.charAt(j - 1) ? 0 : 1;
                row[j] = Math.min(Math.min(above + 1, row[j - 1] + 1), diagonal + cost);
                diagonal = above;
            }
        }
        return row[n];
    }
}
