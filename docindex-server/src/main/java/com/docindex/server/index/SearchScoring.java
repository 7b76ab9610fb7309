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

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Scores and thresholds used by {@link SearchIndex}.
 * Bound from {@code docindex.search.*}; the defaults are the calibrated values.
 */
@Data
public class SearchScoring {
    
    @Min(1)
    private int exactMatch = 100;
    
    /**
     * Base of the hierarchical path match, reduced by the length difference
     */
    private int hierarchicalBase = 100;
    
    private int prefixMatch = 80;
    
    private int prefixBoundaryBonus = 10;
    
    private double prefixPositionPenalty = 0.5;
    
    private int wordMatch = 60;
    
    private int wordRepeatBonus = 5;
    
    private int fuzzyBase = 40;
    
    private int fuzzyStep = 10;
    
    @Min(1)
    private int fuzzyMinWordLength = 5;
    
    @Min(0)
    private int fuzzyMaxDistance = 2;
    
    @Min(0)
    private int fuzzyLengthTolerance = 1;
    
    private int phraseNameMatch = 90;
    
    private int phraseDescriptionMatch = 50;
    
    /**
     * Queries shorter than this without spaces are also tried as a single term
     */
    private int wholeQueryMaxLength = 50;
    
    @Min(1)
    private int defaultLimit = 20;
}
