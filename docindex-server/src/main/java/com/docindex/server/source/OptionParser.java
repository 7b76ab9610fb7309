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

import com.docindex.core.model.OptionRecord;

import java.util.List;

/**
 * Turns the raw text of one document into option records.
 */
@FunctionalInterface
public interface OptionParser {
    
    /**
     * @throws com.docindex.core.exception.SourceException if the text cannot be parsed
     */
    List<OptionRecord> parse(String documentId, String rawText);
}
