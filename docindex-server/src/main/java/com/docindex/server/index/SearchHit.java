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

import com.docindex.core.model.OptionRecord;
import lombok.Value;

/**
 * An option matched by a search, with its merged score.
 */
@Value
public class SearchHit {
    OptionRecord option;
    int score;
}
