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
package com.docindex.server.store;

import com.docindex.core.model.StoreData;
import com.docindex.server.index.IndexSnapshot;
import lombok.Value;

/**
 * A store's options together with their derived indices, as held in the memory cache
 * and rebuilt from the two disk cache payloads.
 */
@Value
public class IndexedDataset {
    StoreData data;
    IndexSnapshot snapshot;
}
