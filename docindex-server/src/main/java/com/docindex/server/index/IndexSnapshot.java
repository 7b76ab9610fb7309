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
import lombok.Getter;

import java.io.Serializable;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The four derived lookup structures of a {@link SearchIndex}.
 * 
 * <ul>
 *   <li><b>nameIndex</b> - every dotted prefix of a name, the name itself included,
 *       to the sorted names sharing it</li>
 *   <li><b>prefixIndex</b> - every proper prefix to the names strictly below it</li>
 *   <li><b>wordIndex</b> - lowercase word (3+ chars) of a name or description to names</li>
 *   <li><b>hierarchicalIndex</b> - (parent path, next segment) to names</li>
 * </ul>
 * 
 * <p>Built in one pass and never mutated afterwards; persisted as the binary payload
 * of a store's disk cache entry.</p>
 */
@Getter
public class IndexSnapshot implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    private final HashMap<String, TreeSet<String>> nameIndex;
    private final HashMap<String, HashSet<String>> prefixIndex;
    private final HashMap<String, HashSet<String>> wordIndex;
    private final HashMap<HierarchyKey, HashSet<String>> hierarchicalIndex;
    
    private IndexSnapshot(HashMap<String, TreeSet<String>> nameIndex,
                          HashMap<String, HashSet<String>> prefixIndex,
                          HashMap<String, HashSet<String>> wordIndex,
                          HashMap<HierarchyKey, HashSet<String>> hierarchicalIndex) {
        this.nameIndex = nameIndex;
        this.prefixIndex = prefixIndex;
        this.wordIndex = wordIndex;
        this.hierarchicalIndex = hierarchicalIndex;
    }
    
    public static IndexSnapshot build(Collection<OptionRecord> records) {
        HashMap<String, TreeSet<String>> nameIndex = new HashMap<>();
        HashMap<String, HashSet<String>> prefixIndex = new HashMap<>();
        HashMap<String, HashSet<String>> wordIndex = new HashMap<>();
        HashMap<HierarchyKey, HashSet<String>> hierarchicalIndex = new HashMap<>();
        
        for (OptionRecord record : records) {
            String name = record.getName();
            String[] parts = name.split("\\.");
            
            StringBuilder prefix = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    hierarchicalIndex.computeIfAbsent(new HierarchyKey(prefix.toString(), parts[i]), 
                            k -> new HashSet<>()).add(name);
                    prefix.append('.');
                }
                prefix.append(parts[i]);
                String current = prefix.toString();
                nameIndex.computeIfAbsent(current, k -> new TreeSet<>()).add(name);
                if (i < parts.length - 1) {
                    prefixIndex.computeIfAbsent(current, k -> new HashSet<>()).add(name);
                }
            }
            // The split drops empty trailing segments, so make sure the full name is keyed
            nameIndex.computeIfAbsent(name, k -> new TreeSet<>()).add(name);
            
            String text = record.getDescription() == null ? name : name + " " + record.getDescription();
            for (String word : QueryTokenizer.indexWords(text)) {
                wordIndex.computeIfAbsent(word, k -> new HashSet<>()).add(name);
            }
        }
        return new IndexSnapshot(nameIndex, prefixIndex, wordIndex, hierarchicalIndex);
    }
    
    public Set<String> namesWithPrefix(String prefix) {
        Set<String> names = nameIndex.get(prefix);
        return names != null ? names : Set.of();
    }
    
    public Set<String> namesBelow(String prefix) {
        Set<String> names = prefixIndex.get(prefix);
        return names != null ? names : Set.of();
    }
    
    public Set<String> namesWithWord(String word) {
        Set<String> names = wordIndex.get(word);
        return names != null ? names : Set.of();
    }
    
    public Set<String> namesUnder(String parentPath, String childSegment) {
        Set<String> names = hierarchicalIndex.get(new HierarchyKey(parentPath, childSegment));
        return names != null ? names : Set.of();
    }
    
    /**
     * Names referenced by any of the four structures that are not in {@code options}.
     */
    public Set<String> danglingNames(Map<String, OptionRecord> options) {
        Set<String> dangling = new TreeSet<>();
        collectDangling(nameIndex.values(), options, dangling);
        collectDangling(prefixIndex.values(), options, dangling);
        collectDangling(wordIndex.values(), options, dangling);
        collectDangling(hierarchicalIndex.values(), options, dangling);
        return dangling;
    }
    
    private static void collectDangling(Collection<? extends Set<String>> groups, 
                                        Map<String, OptionRecord> options, Set<String> dangling) {
        for (Set<String> names : groups) {
            for (String name : names) {
                if (!options.containsKey(name)) {
                    dangling.add(name);
                }
            }
        }
    }
}
