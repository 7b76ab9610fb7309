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

import com.docindex.core.exception.DocIndexException;
import com.docindex.core.exception.IndexNotBuiltException;
import com.docindex.core.model.OptionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory multi-strategy search over option records.
 * 
 * <p>An index is either <em>empty</em> or <em>built</em>. Queries against an empty index
 * throw {@link IndexNotBuiltException} so callers can tell "not loaded" apart from
 * "no matches".</p>
 * 
 * <h3>Strategies</h3>
 * <ul>
 *   <li><strong>Exact:</strong> the query is an option name</li>
 *   <li><strong>Hierarchical:</strong> dotted query whose components prefix the name's
 *       components, plus a flat fallback over the prefix index</li>
 *   <li><strong>Word:</strong> query words found in the inverted word index</li>
 *   <li><strong>Fuzzy:</strong> long query words within a small edit distance of an indexed word</li>
 *   <li><strong>Phrase:</strong> double-quoted phrases found in a name or description</li>
 * </ul>
 * Scores are merged by taking the maximum per option and sorted by score descending,
 * then name. Exact matches always come first.
 * 
 * <h3>Rebuilds</h3>
 * The option map and its derived structures are built off to the side and published
 * with a single reference swap under {@code rebuildLock}; readers never see a partial
 * index.
 * 
 * @version 1.0.0
 */
@Slf4j
public class SearchIndex {
    
    private final SearchScoring scoring;
    private final ReentrantLock rebuildLock = new ReentrantLock();
    
    private volatile IndexState state;
    
    public SearchIndex(SearchScoring scoring) {
        this.scoring = scoring;
    }
    
    /**
     * Immutable composite of everything a query reads.
     */
    private static final class IndexState {
        final Map<String, OptionRecord> options;
        final IndexSnapshot snapshot;
        final Map<Integer, List<String>> wordsByLength;
        final Map<String, List<String>> childSegments;
        final List<String> rootSegments;
        final Map<String, Integer> categoryCounts;
        
        IndexState(Map<String, OptionRecord> options, IndexSnapshot snapshot) {
            this.options = Collections.unmodifiableMap(options);
            this.snapshot = snapshot;
            
            Map<Integer, List<String>> byLength = new HashMap<>();
            for (String word : snapshot.getWordIndex().keySet()) {
                byLength.computeIfAbsent(word.length(), k -> new ArrayList<>()).add(word);
            }
            this.wordsByLength = byLength;
            
            Map<String, List<String>> children = new HashMap<>();
            Set<String> roots = new TreeSet<>();
            for (HierarchyKey key : snapshot.getHierarchicalIndex().keySet()) {
                children.computeIfAbsent(key.getParentPath(), k -> new ArrayList<>()).add(key.getChildSegment());
                // A segment never contains a dot, so a dot-free parent is a first segment
                if (key.getParentPath().indexOf('.') < 0) {
                    roots.add(key.getParentPath());
                }
            }
            this.childSegments = children;
            this.rootSegments = new ArrayList<>(roots);
            
            Map<String, Integer> categories = new TreeMap<>();
            for (OptionRecord record : options.values()) {
                String category = record.getCategory() != null 
                        ? record.getCategory() : OptionRecord.categoryOf(record.getName());
                categories.merge(category, 1, Integer::sum);
            }
            this.categoryCounts = Collections.unmodifiableMap(categories);
        }
    }
    
    // ==================== Build / Adopt ====================
    
    /**
     * Replace the whole index with one built from {@code records}. Later records win
     * over earlier ones with the same name; records without a name are skipped.
     */
    public void build(Collection<OptionRecord> records) {
        long start = System.currentTimeMillis();
        Map<String, OptionRecord> options = new TreeMap<>();
        int skipped = 0;
        for (OptionRecord record : records) {
            if (record == null || record.getName() == null || record.getName().isBlank()) {
                skipped++;
                continue;
            }
            options.put(record.getName(), record);
        }
        IndexState next = new IndexState(options, IndexSnapshot.build(options.values()));
        publish(next);
        log.info("Built search index: {} options, {} words, {} prefixes in {} ms{}", 
                options.size(), next.snapshot.getWordIndex().size(), 
                next.snapshot.getPrefixIndex().size(), System.currentTimeMillis() - start,
                skipped > 0 ? " (" + skipped + " unnamed records skipped)" : "");
    }
    
    /**
     * Install previously built structures, for example ones restored from a cache.
     * 
     * @throws DocIndexException if the snapshot references names missing from {@code options}
     */
    public void adopt(Map<String, OptionRecord> options, IndexSnapshot snapshot) {
        Set<String> dangling = snapshot.danglingNames(options);
        if (!dangling.isEmpty()) {
            throw new DocIndexException(DocIndexException.ErrorCode.INVALID_ARGUMENT, 
                    "Index snapshot references " + dangling.size() + " unknown options, e.g. " 
                    + dangling.iterator().next());
        }
        publish(new IndexState(new TreeMap<>(options), snapshot));
        log.info("Adopted search index with {} options", options.size());
    }
    
    public void clear() {
        publish(null);
    }
    
    public boolean isBuilt() {
        return state != null;
    }
    
    private void publish(IndexState next) {
        rebuildLock.lock();
        try {
            state = next;
        } finally {
            rebuildLock.unlock();
        }
    }
    
    // ==================== Queries ====================
    
    public SearchResult search(String query, int limit) {
        IndexState s = requireBuilt("search");
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty() || limit <= 0) {
            return SearchResult.empty();
        }
        
        Map<String, Integer> exact = new LinkedHashMap<>();
        if (s.options.containsKey(trimmed)) {
            exact.put(trimmed, scoring.getExactMatch());
        }
        
        List<String> phrases = QueryTokenizer.quotedPhrases(trimmed);
        List<String> words = QueryTokenizer.queryWords(trimmed, scoring.getWholeQueryMaxLength());
        
        List<Map<String, Integer>> strategies = new ArrayList<>();
        strategies.add(prefixMatches(s, trimmed));
        strategies.add(wordMatches(s, words));
        strategies.add(fuzzyMatches(s, words));
        if (!phrases.isEmpty()) {
            strategies.add(phraseMatches(s, phrases));
        }
        
        Map<String, Integer> merged = new HashMap<>();
        for (Map<String, Integer> matches : strategies) {
            for (Map.Entry<String, Integer> e : matches.entrySet()) {
                if (!exact.containsKey(e.getKey())) {
                    merged.merge(e.getKey(), e.getValue(), Math::max);
                }
            }
        }
        
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(exact.entrySet());
        List<Map.Entry<String, Integer>> others = new ArrayList<>(merged.entrySet());
        others.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        ranked.addAll(others);
        
        List<SearchHit> hits = new ArrayList<>(Math.min(limit, ranked.size()));
        for (Map.Entry<String, Integer> e : ranked) {
            if (hits.size() >= limit) {
                break;
            }
            hits.add(new SearchHit(s.options.get(e.getKey()), e.getValue()));
        }
        if (hits.isEmpty()) {
            log.debug("No results for query: {}", trimmed);
        }
        return new SearchResult(Collections.unmodifiableList(hits), ranked.size());
    }
    
    public Optional<OptionRecord> get(String name) {
        return Optional.ofNullable(requireBuilt("get option").options.get(name));
    }
    
    /**
     * Names strictly below {@code prefix}, sorted.
     */
    public List<String> namesBelow(String prefix) {
        IndexState s = requireBuilt("list options by prefix");
        return new ArrayList<>(new TreeSet<>(s.snapshot.namesBelow(prefix)));
    }
    
    /**
     * Options strictly below {@code prefix} plus any whose name starts with
     * {@code prefix + "."}, sorted by name.
     */
    public List<OptionRecord> optionsUnder(String prefix) {
        IndexState s = requireBuilt("list options by prefix");
        Set<String> names = new TreeSet<>(s.snapshot.namesBelow(prefix));
        if (!prefix.endsWith(".")) {
            names.addAll(s.snapshot.namesWithPrefix(prefix));
            names.remove(prefix);
        }
        List<OptionRecord> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(s.options.get(name));
        }
        return result;
    }
    
    public Map<String, OptionRecord> getOptions() {
        return requireBuilt("list options").options;
    }
    
    public IndexSnapshot getSnapshot() {
        return requireBuilt("snapshot").snapshot;
    }
    
    public Map<String, Integer> getCategoryCounts() {
        return requireBuilt("list categories").categoryCounts;
    }
    
    public int size() {
        IndexState s = state;
        return s == null ? 0 : s.options.size();
    }
    
    public Map<String, Object> getStatistics() {
        IndexState s = state;
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("built", s != null);
        stats.put("options", s == null ? 0 : s.options.size());
        stats.put("names", s == null ? 0 : s.snapshot.getNameIndex().size());
        stats.put("prefixes", s == null ? 0 : s.snapshot.getPrefixIndex().size());
        stats.put("words", s == null ? 0 : s.snapshot.getWordIndex().size());
        stats.put("hierarchicalParts", s == null ? 0 : s.snapshot.getHierarchicalIndex().size());
        stats.put("categories", s == null ? 0 : s.categoryCounts.size());
        return stats;
    }
    
    // ==================== Strategies ====================
    
    private Map<String, Integer> prefixMatches(IndexState s, String query) {
        Map<String, Integer> matches = new HashMap<>();
        String[] queryParts = query.split("\\.");
        String queryLower = query.toLowerCase(Locale.ROOT);
        
        if (queryParts.length > 1) {
            for (String name : hierarchicalCandidates(s, queryLower.split("\\."))) {
                int score = scoring.getHierarchicalBase() - (name.length() - query.length());
                matches.merge(name, score, Math::max);
            }
        }
        
        for (String part : queryParts) {
            if (part.isEmpty()) {
                continue;
            }
            String partLower = part.toLowerCase(Locale.ROOT);
            for (String name : s.snapshot.namesBelow(part)) {
                String nameLower = name.toLowerCase(Locale.ROOT);
                int position = nameLower.indexOf(partLower);
                if (position < 0) {
                    continue;
                }
                int score = scoring.getPrefixMatch();
                if (position == 0 || ".-_".indexOf(nameLower.charAt(position - 1)) >= 0) {
                    score += scoring.getPrefixBoundaryBonus();
                }
                score -= (int) (position * scoring.getPrefixPositionPenalty());
                matches.merge(name, score, Math::max);
            }
        }
        return matches;
    }
    
    /**
     * Names whose leading segments start with the corresponding query parts, ignoring case.
     * Walks the hierarchical index one level at a time from the first segments down.
     */
    private static Set<String> hierarchicalCandidates(IndexState s, String[] lowerParts) {
        List<String> paths = new ArrayList<>();
        for (String root : s.rootSegments) {
            if (root.toLowerCase(Locale.ROOT).startsWith(lowerParts[0])) {
                paths.add(root);
            }
        }
        Set<String> names = new HashSet<>();
        for (int level = 1; level < lowerParts.length && !paths.isEmpty(); level++) {
            boolean last = level == lowerParts.length - 1;
            List<String> next = new ArrayList<>();
            for (String parent : paths) {
                for (String segment : s.childSegments.getOrDefault(parent, List.of())) {
                    if (!segment.toLowerCase(Locale.ROOT).startsWith(lowerParts[level])) {
                        continue;
                    }
                    if (last) {
                        names.addAll(s.snapshot.namesUnder(parent, segment));
                    } else {
                        next.add(parent + "." + segment);
                    }
                }
            }
            paths = next;
        }
        return names;
    }
    
    private Map<String, Integer> wordMatches(IndexState s, List<String> words) {
        Map<String, Integer> matches = new HashMap<>();
        for (String word : words) {
            for (String name : s.snapshot.namesWithWord(word)) {
                int score = scoring.getWordMatch();
                int occurrences = countOccurrences(name.toLowerCase(Locale.ROOT), word);
                if (occurrences > 1) {
                    score += scoring.getWordRepeatBonus() * (occurrences - 1);
                }
                matches.merge(name, score, Math::max);
            }
        }
        return matches;
    }
    
    private Map<String, Integer> fuzzyMatches(IndexState s, List<String> words) {
        Map<String, Integer> matches = new HashMap<>();
        int tolerance = scoring.getFuzzyLengthTolerance();
        for (String word : words) {
            if (word.length() < scoring.getFuzzyMinWordLength()) {
                continue;
            }
            for (int len = word.length() - tolerance; len <= word.length() + tolerance; len++) {
                for (String indexWord : s.wordsByLength.getOrDefault(len, List.of())) {
                    int distance = LevenshteinDistance.compute(word, indexWord);
                    if (distance > scoring.getFuzzyMaxDistance()) {
                        continue;
                    }
                    int score = scoring.getFuzzyBase() - distance * scoring.getFuzzyStep();
                    for (String name : s.snapshot.namesWithWord(indexWord)) {
                        matches.merge(name, score, Math::max);
                    }
                }
            }
        }
        return matches;
    }
    
    private Map<String, Integer> phraseMatches(IndexState s, List<String> phrases) {
        Map<String, Integer> matches = new HashMap<>();
        for (String phrase : phrases) {
            String phraseLower = phrase.toLowerCase(Locale.ROOT);
            for (OptionRecord record : s.options.values()) {
                int score = 0;
                if (record.getName().toLowerCase(Locale.ROOT).contains(phraseLower)) {
                    score = scoring.getPhraseNameMatch();
                } else if (record.getDescription() != null 
                        && record.getDescription().toLowerCase(Locale.ROOT).contains(phraseLower)) {
                    score = scoring.getPhraseDescriptionMatch();
                }
                if (score > 0) {
                    matches.merge(record.getName(), score, Math::max);
                }
            }
        }
        return matches;
    }
    
    // ==================== Helper Methods ====================
    
    private IndexState requireBuilt(String operation) {
        IndexState s = state;
        if (s == null) {
            throw IndexNotBuiltException.forOperation(operation);
        }
        return s;
    }
    
    private static int countOccurrences(String text, String word) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(word, from)) >= 0) {
            count++;
            from += word.length();
        }
        return count;
    }
}
