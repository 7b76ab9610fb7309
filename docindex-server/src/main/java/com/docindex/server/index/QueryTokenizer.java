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

import com.docindex.core.constants.DocIndexConstants;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits option text and queries into lowercase word tokens.
 */
final class QueryTokenizer {
    
    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    
    private QueryTokenizer() {
        // Prevent instantiation
    }
    
    /**
     * Distinct lowercase words long enough to be indexed.
     */
    static Set<String> indexWords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            String word = m.group().toLowerCase(Locale.ROOT);
            if (word.length() >= DocIndexConstants.MIN_INDEXED_WORD_LENGTH) {
                words.add(word);
            }
        }
        return words;
    }
    
    static List<String> quotedPhrases(String query) {
        List<String> phrases = new ArrayList<>();
        Matcher m = QUOTED.matcher(query);
        while (m.find()) {
            phrases.add(m.group(1));
        }
        return phrases;
    }
    
    static String stripQuoted(String query) {
        return QUOTED.matcher(query).replaceAll("").trim();
    }
    
    /**
     * Words of the unquoted query plus, for short single-term queries, the whole
     * query lowercased.
     */
    static List<String> queryWords(String query, int wholeQueryMaxLength) {
        List<String> words = new ArrayList<>(indexWords(stripQuoted(query)));
        String whole = query.toLowerCase(Locale.ROOT);
        if (query.length() < wholeQueryMaxLength && !query.contains(" ") && !words.contains(whole)) {
            words.add(whole);
        }
        return words;
    }
}
