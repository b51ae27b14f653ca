package com.paperradar.common.scoring;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Splits titles and abstracts into the distinct terms keyword novelty is measured on.
 * Stop words include the field's boilerplate vocabulary, which says nothing about novelty.
 */
public final class KeywordExtractor {

    static final int MIN_TERM_LENGTH = 3;

    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "with", "that", "this", "from", "are", "our", "can", "which",
        "these", "their", "such", "also", "has", "have", "been", "was", "were", "not", "its",
        "than", "into", "over", "both", "while", "other", "more", "most", "using", "based",
        "via", "show", "paper", "propose", "proposed", "approach", "method", "methods",
        "results", "model", "models", "learning", "neural", "network", "networks", "deep",
        "training", "data", "dataset", "task", "tasks", "performance", "state", "art", "new",
        "novel", "framework");

    private KeywordExtractor() {}

    /** Distinct lower-cased terms of {@code text}, in natural order. Empty for null text. */
    public static Set<String> terms(String text) {
        Set<String> terms = new TreeSet<>();
        if (text == null || text.isBlank()) return terms;
        for (String token : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TERM_LENGTH && !STOP_WORDS.contains(token)) terms.add(token);
        }
        return terms;
    }

    static Set<String> terms(String title, String abstractText) {
        Set<String> terms = terms(title);
        terms.addAll(terms(abstractText));
        return terms;
    }
}
