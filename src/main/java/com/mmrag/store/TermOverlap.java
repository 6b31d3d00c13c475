package com.mmrag.store;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class TermOverlap {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "did", "do", "does", "for", "from", "how",
            "in", "is", "it", "me", "of", "on", "or", "the", "to", "was", "what", "when", "where",
            "which", "who", "why", "with");

    private TermOverlap() {
    }

    public static Set<String> terms(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .filter(token -> !STOP_WORDS.contains(token))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static boolean isStopWord(String token) {
        return STOP_WORDS.contains(token);
    }

    public static double score(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty() || text == null || text.isBlank()) {
            return 0.0;
        }
        Set<String> words = terms(text);
        long matches = queryTerms.stream().filter(words::contains).count();
        return (double) matches / queryTerms.size();
    }
}
