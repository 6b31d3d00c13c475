package com.mmrag.query;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.mmrag.error.ValidationException;

/**
 * Rule-based intent detection. Rules are checked in order: factual question markers,
 * then modality terms, then short or vague phrasing. Anything left over is factual.
 */
public class QueryClassifier {
    private static final List<Pattern> FACTUAL_MARKERS = compile(
            "\\bwhat (?:is|are)\\b",
            "\\bwho is\\b",
            "\\bwhen did\\b",
            "\\bwhere is\\b",
            "\\bhow (?:many|much)\\b",
            "\\bdefine\\b",
            "\\bexplain\\b");
    private static final List<Pattern> MODALITY_TERMS = compile(
            "\\bimages?\\b",
            "\\bdiagrams?\\b",
            "\\bpictures?\\b",
            "\\bphotos?\\b",
            "\\bfigures?\\b",
            "\\bcharts?\\b",
            "\\bvisual\\b",
            "\\bscreenshots?\\b",
            "\\bshown\\b");
    private static final List<Pattern> VAGUE_TERMS = compile(
            "\\boverview\\b",
            "\\btell me about\\b",
            "\\brecent\\b",
            "\\binformation about\\b",
            "\\banything about\\b",
            "\\brelated to\\b",
            "\\bsimilar to\\b",
            "\\bsummari[sz]e\\b");

    private final int shortQueryMaxWords;

    public QueryClassifier(int shortQueryMaxWords) {
        this.shortQueryMaxWords = shortQueryMaxWords;
    }

    public QueryIntent classify(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must not be blank");
        }
        String normalized = query.strip().toLowerCase(Locale.ROOT);
        if (matchesAny(FACTUAL_MARKERS, normalized)) {
            return QueryIntent.FACTUAL;
        }
        if (matchesAny(MODALITY_TERMS, normalized)) {
            return QueryIntent.CROSS_MODAL;
        }
        if (normalized.split("\\s+").length <= shortQueryMaxWords || matchesAny(VAGUE_TERMS, normalized)) {
            return QueryIntent.EXPLORATORY;
        }
        return QueryIntent.FACTUAL;
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static List<Pattern> compile(String... expressions) {
        return Arrays.stream(expressions).map(Pattern::compile).toList();
    }
}
