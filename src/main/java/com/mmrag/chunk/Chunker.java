package com.mmrag.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mmrag.error.ValidationException;

public class Chunker {
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n[ \\t]*\\n\\s*");

    private final int maxChunkSize;
    private final int overlap;

    public Chunker(int maxChunkSize, int overlap) {
        if (maxChunkSize < 1) {
            throw new ValidationException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (overlap < 0 || overlap >= maxChunkSize) {
            throw new ValidationException("overlap must be in [0, %d): %d".formatted(maxChunkSize, overlap));
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    public int overlap() {
        return overlap;
    }

    public List<TextSpan> chunk(String text) {
        String source = text == null ? "" : text;
        if (source.length() <= maxChunkSize) {
            return List.of(new TextSpan(source, 0, source.length()));
        }

        TreeSet<Integer> boundaries = sentenceBoundaries(source);
        List<TextSpan> spans = new ArrayList<>();
        int start = 0;
        int previousEnd = 0;
        while (true) {
            int limit = start + maxChunkSize;
            if (limit >= source.length()) {
                spans.add(new TextSpan(source.substring(start), start, source.length()));
                return spans;
            }
            // every window must end past the previous one and past the overlap region
            int floor = Math.max(start + overlap, previousEnd);
            Integer boundary = boundaries.floor(limit);
            int end = boundary != null && boundary > floor
                    ? boundary
                    : whitespaceCut(source, floor, limit);
            spans.add(new TextSpan(source.substring(start, end), start, end));
            start = nextStart(source, start, end);
            previousEnd = end;
        }
    }

    private int nextStart(String source, int start, int end) {
        int candidate = end - overlap;
        int wordStart = candidate;
        while (wordStart > start + 1 && !Character.isWhitespace(source.charAt(wordStart - 1))) {
            wordStart--;
        }
        if (Character.isWhitespace(source.charAt(wordStart - 1))) {
            return wordStart;
        }
        return candidate;
    }

    private static int whitespaceCut(String source, int floor, int limit) {
        for (int i = limit - 1; i >= floor; i--) {
            if (Character.isWhitespace(source.charAt(i))) {
                return i + 1;
            }
        }
        return limit;
    }

    private static TreeSet<Integer> sentenceBoundaries(String source) {
        TreeSet<Integer> boundaries = new TreeSet<>();
        Matcher matcher = SENTENCE_BREAK.matcher(source);
        while (matcher.find()) {
            boundaries.add(matcher.end());
        }
        return boundaries;
    }
}
