package com.mmrag.answer;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.capability.CompletionService;
import com.mmrag.error.CapabilityUnavailableException;
import com.mmrag.retrieval.RetrievalEngine;
import com.mmrag.retrieval.RetrievalHit;
import com.mmrag.retrieval.RetrievalRequest;
import com.mmrag.retrieval.RetrievalResult;
import com.mmrag.retrieval.RetrievalStrategy;

/**
 * Answers a question from retrieved context. The completion capability writes the answer
 * when it is configured and reachable; otherwise the best-matching sentence of each source
 * is quoted.
 */
public class AnswerService {
    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    private final RetrievalEngine engine;
    private final Optional<CompletionService> completionService;
    private final CapabilityInvoker invoker;

    public AnswerService(RetrievalEngine engine, Optional<CompletionService> completionService, CapabilityInvoker invoker) {
        this.engine = engine;
        this.completionService = completionService;
        this.invoker = invoker;
    }

    public Answer answer(String query, int nResults) {
        RetrievalResult result = engine.retrieve(
                new RetrievalRequest(query, nResults, RetrievalStrategy.EXPANDED, Map.of(), false));
        List<RetrievalHit> hits = result.hits();
        if (hits.isEmpty()) {
            return new Answer(query, "No relevant content was found for this question.", hits, false);
        }
        if (completionService.isPresent()) {
            CompletionService completion = completionService.get();
            try {
                String text = invoker.read("completion", () -> completion.complete(prompt(query, hits)));
                if (text != null && !text.isBlank()) {
                    return new Answer(query, text.strip(), hits, true);
                }
                log.warn("answer.synthesis.empty query_length={}", query.length());
            } catch (CapabilityUnavailableException e) {
                log.warn("answer.synthesis.failed reason={}", e.getMessage());
            }
        }
        return new Answer(query, extractive(query, hits), hits, false);
    }

    static String prompt(String query, List<RetrievalHit> hits) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < hits.size(); i++) {
            if (i > 0) {
                context.append("\n\n");
            }
            context.append('[').append(i + 1).append("] ").append(hits.get(i).chunk().text());
        }
        return """
                Answer the following query using the provided context. If the context doesn't contain enough information, say so.

                Query: %s

                Context:
                %s

                Answer:""".formatted(query, context);
    }

    static String extractive(String query, List<RetrievalHit> hits) {
        Set<String> keywords = keywords(query);
        return hits.stream()
                .map(hit -> "[%s] %s".formatted(hit.chunk().sourceName(), firstMatchingSentence(hit.chunk().text(), keywords)))
                .distinct()
                .collect(Collectors.joining("\n"));
    }

    private static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstMatchingSentence(String text, Set<String> keywords) {
        if (text == null || text.isBlank()) {
            return "(empty snippet)";
        }
        String[] sentences = text.strip().split("(?<=[.!?])\\s+");
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                return sentence.strip();
            }
        }
        return sentences[0].strip();
    }
}
