package com.mmrag.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.capability.CompletionService;
import com.mmrag.capability.EmbeddingService;
import com.mmrag.error.CapabilityUnavailableException;

/**
 * Runs the query together with paraphrases produced by the completion capability and keeps
 * the best score seen for each chunk. Without usable paraphrases it falls back to a plain
 * semantic search and flags the result as degraded.
 */
public class ExpandedRetriever implements Retriever {
    private static final Logger log = LoggerFactory.getLogger(ExpandedRetriever.class);
    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s*");

    private final SemanticRetriever semantic;
    private final EmbeddingService embeddingService;
    private final CapabilityInvoker invoker;
    private final Optional<CompletionService> completionService;
    private final int variants;

    public ExpandedRetriever(
            SemanticRetriever semantic,
            EmbeddingService embeddingService,
            CapabilityInvoker invoker,
            Optional<CompletionService> completionService,
            int variants) {
        this.semantic = semantic;
        this.embeddingService = embeddingService;
        this.invoker = invoker;
        this.completionService = completionService;
        this.variants = variants;
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.EXPANDED;
    }

    @Override
    public RetrievalResult retrieve(RetrievalRequest request) {
        List<String> paraphrases = expand(request.query());
        if (paraphrases.isEmpty()) {
            List<RetrievalHit> hits = semantic.search(request.query(), request.nResults(), request.filter());
            return new RetrievalResult(request.query(), strategy(), hits, false, List.of(), true);
        }

        List<String> queries = new ArrayList<>();
        queries.add(request.query());
        queries.addAll(paraphrases);
        List<float[]> embeddings = invoker.read("embedding", () -> embeddingService.embedBatch(queries));
        if (embeddings.size() != queries.size()) {
            throw new CapabilityUnavailableException("embedding",
                    "expected " + queries.size() + " embeddings but received " + embeddings.size());
        }

        List<List<RetrievalHit>> candidates = new ArrayList<>();
        for (float[] embedding : embeddings) {
            candidates.add(semantic.searchByEmbedding(embedding, request.nResults(), request.filter()));
        }
        List<RetrievalHit> merged = CandidateMerger.maxScore(candidates, request.nResults());
        return new RetrievalResult(request.query(), strategy(), merged, false, paraphrases, false);
    }

    List<String> expand(String query) {
        if (completionService.isEmpty() || variants < 1) {
            log.info("retrieval.expanded.degraded reason=no_completion_capability");
            return List.of();
        }
        CompletionService completion = completionService.get();
        String raw;
        try {
            raw = invoker.read("completion", () -> completion.complete(prompt(query)));
        } catch (CapabilityUnavailableException e) {
            log.warn("retrieval.expanded.degraded reason={}", e.getMessage());
            return List.of();
        }
        List<String> paraphrases = parse(query, raw);
        if (paraphrases.isEmpty()) {
            log.warn("retrieval.expanded.degraded reason=no_usable_variants");
        }
        return paraphrases;
    }

    private String prompt(String query) {
        return """
                Given this query: "%s"

                Generate %d different variations of this query that could help find relevant information.
                Return only the queries, one per line, without numbering or explanation."""
                .formatted(query, variants);
    }

    private List<String> parse(String query, String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String original = query.strip().toLowerCase(Locale.ROOT);
        Set<String> seen = new LinkedHashSet<>();
        List<String> paraphrases = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            String candidate = LIST_MARKER.matcher(line).replaceFirst("").strip();
            if (candidate.length() > 1 && candidate.startsWith("\"") && candidate.endsWith("\"")) {
                candidate = candidate.substring(1, candidate.length() - 1).strip();
            }
            String key = candidate.toLowerCase(Locale.ROOT);
            if (candidate.isEmpty() || key.equals(original) || !seen.add(key)) {
                continue;
            }
            paraphrases.add(candidate);
            if (paraphrases.size() == variants) {
                break;
            }
        }
        return paraphrases;
    }
}
