package com.mmrag.retrieval;

import java.util.List;

public record RetrievalResult(
        String query,
        RetrievalStrategy strategy,
        List<RetrievalHit> hits,
        boolean reranked,
        List<String> expandedQueries,
        boolean degraded) {

    public RetrievalResult {
        hits = List.copyOf(hits);
        expandedQueries = expandedQueries == null ? List.of() : List.copyOf(expandedQueries);
    }

    static RetrievalResult of(String query, RetrievalStrategy strategy, List<RetrievalHit> hits) {
        return new RetrievalResult(query, strategy, hits, false, List.of(), false);
    }

    RetrievalResult withHits(List<RetrievalHit> rankedHits, boolean rerankedHits) {
        return new RetrievalResult(query, strategy, rankedHits, rerankedHits, expandedQueries, degraded);
    }
}
