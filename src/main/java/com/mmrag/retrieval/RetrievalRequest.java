package com.mmrag.retrieval;

import java.util.Map;

public record RetrievalRequest(
        String query,
        int nResults,
        RetrievalStrategy strategy,
        Map<String, Object> filter,
        boolean rerank) {

    public RetrievalRequest {
        filter = filter == null ? Map.of() : Map.copyOf(filter);
    }

    public static RetrievalRequest of(String query, int nResults) {
        return new RetrievalRequest(query, nResults, null, Map.of(), false);
    }

    /**
     * The request as it is cached and computed: surrounding whitespace removed from the query
     * and the strategy fixed.
     */
    public RetrievalRequest resolve(RetrievalStrategy resolved) {
        return new RetrievalRequest(query.strip(), nResults, resolved, filter, rerank);
    }
}
