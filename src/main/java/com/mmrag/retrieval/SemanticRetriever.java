package com.mmrag.retrieval;

import java.util.List;
import java.util.Map;

import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.capability.EmbeddingService;
import com.mmrag.store.StoreMatch;
import com.mmrag.store.VectorStore;

public class SemanticRetriever implements Retriever {
    private final EmbeddingService embeddingService;
    private final VectorStore store;
    private final CapabilityInvoker invoker;

    public SemanticRetriever(EmbeddingService embeddingService, VectorStore store, CapabilityInvoker invoker) {
        this.embeddingService = embeddingService;
        this.store = store;
        this.invoker = invoker;
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.SEMANTIC;
    }

    @Override
    public RetrievalResult retrieve(RetrievalRequest request) {
        return RetrievalResult.of(request.query(), strategy(), search(request.query(), request.nResults(), request.filter()));
    }

    List<RetrievalHit> search(String query, int nResults, Map<String, Object> filter) {
        float[] embedding = invoker.read("embedding", () -> embeddingService.embed(query));
        return searchByEmbedding(embedding, nResults, filter);
    }

    List<RetrievalHit> searchByEmbedding(float[] embedding, int nResults, Map<String, Object> filter) {
        List<StoreMatch> matches = invoker.read("vector-store", () -> store.query(embedding, nResults, filter));
        return matches.stream()
                .map(match -> new RetrievalHit(match.chunk(), clamp(match.score())))
                .sorted(CandidateMerger.RANKING)
                .toList();
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(1, score));
    }
}
