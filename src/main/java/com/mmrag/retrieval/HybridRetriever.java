package com.mmrag.retrieval;

import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.error.CapabilityUnavailableException;
import com.mmrag.store.StoreMatch;
import com.mmrag.store.TermOverlap;
import com.mmrag.store.VectorStore;

/**
 * Blends dense similarity with keyword overlap. Both candidate lists are scaled so their best
 * score is 1 before the weighted sum.
 */
public class HybridRetriever implements Retriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private final SemanticRetriever semantic;
    private final VectorStore store;
    private final CapabilityInvoker invoker;
    private final double semanticWeight;
    private final double lexicalWeight;

    public HybridRetriever(
            SemanticRetriever semantic,
            VectorStore store,
            CapabilityInvoker invoker,
            double semanticWeight,
            double lexicalWeight) {
        this.semantic = semantic;
        this.store = store;
        this.invoker = invoker;
        this.semanticWeight = semanticWeight;
        this.lexicalWeight = lexicalWeight;
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.HYBRID;
    }

    @Override
    public RetrievalResult retrieve(RetrievalRequest request) {
        List<RetrievalHit> dense = semantic.search(request.query(), request.nResults(), request.filter());
        Set<String> terms = TermOverlap.terms(request.query());
        List<RetrievalHit> lexical;
        try {
            lexical = terms.isEmpty() ? List.of() : keywordSearch(terms, request);
        } catch (CapabilityUnavailableException e) {
            log.warn("retrieval.hybrid.degraded query_terms={} reason={}", terms.size(), e.getMessage());
            return new RetrievalResult(request.query(), strategy(), dense, false, List.of(), true);
        }

        List<RetrievalHit> merged = CandidateMerger.weightedSum(
                CandidateMerger.normalizeByMax(dense),
                semanticWeight,
                CandidateMerger.normalizeByMax(lexical),
                lexicalWeight,
                request.nResults());
        return RetrievalResult.of(request.query(), strategy(), merged);
    }

    private List<RetrievalHit> keywordSearch(Set<String> terms, RetrievalRequest request) {
        List<StoreMatch> matches = invoker.read("vector-store",
                () -> store.keywordQuery(terms, request.nResults(), request.filter()));
        return matches.stream()
                .map(match -> new RetrievalHit(match.chunk(), match.score()))
                .toList();
    }
}
