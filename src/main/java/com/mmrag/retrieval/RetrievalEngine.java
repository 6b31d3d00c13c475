package com.mmrag.retrieval;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.cache.CacheKey;
import com.mmrag.cache.ResultCache;
import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.error.NoDataException;
import com.mmrag.error.ValidationException;
import com.mmrag.query.QueryClassifier;
import com.mmrag.query.QueryIntent;
import com.mmrag.store.VectorStore;

public class RetrievalEngine {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    private final Map<RetrievalStrategy, Retriever> retrievers = new EnumMap<>(RetrievalStrategy.class);
    private final QueryClassifier classifier;
    private final Reranker reranker;
    private final ResultCache cache;
    private final VectorStore store;
    private final CapabilityInvoker invoker;
    private final int maxResults;

    public RetrievalEngine(
            List<Retriever> retrievers,
            QueryClassifier classifier,
            Reranker reranker,
            ResultCache cache,
            VectorStore store,
            CapabilityInvoker invoker,
            int maxResults) {
        for (Retriever retriever : retrievers) {
            this.retrievers.put(retriever.strategy(), retriever);
        }
        for (RetrievalStrategy strategy : RetrievalStrategy.values()) {
            if (!this.retrievers.containsKey(strategy)) {
                throw new IllegalArgumentException("No retriever registered for strategy " + strategy.label());
            }
        }
        this.classifier = classifier;
        this.reranker = reranker;
        this.cache = cache;
        this.store = store;
        this.invoker = invoker;
        this.maxResults = maxResults;
    }

    public RetrievalResult retrieve(RetrievalRequest request) {
        validate(request);
        RetrievalStrategy strategy = request.strategy();
        if (strategy == null) {
            QueryIntent intent = classifier.classify(request.query());
            strategy = intent.defaultStrategy();
            log.debug("retrieval.strategy.resolved intent={} strategy={}", intent.label(), strategy.label());
        }
        RetrievalRequest resolved = request.resolve(strategy);
        return cache.getOrCompute(CacheKey.of(resolved), () -> compute(resolved));
    }

    public QueryIntent classify(String query) {
        return classifier.classify(query);
    }

    private RetrievalResult compute(RetrievalRequest request) {
        int stored = invoker.read("vector-store", store::count);
        if (stored == 0) {
            throw new NoDataException();
        }
        RetrievalResult result = retrievers.get(request.strategy()).retrieve(request);
        if (request.rerank()) {
            result = result.withHits(reranker.rerank(result.hits(), request.nResults()), true);
        }
        log.info("retrieval.completed strategy={} hits={} reranked={} degraded={}",
                result.strategy().label(), result.hits().size(), result.reranked(), result.degraded());
        return result;
    }

    private void validate(RetrievalRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new ValidationException("Query must not be blank");
        }
        if (request.nResults() < 1 || request.nResults() > maxResults) {
            throw new ValidationException("nResults must be between 1 and " + maxResults + " but was " + request.nResults());
        }
    }
}
