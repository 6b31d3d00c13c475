package com.mmrag.store;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.mmrag.document.Chunk;

/**
 * In-memory store that counts calls and can be told to fail selected operations.
 */
public class RecordingVectorStore implements VectorStore {
    private final InMemoryVectorStore delegate = new InMemoryVectorStore();
    public final AtomicInteger puts = new AtomicInteger();
    public final AtomicInteger queries = new AtomicInteger();
    public final AtomicInteger keywordQueries = new AtomicInteger();
    public final AtomicInteger counts = new AtomicInteger();
    public volatile String failPutsForSource;
    public volatile int failAfterPuts = -1;
    public volatile boolean failKeywordQueries;

    @Override
    public String put(Chunk chunk, float[] embedding) {
        if (chunk.sourceName().equals(failPutsForSource) && chunk.position() >= failAfterPuts) {
            throw new IllegalStateException("disk full");
        }
        puts.incrementAndGet();
        return delegate.put(chunk, embedding);
    }

    @Override
    public List<StoreMatch> query(float[] embedding, int k, Map<String, Object> filter) {
        queries.incrementAndGet();
        return delegate.query(embedding, k, filter);
    }

    @Override
    public List<StoreMatch> keywordQuery(Set<String> terms, int k, Map<String, Object> filter) {
        keywordQueries.incrementAndGet();
        if (failKeywordQueries) {
            throw new IllegalStateException("keyword index offline");
        }
        return delegate.keywordQuery(terms, k, filter);
    }

    @Override
    public int delete(String documentId) {
        return delegate.delete(documentId);
    }

    @Override
    public int count() {
        counts.incrementAndGet();
        return delegate.count();
    }

    @Override
    public int documentCount() {
        return delegate.documentCount();
    }

    public int roundTrips() {
        return queries.get() + keywordQueries.get() + counts.get();
    }
}
