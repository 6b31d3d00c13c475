package com.mmrag.store;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mmrag.document.Chunk;

public interface VectorStore {
    String put(Chunk chunk, float[] embedding);

    List<StoreMatch> query(float[] embedding, int k, Map<String, Object> filter);

    List<StoreMatch> keywordQuery(Set<String> terms, int k, Map<String, Object> filter);

    int delete(String documentId);

    int count();

    int documentCount();
}
