package com.mmrag.retrieval;

public interface Retriever {
    RetrievalStrategy strategy();

    RetrievalResult retrieve(RetrievalRequest request);
}
