package com.mmrag.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.mmrag.retrieval.RetrievalStrategy;

public enum QueryIntent {
    FACTUAL("factual", RetrievalStrategy.SEMANTIC),
    EXPLORATORY("exploratory", RetrievalStrategy.EXPANDED),
    CROSS_MODAL("cross_modal", RetrievalStrategy.HYBRID);

    private final String label;
    private final RetrievalStrategy defaultStrategy;

    QueryIntent(String label, RetrievalStrategy defaultStrategy) {
        this.label = label;
        this.defaultStrategy = defaultStrategy;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public RetrievalStrategy defaultStrategy() {
        return defaultStrategy;
    }
}
