package com.mmrag.answer;

import java.util.List;

import com.mmrag.retrieval.RetrievalHit;

public record Answer(String query, String text, List<RetrievalHit> sources, boolean synthesized) {

    public Answer {
        sources = List.copyOf(sources);
    }
}
