package com.mmrag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.mmrag.document.Chunk;
import com.mmrag.document.Modality;

class CandidateMergerTest {

    @Test
    void shouldSumWeightedScoresPerChunk() {
        List<RetrievalHit> dense = List.of(hit("a", 1.0), hit("b", 0.5));
        List<RetrievalHit> lexical = List.of(hit("b", 1.0), hit("c", 0.5));

        List<RetrievalHit> merged = CandidateMerger.weightedSum(dense, 0.7, lexical, 0.3, 3);

        assertEquals(List.of("a#0", "b#0", "c#0"), merged.stream().map(h -> h.chunk().id()).toList());
        assertEquals(0.70, merged.get(0).score(), 1e-9);
        assertEquals(0.65, merged.get(1).score(), 1e-9);
        assertEquals(0.15, merged.get(2).score(), 1e-9);
    }

    @Test
    void shouldKeepMaximumScoreAcrossQueryVariants() {
        List<RetrievalHit> merged = CandidateMerger.maxScore(List.of(
                List.of(hit("a", 0.4), hit("b", 0.9)),
                List.of(hit("a", 0.8), hit("c", 0.1))), 2);

        assertEquals(List.of("b#0", "a#0"), merged.stream().map(h -> h.chunk().id()).toList());
        assertEquals(0.8, merged.get(1).score(), 1e-9);
    }

    @Test
    void shouldNormalizeByMaximum() {
        List<RetrievalHit> normalized = CandidateMerger.normalizeByMax(List.of(hit("a", 0.5), hit("b", 0.25)));

        assertEquals(1.0, normalized.get(0).score(), 1e-9);
        assertEquals(0.5, normalized.get(1).score(), 1e-9);
        assertEquals(0.0, CandidateMerger.normalizeByMax(List.of(hit("z", 0.0))).get(0).score(), 1e-9);
    }

    private static RetrievalHit hit(String documentId, double score) {
        return new RetrievalHit(new Chunk(Chunk.idFor(documentId, 0), documentId, documentId, Modality.TEXT, 0, 0, 1, "x",
                Map.of()), score);
    }
}
