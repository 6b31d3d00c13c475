package com.mmrag.retrieval;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mmrag.document.Chunk;

/**
 * Merges candidate lists keyed by chunk id so that every chunk appears at most once.
 */
final class CandidateMerger {
    static final Comparator<RetrievalHit> RANKING = Comparator.comparingDouble(RetrievalHit::score).reversed()
            .thenComparing(hit -> hit.chunk().id());

    private CandidateMerger() {
    }

    static List<RetrievalHit> normalizeByMax(List<RetrievalHit> hits) {
        double max = hits.stream().mapToDouble(RetrievalHit::score).max().orElse(0);
        if (max <= 0) {
            return hits.stream().map(hit -> new RetrievalHit(hit.chunk(), 0)).toList();
        }
        return hits.stream().map(hit -> new RetrievalHit(hit.chunk(), hit.score() / max)).toList();
    }

    static List<RetrievalHit> weightedSum(
            List<RetrievalHit> first,
            double firstWeight,
            List<RetrievalHit> second,
            double secondWeight,
            int limit) {
        Map<String, Chunk> chunks = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        for (RetrievalHit hit : first) {
            chunks.putIfAbsent(hit.chunk().id(), hit.chunk());
            scores.merge(hit.chunk().id(), firstWeight * hit.score(), Double::sum);
        }
        for (RetrievalHit hit : second) {
            chunks.putIfAbsent(hit.chunk().id(), hit.chunk());
            scores.merge(hit.chunk().id(), secondWeight * hit.score(), Double::sum);
        }
        return rank(chunks, scores, limit);
    }

    static List<RetrievalHit> maxScore(Collection<List<RetrievalHit>> candidateLists, int limit) {
        Map<String, Chunk> chunks = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        for (List<RetrievalHit> candidates : candidateLists) {
            for (RetrievalHit hit : candidates) {
                chunks.putIfAbsent(hit.chunk().id(), hit.chunk());
                scores.merge(hit.chunk().id(), hit.score(), Math::max);
            }
        }
        return rank(chunks, scores, limit);
    }

    private static List<RetrievalHit> rank(Map<String, Chunk> chunks, Map<String, Double> scores, int limit) {
        return scores.entrySet().stream()
                .map(entry -> new RetrievalHit(chunks.get(entry.getKey()), entry.getValue()))
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }
}
