package com.mmrag.retrieval;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;

import com.mmrag.document.Chunk;
import com.mmrag.runtime.AppConfig;

/**
 * Reorders hits by a composite of relevance, recency of upload and closeness of the chunk
 * length to an optimal length. Hits without an upload time get a neutral recency of 0.5.
 */
public class Reranker {
    static final double NEUTRAL_RECENCY = 0.5;

    private final double relevanceWeight;
    private final double recencyWeight;
    private final double lengthWeight;
    private final int optimalLength;
    private final double halfLifeDays;
    private final Clock clock;

    public Reranker(AppConfig.RerankConfig config) {
        this(config, Clock.systemUTC());
    }

    public Reranker(AppConfig.RerankConfig config, Clock clock) {
        this.relevanceWeight = config.getRelevanceWeight();
        this.recencyWeight = config.getRecencyWeight();
        this.lengthWeight = config.getLengthWeight();
        this.optimalLength = Math.max(1, config.getOptimalLength());
        this.halfLifeDays = config.getRecencyHalfLifeDays();
        this.clock = clock;
    }

    public List<RetrievalHit> rerank(List<RetrievalHit> hits, int nResults) {
        Instant now = clock.instant();
        Comparator<Scored> order = Comparator.comparingDouble(Scored::composite).reversed()
                .thenComparing(Comparator.comparingDouble((Scored scored) -> scored.hit().score()).reversed())
                .thenComparing(scored -> scored.hit().chunk().id());
        return hits.stream()
                .map(hit -> new Scored(hit, composite(hit, now)))
                .sorted(order)
                .limit(nResults)
                .map(scored -> new RetrievalHit(scored.hit().chunk(), scored.composite()))
                .toList();
    }

    double composite(RetrievalHit hit, Instant now) {
        return relevanceWeight * hit.score()
                + recencyWeight * recency(hit.chunk(), now)
                + lengthWeight * lengthFactor(hit.chunk().text());
    }

    double recency(Chunk chunk, Instant now) {
        Object uploadedAt = chunk.metadata().get(Chunk.UPLOADED_AT);
        if (uploadedAt == null || halfLifeDays <= 0) {
            return NEUTRAL_RECENCY;
        }
        try {
            Instant uploaded = Instant.parse(uploadedAt.toString());
            Duration age = Duration.between(uploaded, now);
            double ageDays = Math.max(0, age.toMillis()) / (double) Duration.ofDays(1).toMillis();
            return Math.pow(0.5, ageDays / halfLifeDays);
        } catch (DateTimeParseException e) {
            return NEUTRAL_RECENCY;
        }
    }

    double lengthFactor(String text) {
        int length = text == null ? 0 : text.length();
        return Math.max(0, 1 - Math.abs(length - optimalLength) / (2.0 * optimalLength));
    }

    private record Scored(RetrievalHit hit, double composite) {
    }
}
