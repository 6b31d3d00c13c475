package com.mmrag.capability;

import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.error.CapabilityUnavailableException;

/**
 * Routes embedding calls to the primary provider while its circuit is closed and to the
 * fallback provider while it is open. A half-open circuit lets one probe through.
 */
public class FallbackEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(FallbackEmbeddingService.class);

    private final EmbeddingService primary;
    private final EmbeddingService fallback;
    private final CircuitBreaker circuitBreaker;

    public FallbackEmbeddingService(EmbeddingService primary, EmbeddingService fallback, CircuitBreaker circuitBreaker) {
        this.primary = primary;
        this.fallback = fallback;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public float[] embed(String text) {
        return route(service -> service.embed(text));
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        return route(service -> service.embedBatch(texts));
    }

    @Override
    public int dimension() {
        return primary.dimension();
    }

    @Override
    public String version() {
        return circuitBreaker.state() == CircuitBreaker.State.OPEN ? fallback.version() : primary.version();
    }

    private <T> T route(Function<EmbeddingService, T> call) {
        if (!circuitBreaker.allowRequest()) {
            return call.apply(fallback);
        }
        try {
            T result = call.apply(primary);
            circuitBreaker.recordSuccess();
            return result;
        } catch (CapabilityUnavailableException e) {
            circuitBreaker.recordFailure();
            log.warn("embedding.primary.failed circuit={} reason={}", circuitBreaker.state(), e.getMessage());
            return call.apply(fallback);
        }
    }
}
