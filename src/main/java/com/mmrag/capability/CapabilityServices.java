package com.mmrag.capability;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class CapabilityServices {
    private static final Logger log = LoggerFactory.getLogger(CapabilityServices.class);

    private CapabilityServices() {
    }

    public static EmbeddingService embedding(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        return embedding(config, httpClient, System.getenv());
    }

    static EmbeddingService embedding(AppConfig.EmbeddingConfig config, OkHttpClient httpClient, Map<String, String> env) {
        EmbeddingService local = new LocalModelEmbeddingService(config.getLocalDimension());
        String endpoint = firstNonBlank(env.get("MMRAG_EMBEDDING_URL"), config.getEndpoint());
        if (endpoint == null) {
            log.info("capability.embedding provider=local dimension={}", local.dimension());
            return local;
        }
        String apiKey = firstNonBlank(env.get("MMRAG_EMBEDDING_API_KEY"), config.getApiKey());
        EmbeddingService remote = new RemoteEmbeddingService(httpClient, endpoint, config.getModel(), apiKey, local.dimension());
        CircuitBreaker breaker = new CircuitBreaker(config.getFailureThreshold(), Duration.ofMillis(config.getCooldownMs()));
        log.info("capability.embedding provider=remote endpoint={} fallback=local", endpoint);
        return new FallbackEmbeddingService(remote, local, breaker);
    }

    public static CaptioningService captioning(AppConfig.EndpointConfig config, OkHttpClient httpClient) {
        return captioning(config, httpClient, System.getenv());
    }

    static CaptioningService captioning(AppConfig.EndpointConfig config, OkHttpClient httpClient, Map<String, String> env) {
        String endpoint = firstNonBlank(env.get("MMRAG_CAPTION_URL"), config.getEndpoint());
        if (endpoint == null) {
            log.info("capability.captioning provider=local");
            return new LocalImageDescriptionService();
        }
        log.info("capability.captioning provider=remote endpoint={}", endpoint);
        return new RemoteCaptioningService(httpClient, endpoint, config.getModel(), config.getApiKey());
    }

    public static Optional<CompletionService> completion(AppConfig.CompletionConfig config, OkHttpClient httpClient) {
        return completion(config, httpClient, System.getenv());
    }

    static Optional<CompletionService> completion(AppConfig.CompletionConfig config, OkHttpClient httpClient, Map<String, String> env) {
        String endpoint = firstNonBlank(env.get("MMRAG_COMPLETION_URL"), config.getEndpoint());
        if (endpoint == null) {
            log.info("capability.completion provider=none");
            return Optional.empty();
        }
        String apiKey = firstNonBlank(env.get("MMRAG_COMPLETION_API_KEY"), config.getApiKey());
        log.info("capability.completion provider=remote endpoint={} model={}", endpoint, config.getModel());
        return Optional.of(new RemoteCompletionService(
                httpClient,
                endpoint,
                config.getModel(),
                apiKey,
                config.getTemperature(),
                config.getMaxTokens()));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
