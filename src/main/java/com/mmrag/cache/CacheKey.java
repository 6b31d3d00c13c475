package com.mmrag.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mmrag.retrieval.RetrievalRequest;

/**
 * Builds cache keys from a sorted-key JSON rendering of a resolved request, so that two
 * requests differing only in filter insertion order share a key.
 */
public final class CacheKey {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private CacheKey() {
    }

    public static String of(RetrievalRequest request) {
        return sha256(canonicalJson(request));
    }

    static String canonicalJson(RetrievalRequest request) {
        if (request.strategy() == null) {
            throw new IllegalStateException("Cache keys require a resolved retrieval strategy");
        }
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("query", request.query().strip());
        canonical.put("strategy", request.strategy().label());
        canonical.put("n_results", request.nResults());
        canonical.put("rerank", request.rerank());
        canonical.put("filter", new TreeMap<>(request.filter()));
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to render cache key", e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
