package com.mmrag.capability;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmrag.error.CapabilityUnavailableException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class RemoteEmbeddingService implements EmbeddingService {
    static final String CAPABILITY = "embedding";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public RemoteEmbeddingService(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        payload.put("input", texts);

        try {
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new CapabilityUnavailableException(CAPABILITY, "HTTP " + response.code() + " from " + endpoint);
                }
                List<float[]> vectors = parseVectors(mapper.readTree(response.body().string()));
                if (vectors.size() != texts.size()) {
                    throw new CapabilityUnavailableException(CAPABILITY,
                            "expected %d vectors, received %d".formatted(texts.size(), vectors.size()));
                }
                return vectors;
            }
        } catch (IOException e) {
            throw new CapabilityUnavailableException(CAPABILITY, e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "remote-" + (model == null || model.isBlank() ? "default" : model);
    }

    private List<float[]> parseVectors(JsonNode root) {
        List<float[]> vectors = new ArrayList<>();
        if (root.path("data").isArray()) {
            for (JsonNode item : root.path("data")) {
                vectors.add(toVector(item.path("embedding")));
            }
        } else if (root.path("embeddings").isArray()) {
            for (JsonNode item : root.path("embeddings")) {
                vectors.add(toVector(item));
            }
        } else if (root.path("embedding").isArray()) {
            vectors.add(toVector(root.path("embedding")));
        } else {
            throw new CapabilityUnavailableException(CAPABILITY, "response carries no embeddings");
        }
        return vectors;
    }

    private static float[] toVector(JsonNode vectorNode) {
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new CapabilityUnavailableException(CAPABILITY, "malformed embedding vector");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
