package com.mmrag.capability;

import java.io.IOException;
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

public class RemoteCompletionService implements CompletionService {
    static final String CAPABILITY = "completion";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;

    public RemoteCompletionService(
            OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            double temperature,
            int maxTokens) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String complete(String prompt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);

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
                JsonNode root = mapper.readTree(response.body().string());
                JsonNode content = root.path("choices").path(0).path("message").path("content");
                if (!content.isTextual()) {
                    throw new CapabilityUnavailableException(CAPABILITY, "response carries no completion text");
                }
                return content.asText().strip();
            }
        } catch (IOException e) {
            throw new CapabilityUnavailableException(CAPABILITY, e.getMessage(), e);
        }
    }
}
