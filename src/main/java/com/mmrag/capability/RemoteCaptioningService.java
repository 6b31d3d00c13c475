package com.mmrag.capability;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmrag.error.CapabilityUnavailableException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class RemoteCaptioningService implements CaptioningService {
    static final String CAPABILITY = "captioning";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;

    public RemoteCaptioningService(OkHttpClient httpClient, String endpoint, String model, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public String caption(byte[] image, String name) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        payload.put("filename", name);
        payload.put("image", Base64.getEncoder().encodeToString(image));

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
                String caption = root.path("caption").asText(root.path("text").asText(""));
                if (caption.isBlank()) {
                    throw new CapabilityUnavailableException(CAPABILITY, "empty caption for " + name);
                }
                return caption.strip();
            }
        } catch (IOException e) {
            throw new CapabilityUnavailableException(CAPABILITY, e.getMessage(), e);
        }
    }
}
