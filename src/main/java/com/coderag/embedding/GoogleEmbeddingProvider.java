package com.coderag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;

public class GoogleEmbeddingProvider implements EmbeddingProvider {
    public static final String NAME = "google";
    private static final String BASE_URL = "https://generativelanguage.googleapis.com/v1beta/models/";

    private final HttpEmbeddingClient client;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimensions;

    public GoogleEmbeddingProvider(OkHttpClient httpClient, RetryPolicy retryPolicy, String apiKey, String model, int dimensions) {
        this(httpClient, retryPolicy, BASE_URL, apiKey, model, dimensions);
    }

    GoogleEmbeddingProvider(OkHttpClient httpClient, RetryPolicy retryPolicy, String baseUrl, String apiKey, String model, int dimensions) {
        this.client = new HttpEmbeddingClient(httpClient, retryPolicy, NAME);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) throws EmbeddingException {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> requests = new ArrayList<>(texts.size());
        for (String text : EmbeddingTexts.sanitize(texts)) {
            requests.add(Map.of(
                    "model", "models/" + model,
                    "content", Map.of("parts", List.of(Map.of("text", text)))));
        }
        JsonNode root = client.postJson(
                baseUrl + model + ":batchEmbedContents",
                Map.of("requests", requests),
                Map.of("x-goog-api-key", apiKey));
        return JsonVectors.collect(root.path("embeddings"), "values", texts.size(), NAME);
    }
}
