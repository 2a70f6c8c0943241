package com.coderag.embedding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import okhttp3.OkHttpClient;

/**
 * Providers that speak the {@code POST /embeddings {model, input[]} -> data[].embedding} dialect
 * (OpenAI, Voyage).
 */
public class OpenAiCompatibleEmbeddingProvider implements EmbeddingProvider {
    public static final String OPENAI_URL = "https://api.openai.com/v1/embeddings";
    public static final String VOYAGE_URL = "https://api.voyageai.com/v1/embeddings";

    private final HttpEmbeddingClient client;
    private final String name;
    private final String url;
    private final String apiKey;
    private final String model;
    private final int dimensions;

    public OpenAiCompatibleEmbeddingProvider(
            OkHttpClient httpClient,
            RetryPolicy retryPolicy,
            String name,
            String url,
            String apiKey,
            String model,
            int dimensions) {
        this.client = new HttpEmbeddingClient(httpClient, retryPolicy, name);
        this.name = name;
        this.url = url;
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
    }

    @Override
    public String name() {
        return name;
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
        JsonNode root = client.postJson(
                url,
                Map.of("model", model, "input", EmbeddingTexts.sanitize(texts)),
                Map.of("Authorization", "Bearer " + apiKey));
        return JsonVectors.collect(byIndex(root.path("data")), "embedding", texts.size(), name);
    }

    // "data" items carry an "index"; keep input order even if the service reorders them
    private static JsonNode byIndex(JsonNode data) {
        if (!data.isArray()) {
            return data;
        }
        List<JsonNode> items = new ArrayList<>(data.size());
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt(0)));
        ArrayNode sorted = JsonNodeFactory.instance.arrayNode();
        items.forEach(sorted::add);
        return sorted;
    }
}
