package com.coderag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.OkHttpClient;

public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);
    public static final String NAME = "ollama";

    private final HttpEmbeddingClient client;
    private final String host;
    private final String model;
    private final int dimensions;

    public OllamaEmbeddingProvider(OkHttpClient httpClient, RetryPolicy retryPolicy, String host, String model, int dimensions) {
        this.client = new HttpEmbeddingClient(httpClient, retryPolicy, NAME);
        this.host = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
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
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(EmbeddingTexts.sanitize(text)));
        }
        return vectors;
    }

    // halves the input on "context length" rejections until MIN_CHARS
    private float[] embedOne(String content) throws EmbeddingException {
        int limit = EmbeddingTexts.MAX_CHARS;
        while (true) {
            String input = EmbeddingTexts.truncate(content, limit);
            try {
                JsonNode root = client.postJson(host + "/api/embed", Map.of("model", model, "input", input), Map.of());
                return firstEmbedding(root);
            } catch (EmbeddingException e) {
                boolean contextTooLong = e.statusCode() == 400 && e.getMessage().contains("context length");
                if (!contextTooLong || limit <= EmbeddingTexts.MIN_CHARS) {
                    throw e;
                }
                limit = Math.max(EmbeddingTexts.MIN_CHARS, limit / 2);
                log.debug("embedding.ollama.truncate model={} limit={}", model, limit);
            }
        }
    }

    private float[] firstEmbedding(JsonNode root) throws EmbeddingException {
        JsonNode embeddings = root.path("embeddings");
        if (!embeddings.isArray() || embeddings.isEmpty() || !embeddings.get(0).isArray()) {
            throw new EmbeddingException("Ollama returned empty embeddings for model '" + model
                    + "'. Ensure the model is pulled: ollama pull " + model);
        }
        return JsonVectors.toFloats(embeddings.get(0));
    }
}
