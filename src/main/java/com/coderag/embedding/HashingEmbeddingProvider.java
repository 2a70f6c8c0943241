package com.coderag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline provider: token and trigram feature hashing into a fixed-size, L2-normalized vector. Needs no
 * model download or network, which makes it the fallback of last resort and the provider used in tests.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final String NAME = "local";
    private static final String MODEL = "feature-hash-v1";

    private final int dimensions;

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        this.dimensions = dimensions;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return MODEL;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : EmbeddingTexts.sanitize(texts)) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimensions];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            for (String part : splitIdentifier(token)) {
                addHashed(vector, "part:" + part, 0.5f);
            }
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }
        normalize(vector);
        return vector;
    }

    private static String[] splitIdentifier(String token) {
        return token.contains("_") ? token.split("_+") : new String[0];
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
