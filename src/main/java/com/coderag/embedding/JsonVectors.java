package com.coderag.embedding;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonVectors {
    private JsonVectors() {
    }

    static float[] toFloats(JsonNode array) {
        float[] out = new float[array.size()];
        for (int i = 0; i < array.size(); i++) {
            out[i] = (float) array.get(i).asDouble();
        }
        return out;
    }

    static List<float[]> collect(JsonNode items, String field, int expected, String provider) throws EmbeddingException {
        if (!items.isArray() || items.size() != expected) {
            throw new EmbeddingException(provider + " returned " + (items.isArray() ? items.size() : 0)
                    + " embeddings for " + expected + " inputs");
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (JsonNode item : items) {
            JsonNode vector = field == null ? item : item.path(field);
            if (!vector.isArray()) {
                throw new EmbeddingException(provider + " returned a malformed embedding");
            }
            vectors.add(toFloats(vector));
        }
        return vectors;
    }
}
