package com.coderag.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class HashingEmbeddingProviderTest {

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    @Test
    void shouldProduceDeterministicUnitVectors() {
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(128);

        List<float[]> first = provider.embed(List.of("def load_config(path): return parse(path)"));
        List<float[]> second = provider.embed(List.of("def load_config(path): return parse(path)"));

        assertArrayEquals(first.get(0), second.get(0));
        assertEquals(128, first.get(0).length);
        assertEquals(1.0, dot(first.get(0), first.get(0)), 1e-4);
    }

    @Test
    void shouldScoreRelatedTextAboveUnrelatedText() throws Exception {
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(256);

        float[] query = provider.embedQuery("load config file");
        List<float[]> docs = provider.embed(List.of(
                "def load_config(file): read the config file",
                "SELECT count(*) FROM orders WHERE total > 10"));

        assertTrue(dot(query, docs.get(0)) > dot(query, docs.get(1)));
    }

    @Test
    void shouldEmbedBlankTextWithoutFailing() {
        List<float[]> vectors = new HashingEmbeddingProvider(16).embed(List.of("", "   "));

        assertEquals(2, vectors.size());
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingProvider(0));
    }
}
