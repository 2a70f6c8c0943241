package com.coderag.embedding;

/**
 * The provider an instance embeds with, or why none could be resolved.
 */
public record EmbeddingStatus(String provider, String model, int dimensions, boolean active, String error) {

    public static EmbeddingStatus of(EmbeddingProvider provider) {
        return new EmbeddingStatus(provider.name(), provider.model(), provider.dimensions(), true, null);
    }

    public static EmbeddingStatus unavailable(String error) {
        return new EmbeddingStatus(null, null, 0, false, error);
    }
}
