package com.coderag.store;

/**
 * Tags a collection with the project it indexes and the embedding provider that produced its vectors.
 */
public record CollectionMetadata(
        String projectPath,
        String embeddingProvider,
        String embeddingModel,
        int embeddingDimensions) {
}
