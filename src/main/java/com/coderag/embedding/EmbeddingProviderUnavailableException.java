package com.coderag.embedding;

/**
 * No embedding provider could be resolved, or the resolved one cannot be reached. Indexing cannot
 * continue without mixing or losing vectors, so callers treat this as fatal for the whole operation.
 */
public class EmbeddingProviderUnavailableException extends EmbeddingException {
    public EmbeddingProviderUnavailableException(String message) {
        super(message);
    }

    public EmbeddingProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
