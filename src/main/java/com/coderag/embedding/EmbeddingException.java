package com.coderag.embedding;

import java.io.IOException;

public class EmbeddingException extends IOException {
    private final int statusCode;

    public EmbeddingException(String message) {
        this(message, -1, null);
    }

    public EmbeddingException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public EmbeddingException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
