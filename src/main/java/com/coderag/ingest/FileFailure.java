package com.coderag.ingest;

public record FileFailure(String relativePath, Stage stage, String message) {

    public enum Stage {
        READ,
        CHUNK,
        EMBED,
        STORE
    }
}
