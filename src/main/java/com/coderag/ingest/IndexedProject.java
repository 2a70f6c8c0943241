package com.coderag.ingest;

public record IndexedProject(
        String name,
        String projectPath,
        int chunks,
        String embeddingProvider,
        String embeddingModel) {
}
