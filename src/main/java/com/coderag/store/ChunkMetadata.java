package com.coderag.store;

public record ChunkMetadata(
        String filePath,
        int startLine,
        int endLine,
        String language,
        String symbolName,
        String fileHash,
        String projectPath) {

    public ChunkMetadata {
        language = language == null ? "" : language;
        symbolName = symbolName == null ? "" : symbolName;
    }
}
