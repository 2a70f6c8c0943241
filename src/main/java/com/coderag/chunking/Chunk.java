package com.coderag.chunking;

public record Chunk(
        String content,
        String filePath,
        int startLine,
        int endLine,
        String symbolName,
        String language) {

    public Chunk {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid chunk range " + startLine + "-" + endLine + " for " + filePath);
        }
        language = language == null ? "" : language;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }
}
