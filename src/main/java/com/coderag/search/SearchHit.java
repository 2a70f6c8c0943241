package com.coderag.search;

public record SearchHit(
        String filePath,
        int startLine,
        int endLine,
        String symbolName,
        String language,
        String content,
        double similarity,
        String projectPath) {
}
