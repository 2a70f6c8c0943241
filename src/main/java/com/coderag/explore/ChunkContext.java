package com.coderag.explore;

/**
 * A chunk with the lines around it. {@code actualStartLine}/{@code actualEndLine} are file line numbers;
 * {@code chunkStartLine}/{@code chunkEndLine} are 1-based positions inside {@code content}.
 */
public record ChunkContext(
        String filePath,
        String content,
        int actualStartLine,
        int actualEndLine,
        int chunkStartLine,
        int chunkEndLine) {
}
