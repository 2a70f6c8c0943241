package com.coderag.explore;

import java.util.List;

/**
 * A group of files whose averaged chunk embeddings are close to each other.
 */
public record ProjectComponent(
        int id,
        String label,
        List<String> files,
        int fileCount,
        List<String> symbols,
        String directory,
        List<String> languages) {
}
