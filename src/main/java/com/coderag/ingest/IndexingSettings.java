package com.coderag.ingest;

import java.util.List;

import com.coderag.runtime.AppConfig;

public record IndexingSettings(
        int batchSize,
        long maxFileSizeBytes,
        List<String> extraIgnoredDirectories,
        List<String> extraIgnoredExtensions) {

    public static final int DEFAULT_BATCH_SIZE = 20;
    public static final long DEFAULT_MAX_FILE_SIZE = 500_000;

    public IndexingSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        extraIgnoredDirectories = List.copyOf(extraIgnoredDirectories);
        extraIgnoredExtensions = List.copyOf(extraIgnoredExtensions);
    }

    public static IndexingSettings defaults() {
        return new IndexingSettings(DEFAULT_BATCH_SIZE, DEFAULT_MAX_FILE_SIZE, List.of(), List.of());
    }

    public static IndexingSettings from(AppConfig config) {
        return new IndexingSettings(
                config.getEmbedding().getBatchSize(),
                config.getIndexing().getMaxFileSizeBytes(),
                config.getIndexing().getExtraIgnoredDirectories(),
                config.getIndexing().getExtraIgnoredExtensions());
    }
}
