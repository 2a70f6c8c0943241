package com.coderag.ingest;

import java.util.List;

public record IndexStats(
        String projectPath,
        String collectionName,
        int scanned,
        int indexed,
        int skipped,
        int chunksCreated,
        int removed,
        int failed,
        List<FileFailure> failures) {

    public IndexStats {
        failures = List.copyOf(failures);
    }
}
