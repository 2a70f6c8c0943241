package com.coderag.ingest;

import com.coderag.store.CollectionNames;

public final class ChunkIds {
    private ChunkIds() {
    }

    public static String forChunk(String relativePath, int ordinal) {
        return CollectionNames.md5Hex(relativePath).substring(0, 8) + "_" + ordinal;
    }
}
