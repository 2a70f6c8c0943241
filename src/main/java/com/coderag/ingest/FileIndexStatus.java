package com.coderag.ingest;

public enum FileIndexStatus {
    SUCCESS,
    FILE_DELETED,
    NOT_IN_PROJECT,
    IGNORED,
    NOT_A_FILE,
    TOO_LARGE,
    READ_ERROR,
    PROJECT_NOT_INDEXED,
    PROVIDER_MISMATCH,
    CHUNK_ERROR,
    NO_CHUNKS,
    EMBED_ERROR,
    STORE_ERROR;

    /**
     * Statuses that report a condition of the file rather than a failure to process it.
     */
    public boolean isIgnorable() {
        return this == FILE_DELETED || this == NOT_IN_PROJECT || this == IGNORED
                || this == NOT_A_FILE || this == TOO_LARGE || this == NO_CHUNKS;
    }
}
