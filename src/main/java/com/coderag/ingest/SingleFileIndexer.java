package com.coderag.ingest;

import java.nio.file.Path;

import com.coderag.store.VectorStoreException;

/**
 * Single-file operations driven by file-system events.
 */
public interface SingleFileIndexer {
    FileIndexResult indexFile(Path root, Path file);

    int removeFile(Path root, Path file) throws VectorStoreException;
}
