package com.coderag.store;

import java.util.List;
import java.util.Optional;

public interface VectorStore {
    Optional<CollectionInfo> getCollection(String name) throws VectorStoreException;

    CollectionInfo getOrCreateCollection(String name, CollectionMetadata metadata) throws VectorStoreException;

    void updateCollectionMetadata(String name, CollectionMetadata metadata) throws VectorStoreException;

    boolean deleteCollection(String name) throws VectorStoreException;

    List<CollectionInfo> listCollections() throws VectorStoreException;

    /**
     * Inserts or replaces records by id. Changes become durable on {@link #commit(String)}.
     */
    void upsert(String name, List<ChunkRecord> records) throws VectorStoreException;

    /**
     * Removes every record whose metadata file path equals {@code relativePath}; returns the number removed.
     */
    int deleteByFilePath(String name, String relativePath) throws VectorStoreException;

    /**
     * Persists the pending changes of {@code name}. On failure the pending changes are discarded and the
     * collection reads as it was last committed.
     */
    void commit(String name) throws VectorStoreException;

    List<ChunkRecord> getAll(String name) throws VectorStoreException;

    int count(String name) throws VectorStoreException;

    List<ScoredRecord> query(String name, float[] vector, int topK) throws VectorStoreException;
}
