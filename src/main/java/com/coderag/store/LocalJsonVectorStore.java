package com.coderag.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Vector store keeping one JSON document per collection under {@code <dataDir>/collections}. Collections
 * are loaded lazily; record and metadata changes stay in memory until {@link #commit(String)} writes the
 * document. A failed write discards the uncommitted changes. All methods are synchronized.
 */
public class LocalJsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorStore.class);
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, StoredCollection> loaded = new HashMap<>();

    public LocalJsonVectorStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public synchronized Optional<CollectionInfo> getCollection(String name) throws VectorStoreException {
        return load(name).map(collection -> collection.info(name));
    }

    @Override
    public synchronized CollectionInfo getOrCreateCollection(String name, CollectionMetadata metadata) throws VectorStoreException {
        Optional<StoredCollection> existing = load(name);
        if (existing.isPresent()) {
            return existing.get().info(name);
        }
        StoredCollection created = new StoredCollection(metadata);
        loaded.put(name, created);
        try {
            save(name, created);
        } catch (VectorStoreException e) {
            loaded.remove(name);
            throw e;
        }
        log.info("store.collection.created name={} provider={}", name, metadata.embeddingProvider());
        return created.info(name);
    }

    @Override
    public synchronized void updateCollectionMetadata(String name, CollectionMetadata metadata) throws VectorStoreException {
        StoredCollection collection = require(name);
        collection.metadata = metadata;
        collection.dirty = true;
    }

    @Override
    public synchronized boolean deleteCollection(String name) throws VectorStoreException {
        checkName(name);
        loaded.remove(name);
        try {
            boolean deleted = Files.deleteIfExists(fileFor(name));
            if (deleted) {
                log.info("store.collection.deleted name={}", name);
            }
            return deleted;
        } catch (IOException e) {
            throw new VectorStoreException("Failed to delete collection " + name, e);
        }
    }

    @Override
    public synchronized List<CollectionInfo> listCollections() throws VectorStoreException {
        List<String> names = new ArrayList<>();
        if (Files.isDirectory(directory)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
                for (Path file : stream) {
                    String fileName = file.getFileName().toString();
                    names.add(fileName.substring(0, fileName.length() - SUFFIX.length()));
                }
            } catch (IOException e) {
                throw new VectorStoreException("Failed to list collections in " + directory, e);
            }
        }
        names.sort(Comparator.naturalOrder());
        List<CollectionInfo> infos = new ArrayList<>();
        for (String name : names) {
            if (!VALID_NAME.matcher(name).matches()) {
                continue;
            }
            load(name).ifPresent(collection -> infos.add(collection.info(name)));
        }
        return infos;
    }

    @Override
    public synchronized void upsert(String name, List<ChunkRecord> records) throws VectorStoreException {
        if (records.isEmpty()) {
            return;
        }
        StoredCollection collection = require(name);
        for (ChunkRecord record : records) {
            collection.records.put(record.id(), record);
        }
        collection.dirty = true;
    }

    @Override
    public synchronized int deleteByFilePath(String name, String relativePath) throws VectorStoreException {
        Optional<StoredCollection> found = load(name);
        if (found.isEmpty()) {
            return 0;
        }
        StoredCollection collection = found.get();
        List<String> toRemove = collection.records.values().stream()
                .filter(record -> record.metadata().filePath().equals(relativePath))
                .map(ChunkRecord::id)
                .toList();
        toRemove.forEach(collection.records::remove);
        if (!toRemove.isEmpty()) {
            collection.dirty = true;
        }
        return toRemove.size();
    }

    @Override
    public synchronized void commit(String name) throws VectorStoreException {
        checkName(name);
        StoredCollection collection = loaded.get(name);
        if (collection == null || !collection.dirty) {
            return;
        }
        try {
            save(name, collection);
        } catch (VectorStoreException e) {
            loaded.remove(name);
            log.warn("store.commit.failed name={} reason={}", name, e.getMessage());
            throw e;
        }
        collection.dirty = false;
        log.debug("store.collection.committed name={} records={}", name, collection.records.size());
    }

    synchronized boolean hasUncommittedChanges(String name) {
        StoredCollection collection = loaded.get(name);
        return collection != null && collection.dirty;
    }

    @Override
    public synchronized List<ChunkRecord> getAll(String name) throws VectorStoreException {
        return load(name).map(collection -> List.copyOf(collection.records.values())).orElse(List.of());
    }

    @Override
    public synchronized int count(String name) throws VectorStoreException {
        return load(name).map(collection -> collection.records.size()).orElse(0);
    }

    @Override
    public synchronized List<ScoredRecord> query(String name, float[] vector, int topK) throws VectorStoreException {
        if (topK <= 0) {
            return List.of();
        }
        return load(name).map(collection -> collection.records.values().stream()
                        .map(record -> new ScoredRecord(record, 1f - Vectors.cosine(vector, record.embedding())))
                        .sorted(Comparator.comparing(ScoredRecord::distance))
                        .limit(topK)
                        .toList())
                .orElse(List.of());
    }

    private StoredCollection require(String name) throws VectorStoreException {
        return load(name).orElseThrow(() -> new VectorStoreException("Collection does not exist: " + name));
    }

    private Optional<StoredCollection> load(String name) throws VectorStoreException {
        checkName(name);
        StoredCollection cached = loaded.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        Path file = fileFor(name);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            CollectionFile stored = objectMapper.readValue(file.toFile(), CollectionFile.class);
            StoredCollection collection = new StoredCollection(stored.metadata());
            if (stored.records() != null) {
                for (ChunkRecord record : stored.records()) {
                    collection.records.put(record.id(), record);
                }
            }
            loaded.put(name, collection);
            return Optional.of(collection);
        } catch (IOException e) {
            throw new VectorStoreException("Failed to read collection " + name + " from " + file, e);
        }
    }

    private void save(String name, StoredCollection collection) throws VectorStoreException {
        Path file = fileFor(name);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, name, ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(),
                        new CollectionFile(collection.metadata, List.copyOf(collection.records.values())));
                try {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new VectorStoreException("Failed to write collection " + name + " to " + file, e);
        }
    }

    private Path fileFor(String name) {
        return directory.resolve(name + SUFFIX);
    }

    private static void checkName(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid collection name: " + name);
        }
    }

    private static final class StoredCollection {
        private CollectionMetadata metadata;
        private final Map<String, ChunkRecord> records = new LinkedHashMap<>();
        private boolean dirty;

        private StoredCollection(CollectionMetadata metadata) {
            this.metadata = metadata;
        }

        private CollectionInfo info(String name) {
            return new CollectionInfo(name, metadata, records.size());
        }
    }

    public record CollectionFile(CollectionMetadata metadata, List<ChunkRecord> records) {
    }
}
