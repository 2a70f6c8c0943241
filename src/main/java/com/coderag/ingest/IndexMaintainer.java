package com.coderag.ingest;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.chunking.Chunk;
import com.coderag.chunking.ChunkerSelector;
import com.coderag.embedding.EmbeddingException;
import com.coderag.embedding.EmbeddingProvider;
import com.coderag.embedding.EmbeddingProviderUnavailableException;
import com.coderag.store.ChunkMetadata;
import com.coderag.store.ChunkRecord;
import com.coderag.store.CollectionInfo;
import com.coderag.store.CollectionMetadata;
import com.coderag.store.CollectionNames;
import com.coderag.store.VectorStore;
import com.coderag.store.VectorStoreException;

/**
 * Keeps a project's collection in step with its file tree. Unchanged files (same fingerprint) are skipped;
 * changed files have their records deleted before the new chunks are embedded and stored.
 */
public class IndexMaintainer implements SingleFileIndexer {
    private static final Logger log = LoggerFactory.getLogger(IndexMaintainer.class);

    /** Provider assumed for collections written without a provider tag. */
    static final String LEGACY_PROVIDER = "ollama";

    private final VectorStore store;
    private final EmbeddingProvider embeddingProvider;
    private final ChunkerSelector chunkerSelector;
    private final IndexingSettings settings;
    private final ProjectScanner scanner = new ProjectScanner();

    public IndexMaintainer(
            VectorStore store,
            EmbeddingProvider embeddingProvider,
            ChunkerSelector chunkerSelector,
            IndexingSettings settings) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.chunkerSelector = chunkerSelector;
        this.settings = settings;
    }

    public EmbeddingProvider embeddingProvider() {
        return embeddingProvider;
    }

    /**
     * Full scan of {@code root}.
     *
     * @throws IllegalArgumentException if {@code root} is not a directory
     * @throws ProviderMismatchException if the collection was built with another provider and
     *         {@code forceFullRebuild} is false
     * @throws EmbeddingProviderUnavailableException if the provider cannot be reached
     * @throws VectorStoreException if the collection cannot be created or read
     */
    public IndexStats indexProject(Path root, boolean forceFullRebuild) throws IOException {
        Path project = normalize(root);
        if (!Files.isDirectory(project)) {
            throw new IllegalArgumentException("Not a directory: " + project);
        }
        String collection = CollectionNames.forProject(project);
        log.info("index.project.start path={} collection={} rebuild={} provider={}",
                project, collection, forceFullRebuild, embeddingProvider.name());

        if (forceFullRebuild) {
            store.deleteCollection(collection);
        }
        CollectionMetadata active = activeMetadata(project);
        CollectionInfo info = store.getOrCreateCollection(collection, active);
        if (!forceFullRebuild && info.count() > 0) {
            String stored = storedProvider(info).orElse(LEGACY_PROVIDER);
            if (!stored.equals(active.embeddingProvider())) {
                throw new ProviderMismatchException(project.toString(), stored, active.embeddingProvider());
            }
        }
        store.updateCollectionMetadata(collection, active);

        Map<String, String> recordedHashes = info.count() > 0 && !forceFullRebuild
                ? recordedHashes(collection)
                : Map.of();

        ScanProgress progress;
        try {
            progress = scan(project, collection, recordedHashes);
        } catch (IOException | RuntimeException e) {
            commitAfterAbort(collection, e);
            throw e;
        }
        store.commit(collection);

        IndexStats stats = progress.toStats(project.toString(), collection);
        log.info("index.project.completed path={} scanned={} indexed={} skipped={} chunks={} removed={} failed={}",
                project, stats.scanned(), stats.indexed(), stats.skipped(), stats.chunksCreated(),
                stats.removed(), stats.failed());
        return stats;
    }

    /**
     * Re-indexes one file of an already indexed project. Never throws for expected conditions; each one maps
     * to a {@link FileIndexStatus}.
     */
    @Override
    public FileIndexResult indexFile(Path root, Path file) {
        Path project = normalize(root);
        Path target = normalize(file.isAbsolute() ? file : project.resolve(file));
        String display = target.toString();

        if (!target.startsWith(project) || target.equals(project)) {
            return FileIndexResult.of(FileIndexStatus.NOT_IN_PROJECT, display,
                    "File is not in project directory " + project);
        }
        String relative = ProjectScanner.relativePath(project, target);
        String collection = CollectionNames.forProject(project);

        if (!Files.exists(target)) {
            try {
                if (store.deleteByFilePath(collection, relative) > 0) {
                    store.commit(collection);
                }
            } catch (VectorStoreException e) {
                log.warn("index.file.cleanup_failed path={} reason={}", relative, e.getMessage());
            }
            return FileIndexResult.of(FileIndexStatus.FILE_DELETED, display, null);
        }
        if (!Files.isRegularFile(target)) {
            return FileIndexResult.of(FileIndexStatus.NOT_A_FILE, display, null);
        }

        long size;
        try {
            size = Files.size(target);
        } catch (IOException e) {
            return FileIndexResult.of(FileIndexStatus.READ_ERROR, display, e.toString());
        }
        Optional<IgnoreReason> ignored = IgnoreRules.forProject(project, settings).check(relative, size);
        if (ignored.isPresent()) {
            FileIndexStatus status = ignored.get() == IgnoreReason.TOO_LARGE
                    ? FileIndexStatus.TOO_LARGE
                    : FileIndexStatus.IGNORED;
            return FileIndexResult.of(status, display, ignored.get().name());
        }

        String content;
        try {
            content = readContent(target);
        } catch (IOException e) {
            return FileIndexResult.of(FileIndexStatus.READ_ERROR, display, e.toString());
        }

        Optional<CollectionInfo> info;
        try {
            info = store.getCollection(collection);
        } catch (VectorStoreException e) {
            return FileIndexResult.of(FileIndexStatus.STORE_ERROR, display, e.getMessage());
        }
        if (info.isEmpty()) {
            return FileIndexResult.of(FileIndexStatus.PROJECT_NOT_INDEXED, display,
                    "Project not indexed. Run index first.");
        }
        Optional<String> stored = storedProvider(info.get());
        if (stored.isPresent() && !stored.get().equals(embeddingProvider.name())) {
            log.warn("index.file.provider_mismatch path={} stored={} active={}",
                    relative, stored.get(), embeddingProvider.name());
            return FileIndexResult.of(FileIndexStatus.PROVIDER_MISMATCH, display,
                    "Provider mismatch: " + stored.get() + " vs " + embeddingProvider.name());
        }

        FileIndexResult result = replaceRecords(project, collection, relative, display, content);
        try {
            store.commit(collection);
        } catch (VectorStoreException e) {
            return FileIndexResult.of(FileIndexStatus.STORE_ERROR, display, e.getMessage());
        }
        if (result.status() == FileIndexStatus.SUCCESS) {
            log.debug("index.file.completed path={} chunks={}", relative, result.chunksIndexed());
        }
        return result;
    }

    private FileIndexResult replaceRecords(Path project, String collection, String relative, String display, String content) {
        try {
            store.deleteByFilePath(collection, relative);
        } catch (VectorStoreException e) {
            return FileIndexResult.of(FileIndexStatus.STORE_ERROR, display, e.getMessage());
        }

        List<ChunkRecord> records;
        try {
            records = toRecords(chunk(content, relative), ContentHasher.fingerprint(content), project);
        } catch (RuntimeException e) {
            return FileIndexResult.of(FileIndexStatus.CHUNK_ERROR, display, e.toString());
        }
        if (records.isEmpty()) {
            return FileIndexResult.of(FileIndexStatus.NO_CHUNKS, display, null);
        }

        List<ChunkRecord> embedded;
        try {
            embedded = embed(records);
        } catch (EmbeddingException e) {
            log.warn("index.file.embed_failed path={} reason={}", relative, e.getMessage());
            return FileIndexResult.of(FileIndexStatus.EMBED_ERROR, display, e.getMessage());
        }
        try {
            store.upsert(collection, embedded);
        } catch (VectorStoreException e) {
            return FileIndexResult.of(FileIndexStatus.STORE_ERROR, display, e.getMessage());
        }
        return new FileIndexResult(FileIndexStatus.SUCCESS, display, embedded.size(), null);
    }

    /**
     * Deletes every record of {@code file}; returns the number removed.
     */
    @Override
    public int removeFile(Path root, Path file) throws VectorStoreException {
        Path project = normalize(root);
        Path target = normalize(file.isAbsolute() ? file : project.resolve(file));
        if (!target.startsWith(project) || target.equals(project)) {
            return 0;
        }
        String relative = ProjectScanner.relativePath(project, target);
        String collection = CollectionNames.forProject(project);
        int removed = store.deleteByFilePath(collection, relative);
        if (removed > 0) {
            store.commit(collection);
        }
        log.info("index.file.removed path={} records={}", relative, removed);
        return removed;
    }

    public List<IndexedProject> listIndexedProjects() throws VectorStoreException {
        List<IndexedProject> projects = new ArrayList<>();
        for (CollectionInfo info : store.listCollections()) {
            CollectionMetadata metadata = info.metadata();
            projects.add(new IndexedProject(
                    info.name(),
                    metadata == null || metadata.projectPath() == null ? "unknown" : metadata.projectPath(),
                    info.count(),
                    storedProvider(info).orElse(LEGACY_PROVIDER),
                    metadata == null || metadata.embeddingModel() == null ? "unknown" : metadata.embeddingModel()));
        }
        return projects;
    }

    private ScanProgress scan(Path project, String collection, Map<String, String> recordedHashes) throws IOException {
        List<CandidateFile> candidates = scanner.scan(project, IgnoreRules.forProject(project, settings));
        ScanProgress progress = new ScanProgress(candidates.size());
        Set<String> present = new HashSet<>();
        Batch batch = new Batch();

        for (CandidateFile candidate : candidates) {
            String relative = candidate.relativePath();
            present.add(relative);

            String content;
            try {
                content = readContent(candidate.absolutePath());
            } catch (IOException e) {
                progress.fail(relative, FileFailure.Stage.READ, e.toString());
                continue;
            }
            String fingerprint = ContentHasher.fingerprint(content);
            if (fingerprint.equals(recordedHashes.get(relative))) {
                progress.skipped++;
                continue;
            }

            if (recordedHashes.containsKey(relative)) {
                try {
                    store.deleteByFilePath(collection, relative);
                } catch (VectorStoreException e) {
                    progress.fail(relative, FileFailure.Stage.STORE, e.getMessage());
                    continue;
                }
            }

            List<ChunkRecord> records;
            try {
                records = toRecords(chunk(content, relative), fingerprint, project);
            } catch (RuntimeException e) {
                log.warn("index.file.chunk_failed path={} reason={}", relative, e.toString());
                progress.fail(relative, FileFailure.Stage.CHUNK, e.toString());
                continue;
            }
            batch.add(relative, records);
            progress.indexed++;
            progress.chunksCreated += records.size();

            if (batch.size() >= settings.batchSize()) {
                flush(collection, batch, progress);
            }
        }
        if (batch.size() > 0) {
            flush(collection, batch, progress);
        }

        for (String relative : recordedHashes.keySet()) {
            if (present.contains(relative)) {
                continue;
            }
            try {
                store.deleteByFilePath(collection, relative);
                progress.removed++;
            } catch (VectorStoreException e) {
                progress.fail(relative, FileFailure.Stage.STORE, e.getMessage());
            }
        }
        return progress;
    }

    private void commitAfterAbort(String collection, Exception cause) {
        try {
            store.commit(collection);
        } catch (VectorStoreException e) {
            cause.addSuppressed(e);
        }
    }

    private void flush(String collection, Batch batch, ScanProgress progress) throws EmbeddingProviderUnavailableException {
        List<ChunkRecord> pending = batch.drainRecords();
        Map<String, Integer> files = batch.drainFiles();
        try {
            store.upsert(collection, embed(pending));
            log.debug("index.batch.flushed collection={} chunks={} files={}", collection, pending.size(), files.size());
        } catch (EmbeddingProviderUnavailableException e) {
            throw e;
        } catch (EmbeddingException e) {
            log.warn("index.batch.embed_failed collection={} files={} reason={}", collection, files.size(), e.getMessage());
            progress.failBatch(files, FileFailure.Stage.EMBED, e.getMessage());
        } catch (VectorStoreException e) {
            log.warn("index.batch.store_failed collection={} files={} reason={}", collection, files.size(), e.getMessage());
            progress.failBatch(files, FileFailure.Stage.STORE, e.getMessage());
        }
    }

    private List<ChunkRecord> embed(List<ChunkRecord> records) throws EmbeddingException {
        List<String> documents = records.stream().map(ChunkRecord::document).toList();
        List<float[]> vectors = embeddingProvider.embed(documents);
        if (vectors.size() != records.size()) {
            throw new EmbeddingException("Provider " + embeddingProvider.name() + " returned " + vectors.size()
                    + " vectors for " + records.size() + " texts");
        }
        List<ChunkRecord> embedded = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            ChunkRecord record = records.get(i);
            embedded.add(new ChunkRecord(record.id(), record.document(), record.metadata(), vectors.get(i)));
        }
        return embedded;
    }

    private List<Chunk> chunk(String content, String relativePath) {
        return chunkerSelector.selectForFile(relativePath).chunk(content, relativePath);
    }

    private static List<ChunkRecord> toRecords(List<Chunk> chunks, String fingerprint, Path project) {
        List<ChunkRecord> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            ChunkMetadata metadata = new ChunkMetadata(
                    chunk.filePath(),
                    chunk.startLine(),
                    chunk.endLine(),
                    chunk.language(),
                    chunk.symbolName(),
                    fingerprint,
                    project.toString());
            records.add(new ChunkRecord(ChunkIds.forChunk(chunk.filePath(), i), chunk.content(), metadata, null));
        }
        return records;
    }

    private Map<String, String> recordedHashes(String collection) throws VectorStoreException {
        Map<String, String> hashes = new HashMap<>();
        for (ChunkRecord record : store.getAll(collection)) {
            ChunkMetadata metadata = record.metadata();
            if (metadata != null && metadata.filePath() != null && metadata.fileHash() != null) {
                hashes.put(metadata.filePath(), metadata.fileHash());
            }
        }
        return hashes;
    }

    private CollectionMetadata activeMetadata(Path project) {
        return new CollectionMetadata(
                project.toString(),
                embeddingProvider.name(),
                embeddingProvider.model(),
                embeddingProvider.dimensions());
    }

    private static Optional<String> storedProvider(CollectionInfo info) {
        return Optional.ofNullable(info.metadata()).map(CollectionMetadata::embeddingProvider);
    }

    public static String readContent(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static final class Batch {
        private final List<ChunkRecord> records = new ArrayList<>();
        private final Map<String, Integer> chunksPerFile = new LinkedHashMap<>();

        void add(String relativePath, List<ChunkRecord> fileRecords) {
            records.addAll(fileRecords);
            chunksPerFile.merge(relativePath, fileRecords.size(), Integer::sum);
        }

        int size() {
            return records.size();
        }

        List<ChunkRecord> drainRecords() {
            List<ChunkRecord> drained = List.copyOf(records);
            records.clear();
            return drained;
        }

        Map<String, Integer> drainFiles() {
            Map<String, Integer> drained = new LinkedHashMap<>(chunksPerFile);
            chunksPerFile.clear();
            return drained;
        }
    }

    private static final class ScanProgress {
        private final int scanned;
        private int indexed;
        private int skipped;
        private int chunksCreated;
        private int removed;
        private final List<FileFailure> failures = new ArrayList<>();

        ScanProgress(int scanned) {
            this.scanned = scanned;
        }

        void fail(String relativePath, FileFailure.Stage stage, String message) {
            failures.add(new FileFailure(relativePath, stage, message));
        }

        void failBatch(Map<String, Integer> files, FileFailure.Stage stage, String message) {
            for (Map.Entry<String, Integer> file : files.entrySet()) {
                indexed--;
                chunksCreated -= file.getValue();
                fail(file.getKey(), stage, message);
            }
        }

        IndexStats toStats(String projectPath, String collection) {
            return new IndexStats(projectPath, collection, scanned, indexed, skipped, chunksCreated, removed,
                    failures.size(), failures);
        }
    }
}
