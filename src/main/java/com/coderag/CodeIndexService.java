package com.coderag;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.chunking.ChunkerSelector;
import com.coderag.embedding.EmbeddingException;
import com.coderag.embedding.EmbeddingProvider;
import com.coderag.embedding.EmbeddingProviderUnavailableException;
import com.coderag.embedding.EmbeddingProviders;
import com.coderag.embedding.EmbeddingStatus;
import com.coderag.explore.ChunkContext;
import com.coderag.explore.ChunkContextReader;
import com.coderag.explore.ProjectMap;
import com.coderag.explore.ProjectMapBuilder;
import com.coderag.ingest.FileIndexResult;
import com.coderag.ingest.FileIndexStatus;
import com.coderag.ingest.IndexMaintainer;
import com.coderag.ingest.IndexStats;
import com.coderag.ingest.IndexedProject;
import com.coderag.ingest.IndexingSettings;
import com.coderag.ingest.ProviderMismatchException;
import com.coderag.runtime.AppConfig;
import com.coderag.search.CodeSearchService;
import com.coderag.search.SearchHit;
import com.coderag.store.LocalJsonVectorStore;
import com.coderag.store.VectorStore;
import com.coderag.store.VectorStoreException;
import com.coderag.watch.DebounceScheduler;
import com.coderag.watch.ExecutorDebounceScheduler;
import com.coderag.watch.FileEventSource;
import com.coderag.watch.NioFileEventSource;
import com.coderag.watch.WatchCoordinator;
import com.coderag.watch.WatchResult;

/**
 * Entry point for callers. Every operation returns an {@link OperationResult}; expected failures such as a
 * missing index, an unreachable provider or a provider mismatch are reported, not thrown.
 */
public class CodeIndexService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CodeIndexService.class);

    private final IndexMaintainer maintainer;
    private final CodeSearchService searchService;
    private final ProjectMapBuilder projectMapBuilder;
    private final WatchCoordinator watchCoordinator;
    private final AutoCloseable schedulerResource;

    public CodeIndexService(
            AppConfig config,
            VectorStore store,
            EmbeddingProvider embeddingProvider,
            FileEventSource eventSource,
            DebounceScheduler scheduler,
            Clock clock) {
        IndexingSettings settings = IndexingSettings.from(config);
        this.maintainer = new IndexMaintainer(
                store, embeddingProvider, new ChunkerSelector(config.getIndexing().isAstChunking()), settings);
        this.searchService = new CodeSearchService(store, embeddingProvider);
        this.projectMapBuilder = new ProjectMapBuilder(store);
        this.watchCoordinator = new WatchCoordinator(
                maintainer, eventSource, scheduler, clock, Duration.ofMillis(config.getWatch().getDebounceMs()), settings);
        this.schedulerResource = scheduler instanceof AutoCloseable ? (AutoCloseable) scheduler : null;
    }

    /**
     * Wires the default local store, the JDK watch service and the provider resolved from {@code env}.
     */
    public static CodeIndexService create(AppConfig config, Map<String, String> env) throws EmbeddingProviderUnavailableException {
        EmbeddingProvider provider = EmbeddingProviders.resolve(
                config.getEmbedding(), env, EmbeddingProviders.httpClient(config.getEmbedding()));
        return new CodeIndexService(
                config,
                new LocalJsonVectorStore(config.getStorage().collectionsDir()),
                provider,
                new NioFileEventSource(),
                new ExecutorDebounceScheduler(),
                Clock.systemUTC());
    }

    public EmbeddingProvider embeddingProvider() {
        return maintainer.embeddingProvider();
    }

    public OperationResult<IndexStats> indexProject(Path root, boolean forceFullRebuild) {
        try {
            IndexStats stats = maintainer.indexProject(root, forceFullRebuild);
            if (stats.failed() > 0) {
                return OperationResult.partial(stats, stats.failed() + " file(s) failed to index");
            }
            return OperationResult.success(stats);
        } catch (IllegalArgumentException | ProviderMismatchException e) {
            return OperationResult.failed(e.getMessage());
        } catch (IOException e) {
            log.error("index.project.failed path={} reason={}", root, e.getMessage(), e);
            return OperationResult.failed(e.getMessage());
        }
    }

    public OperationResult<FileIndexResult> indexFile(Path root, Path file) {
        FileIndexResult result = maintainer.indexFile(root, file);
        if (result.status() == FileIndexStatus.SUCCESS) {
            return OperationResult.success(result);
        }
        if (result.status().isIgnorable()) {
            return OperationResult.success(result, result.status().name());
        }
        return OperationResult.failed(result, result.message() == null ? result.status().name() : result.message());
    }

    public OperationResult<Integer> removeFile(Path root, Path file) {
        try {
            return OperationResult.success(maintainer.removeFile(root, file));
        } catch (VectorStoreException e) {
            return OperationResult.failed(e.getMessage());
        }
    }

    public OperationResult<List<SearchHit>> search(String query, Path project, int topK) {
        try {
            return OperationResult.success(searchService.search(query, project, topK));
        } catch (IllegalArgumentException e) {
            return OperationResult.failed(e.getMessage());
        } catch (EmbeddingException | VectorStoreException e) {
            log.error("search.failed reason={}", e.getMessage(), e);
            return OperationResult.failed(e.getMessage());
        }
    }

    public OperationResult<List<IndexedProject>> listProjects() {
        try {
            return OperationResult.success(maintainer.listIndexedProjects());
        } catch (VectorStoreException e) {
            return OperationResult.failed(e.getMessage());
        }
    }

    public OperationResult<ProjectMap> projectMap(Path root) {
        try {
            return OperationResult.success(projectMapBuilder.build(root));
        } catch (IllegalArgumentException e) {
            return OperationResult.failed(e.getMessage());
        } catch (VectorStoreException e) {
            log.error("project.map.failed path={} reason={}", root, e.getMessage(), e);
            return OperationResult.failed(e.getMessage());
        }
    }

    /**
     * Lines {@code startLine..endLine} of {@code file} with {@code before}/{@code after} lines around them.
     * Needs no index or embedding provider.
     */
    public static OperationResult<ChunkContext> chunkContext(Path file, int startLine, int endLine, int before, int after) {
        try {
            return OperationResult.success(ChunkContextReader.read(file, startLine, endLine, before, after));
        } catch (NoSuchFileException e) {
            return OperationResult.failed("File not found: " + e.getFile());
        } catch (IllegalArgumentException e) {
            return OperationResult.failed(e.getMessage());
        } catch (IOException e) {
            return OperationResult.failed("Cannot read file: " + e.getMessage());
        }
    }

    public OperationResult<EmbeddingStatus> embeddingStatus() {
        return OperationResult.success(EmbeddingStatus.of(maintainer.embeddingProvider()));
    }

    public WatchResult startWatch(Path root) {
        return watchCoordinator.startWatch(root);
    }

    public WatchResult stopWatch(Path root) {
        return watchCoordinator.stopWatch(root);
    }

    public List<Path> listWatched() {
        return watchCoordinator.listWatched();
    }

    @Override
    public void close() {
        watchCoordinator.close();
        if (schedulerResource != null) {
            try {
                schedulerResource.close();
            } catch (Exception e) {
                log.warn("service.close.failed reason={}", e.toString());
            }
        }
    }
}
