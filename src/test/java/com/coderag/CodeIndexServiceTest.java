package com.coderag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coderag.embedding.EmbeddingStatus;
import com.coderag.embedding.HashingEmbeddingProvider;
import com.coderag.explore.ChunkContext;
import com.coderag.explore.ProjectMap;
import com.coderag.ingest.FileIndexResult;
import com.coderag.ingest.FileIndexStatus;
import com.coderag.ingest.IndexStats;
import com.coderag.ingest.IndexedProject;
import com.coderag.runtime.AppConfig;
import com.coderag.search.SearchHit;
import com.coderag.store.LocalJsonVectorStore;
import com.coderag.watch.DebounceScheduler;
import com.coderag.watch.FileEventSource;
import com.coderag.watch.WatchResult;

class CodeIndexServiceTest {

    @TempDir
    Path tempDir;

    private Path project;
    private CodeIndexService service;

    @BeforeEach
    void setUp() throws Exception {
        project = Files.createDirectories(tempDir.resolve("shop"));
        Files.writeString(project.resolve("cart.py"), "def add_to_cart(cart, item):\n    cart.append(item)\n");
        Files.writeString(project.resolve("tax.py"), "def vat(amount):\n    return amount * 0.2\n");

        FileEventSource events = (root, listener) -> () -> { };
        DebounceScheduler scheduler = (task, delay) -> () -> { };
        service = new CodeIndexService(new AppConfig(), new LocalJsonVectorStore(tempDir.resolve("store")),
                new HashingEmbeddingProvider(64), events, scheduler, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void shouldIndexThenSearchProject() {
        OperationResult<IndexStats> indexed = service.indexProject(project, false);
        OperationResult<List<SearchHit>> hits = service.search("vat amount", project, 3);

        assertEquals(OperationStatus.SUCCESS, indexed.status());
        assertEquals(2, indexed.value().indexed());
        assertTrue(hits.isSuccess());
        assertEquals("tax.py", hits.value().get(0).filePath());
    }

    @Test
    void shouldReportFailuresInsteadOfThrowing() {
        OperationResult<IndexStats> missing = service.indexProject(tempDir.resolve("missing"), false);
        OperationResult<List<SearchHit>> notIndexed = service.search("vat", project, 3);
        OperationResult<List<SearchHit>> blank = service.search(" ", null, 3);

        assertEquals(OperationStatus.FAILED, missing.status());
        assertEquals(OperationStatus.FAILED, notIndexed.status());
        assertTrue(notIndexed.message().contains("not indexed"));
        assertEquals(OperationStatus.FAILED, blank.status());
    }

    @Test
    void shouldReportProviderMismatchAsFailure() throws Exception {
        service.indexProject(project, false);
        AppConfig config = new AppConfig();
        try (CodeIndexService other = new CodeIndexService(config,
                new LocalJsonVectorStore(tempDir.resolve("store")),
                new RenamedProvider("voyage"), (root, listener) -> () -> { }, (task, delay) -> () -> { },
                Clock.systemUTC())) {
            OperationResult<IndexStats> result = other.indexProject(project, false);

            assertEquals(OperationStatus.FAILED, result.status());
            assertTrue(result.message().contains("mismatch"));
        }
    }

    @Test
    void shouldTreatFileConditionsAsSuccessfulOutcomes() throws Exception {
        service.indexProject(project, false);

        OperationResult<FileIndexResult> deleted = service.indexFile(project, project.resolve("gone.py"));
        OperationResult<FileIndexResult> reindexed = service.indexFile(project, project.resolve("cart.py"));

        assertEquals(OperationStatus.SUCCESS, deleted.status());
        assertEquals("FILE_DELETED", deleted.message());
        assertEquals(FileIndexStatus.SUCCESS, reindexed.value().status());
        assertEquals(1, service.removeFile(project, project.resolve("cart.py")).value());
    }

    @Test
    void shouldListProjectsAndWatches() {
        service.indexProject(project, false);

        List<IndexedProject> projects = service.listProjects().value();
        WatchResult started = service.startWatch(project);

        assertEquals(1, projects.size());
        assertEquals(2, projects.get(0).chunks());
        assertEquals(WatchResult.Status.STARTED, started.status());
        assertEquals(List.of(project.toAbsolutePath().normalize()), service.listWatched());
        assertEquals(WatchResult.Status.STOPPED, service.stopWatch(project).status());
    }

    @Test
    void shouldBuildFromConfigAndEnvironment() throws Exception {
        AppConfig config = new AppConfig();
        config.getStorage().setDataDir(tempDir.resolve("data").toString());

        try (CodeIndexService created = CodeIndexService.create(config,
                Map.of("CODERAG_EMBEDDING_PROVIDER", "local"))) {
            assertEquals("local", created.embeddingProvider().name());
            assertEquals(OperationStatus.SUCCESS, created.indexProject(project, false).status());
            assertTrue(Files.isDirectory(tempDir.resolve("data/collections")));
        }
    }

    @Test
    void shouldMapIndexedProject() {
        OperationResult<ProjectMap> before = service.projectMap(project);
        service.indexProject(project, false);
        OperationResult<ProjectMap> after = service.projectMap(project);

        assertEquals(OperationStatus.FAILED, before.status());
        assertTrue(before.message().contains("not indexed"), before.message());
        assertEquals(OperationStatus.SUCCESS, after.status());
        assertEquals(2, after.value().totalFiles());
        assertEquals(2, after.value().totalChunks());
    }

    @Test
    void shouldReadChunkContextWithoutIndex() {
        OperationResult<ChunkContext> context = CodeIndexService.chunkContext(project.resolve("tax.py"), 2, 2, 15, 15);
        OperationResult<ChunkContext> missing = CodeIndexService.chunkContext(project.resolve("gone.py"), 1, 1, 15, 15);
        OperationResult<ChunkContext> inverted = CodeIndexService.chunkContext(project.resolve("tax.py"), 2, 1, 15, 15);

        assertEquals(OperationStatus.SUCCESS, context.status());
        assertEquals(1, context.value().actualStartLine());
        assertEquals(2, context.value().chunkStartLine());
        assertEquals(OperationStatus.FAILED, missing.status());
        assertTrue(missing.message().startsWith("File not found"), missing.message());
        assertEquals(OperationStatus.FAILED, inverted.status());
    }

    @Test
    void shouldReportActiveEmbeddingProvider() {
        EmbeddingStatus status = service.embeddingStatus().value();

        assertTrue(status.active());
        assertEquals("local", status.provider());
        assertEquals("feature-hash-v1", status.model());
        assertEquals(64, status.dimensions());
    }

    private static final class RenamedProvider extends HashingEmbeddingProvider {
        private final String name;

        RenamedProvider(String name) {
            super(64);
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }
    }
}
