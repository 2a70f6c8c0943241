package com.coderag;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.coderag.embedding.EmbeddingProviderUnavailableException;
import com.coderag.embedding.EmbeddingProviders;
import com.coderag.embedding.EmbeddingStatus;
import com.coderag.explore.ChunkContext;
import com.coderag.explore.ComponentRelationship;
import com.coderag.explore.ProjectComponent;
import com.coderag.explore.ProjectMap;
import com.coderag.ingest.FileFailure;
import com.coderag.ingest.FileIndexResult;
import com.coderag.ingest.IndexStats;
import com.coderag.ingest.IndexedProject;
import com.coderag.runtime.AppConfig;
import com.coderag.search.SearchHit;
import com.coderag.watch.WatchResult;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "code-rag",
        mixinStandardHelpOptions = true,
        version = "code-rag 0.1.0",
        description = "Chunks, embeds and indexes source trees for local code search.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_PARTIAL = 3;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "code-rag.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: index, reindex, index-file, search, projects, watch, map, context, status",
            defaultValue = "index", converter = ModeConverter.class)
    Mode mode;

    @Option(names = { "-p", "--path" }, description = "Project root", defaultValue = ".")
    Path projectPath;

    @Option(names = "--file", description = "File to re-index in index-file mode, or to read in context mode")
    Path file;

    @Option(names = { "-q", "--query" }, description = "Query text used in search mode")
    String query;

    @Option(names = "--all-projects", description = "Search every indexed project instead of --path", defaultValue = "false")
    boolean allProjects;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    @Option(names = "--start-line", description = "First line of the chunk in context mode")
    Integer startLine;

    @Option(names = "--end-line", description = "Last line of the chunk in context mode")
    Integer endLine;

    @Option(names = "--context-lines", description = "Lines shown before and after the chunk in context mode",
            defaultValue = "15")
    int contextLines;

    @Option(names = "--provider", description = "Embedding provider: ollama, local, google, openai, voyage")
    String provider;

    @Option(names = "--data-dir", description = "Directory holding the index collections")
    Path dataDir;

    enum Mode {
        INDEX("index"),
        REINDEX("reindex"),
        INDEX_FILE("index-file"),
        SEARCH("search"),
        PROJECTS("projects"),
        WATCH("watch"),
        MAP("map"),
        CONTEXT("context"),
        STATUS("status");

        private final String cliName;

        Mode(String cliName) {
            this.cliName = cliName;
        }

        static Mode parse(String value) {
            String normalized = value.strip().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Mode candidate : values()) {
                if (candidate.cliName.equals(normalized)) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("Unknown mode '" + value + "'");
        }
    }

    static final class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            try {
                return Mode.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(configPath);
        if (dataDir != null) {
            config.getStorage().setDataDir(dataDir.toString());
        }
        Map<String, String> env = new HashMap<>(System.getenv());
        if (provider != null && !provider.isBlank()) {
            env.put("CODERAG_EMBEDDING_PROVIDER", provider);
        }

        if (mode == Mode.SEARCH && (query == null || query.isBlank())) {
            log.error("--query is required in search mode");
            return EXIT_USAGE;
        }
        if (mode == Mode.INDEX_FILE && file == null) {
            log.error("--file is required in index-file mode");
            return EXIT_USAGE;
        }

        if (mode == Mode.CONTEXT) {
            if (file == null || startLine == null || endLine == null) {
                log.error("--file, --start-line and --end-line are required in context mode");
                return EXIT_USAGE;
            }
            return reportContext(spec.commandLine().getOut(),
                    CodeIndexService.chunkContext(file, startLine, endLine, contextLines, contextLines));
        }
        if (mode == Mode.STATUS) {
            return reportStatus(spec.commandLine().getOut(), EmbeddingProviders.status(
                    config.getEmbedding(), env, EmbeddingProviders.httpClient(config.getEmbedding())));
        }

        log.info("Starting code-rag in {} mode, dataDir={}", mode.cliName, config.getStorage().getDataDir());
        CodeIndexService service;
        try {
            service = CodeIndexService.create(config, env);
        } catch (EmbeddingProviderUnavailableException e) {
            log.error("No usable embedding provider: {}", e.getMessage());
            return EXIT_FAILED;
        }

        try (service) {
            PrintWriter out = spec.commandLine().getOut();
            switch (mode) {
                case INDEX:
                    return report(out, service.indexProject(projectPath, false));
                case REINDEX:
                    return report(out, service.indexProject(projectPath, true));
                case INDEX_FILE:
                    return reportFile(out, service.indexFile(projectPath, file));
                case SEARCH:
                    return reportSearch(out, service.search(query, allProjects ? null : projectPath, topK));
                case PROJECTS:
                    return reportProjects(out, service.listProjects());
                case WATCH:
                    return watch(out, service);
                case MAP:
                    return reportMap(out, service.projectMap(projectPath));
                default:
                    return EXIT_USAGE;
            }
        }
    }

    private int report(PrintWriter out, OperationResult<IndexStats> result) {
        if (result.status() == OperationStatus.FAILED) {
            log.error("Indexing failed: {}", result.message());
            return EXIT_FAILED;
        }
        IndexStats stats = result.value();
        out.printf("Indexed %s into %s: scanned=%d indexed=%d skipped=%d chunks=%d removed=%d failed=%d%n",
                stats.projectPath(), stats.collectionName(), stats.scanned(), stats.indexed(), stats.skipped(),
                stats.chunksCreated(), stats.removed(), stats.failed());
        for (FileFailure failure : stats.failures()) {
            out.printf("  failed %s (%s): %s%n", failure.relativePath(), failure.stage(), failure.message());
        }
        out.flush();
        return result.status() == OperationStatus.PARTIAL ? EXIT_PARTIAL : EXIT_OK;
    }

    private int reportFile(PrintWriter out, OperationResult<FileIndexResult> result) {
        FileIndexResult fileResult = result.value();
        if (fileResult == null) {
            log.error("Indexing file failed: {}", result.message());
            return EXIT_FAILED;
        }
        out.printf("%s %s chunks=%d%s%n", fileResult.status(), fileResult.filePath(), fileResult.chunksIndexed(),
                fileResult.message() == null ? "" : " (" + fileResult.message() + ")");
        out.flush();
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }

    private int reportSearch(PrintWriter out, OperationResult<List<SearchHit>> result) {
        if (!result.isSuccess()) {
            log.error("Search failed: {}", result.message());
            return EXIT_FAILED;
        }
        List<SearchHit> hits = result.value();
        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            out.printf("#%d %s:%d-%d %s similarity=%.4f%n", i + 1, hit.filePath(), hit.startLine(), hit.endLine(),
                    hit.symbolName().isEmpty() ? "" : "[" + hit.symbolName() + "]", hit.similarity());
        }
        if (hits.isEmpty()) {
            out.println("No results.");
        }
        out.flush();
        return EXIT_OK;
    }

    private int reportProjects(PrintWriter out, OperationResult<List<IndexedProject>> result) {
        if (!result.isSuccess()) {
            log.error("Listing projects failed: {}", result.message());
            return EXIT_FAILED;
        }
        for (IndexedProject project : result.value()) {
            out.printf("%s %s chunks=%d provider=%s model=%s%n", project.name(), project.projectPath(),
                    project.chunks(), project.embeddingProvider(), project.embeddingModel());
        }
        out.flush();
        return EXIT_OK;
    }

    private int reportMap(PrintWriter out, OperationResult<ProjectMap> result) throws JsonProcessingException {
        if (!result.isSuccess()) {
            log.error("Project map failed: {}", result.message());
            return EXIT_FAILED;
        }
        ProjectMap map = result.value();
        out.printf("Project map %s: files=%d chunks=%d components=%d%n", map.projectPath(), map.totalFiles(),
                map.totalChunks(), map.components().size());
        for (ProjectComponent component : map.components()) {
            out.printf("component %s (%d files, %s) directory=%s%n", component.label(), component.fileCount(),
                    component.languages().isEmpty() ? "unknown" : String.join(", ", component.languages()),
                    component.directory());
            if (!component.symbols().isEmpty()) {
                out.printf("  symbols: %s%n", String.join(", ",
                        component.symbols().subList(0, Math.min(10, component.symbols().size()))));
            }
            for (String componentFile : component.files()) {
                out.printf("  - %s%n", componentFile);
            }
        }
        for (ComponentRelationship relationship : map.relationships()) {
            out.printf("related %s <-> %s similarity=%.4f%n", relationship.source(), relationship.target(),
                    relationship.similarity());
        }
        out.println(JSON.writeValueAsString(map));
        out.flush();
        return EXIT_OK;
    }

    private int reportContext(PrintWriter out, OperationResult<ChunkContext> result) {
        if (!result.isSuccess()) {
            log.error("Reading context failed: {}", result.message());
            return EXIT_FAILED;
        }
        ChunkContext context = result.value();
        out.printf("Context for %s:%d-%d (chunk at lines %d-%d)%n%n", context.filePath(), context.actualStartLine(),
                context.actualEndLine(), startLine, endLine);
        out.println(context.content());
        out.flush();
        return EXIT_OK;
    }

    private int reportStatus(PrintWriter out, EmbeddingStatus status) {
        if (!status.active()) {
            out.printf("provider=none status=unavailable error=%s%n", status.error());
            out.flush();
            return EXIT_FAILED;
        }
        out.printf("provider=%s model=%s dimensions=%d status=active%n", status.provider(), status.model(),
                status.dimensions());
        out.flush();
        return EXIT_OK;
    }

    private int watch(PrintWriter out, CodeIndexService service) throws InterruptedException {
        WatchResult started = service.startWatch(projectPath);
        if (started.status() != WatchResult.Status.STARTED) {
            log.error("Watch not started: {} {}", started.status(), started.message() == null ? "" : started.message());
            return EXIT_FAILED;
        }
        out.printf("Watching %s (Ctrl+C to stop)%n", started.projectPath());
        out.flush();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.stopWatch(projectPath);
            stopped.countDown();
        }, "watch-shutdown"));
        stopped.await();
        return EXIT_OK;
    }
}
