package com.coderag.explore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coderag.search.ProjectNotIndexedException;
import com.coderag.store.ChunkMetadata;
import com.coderag.store.ChunkRecord;
import com.coderag.store.CollectionMetadata;
import com.coderag.store.CollectionNames;
import com.coderag.store.LocalJsonVectorStore;

class ProjectMapBuilderTest {

    @TempDir
    Path tempDir;

    private Path project;
    private LocalJsonVectorStore store;
    private ProjectMapBuilder builder;
    private final List<ChunkRecord> records = new ArrayList<>();

    @BeforeEach
    void setUp() {
        project = tempDir.resolve("shop").toAbsolutePath().normalize();
        store = new LocalJsonVectorStore(tempDir.resolve("store"));
        builder = new ProjectMapBuilder(store);
    }

    private void chunk(String file, String symbol, String language, float... vector) {
        records.add(new ChunkRecord(file + "_" + records.size(), "body",
                new ChunkMetadata(file, 1, 10, language, symbol, "hash", project.toString()), vector));
    }

    private void save() throws Exception {
        String name = CollectionNames.forProject(project);
        store.getOrCreateCollection(name, new CollectionMetadata(project.toString(), "local", "feature-hash-v1", 3));
        store.upsert(name, records);
        store.commit(name);
    }

    @Test
    void shouldGroupSimilarFilesIntoLabelledComponents() throws Exception {
        chunk("api/orders.py", "(imports)", "python", 1, 0, 0);
        chunk("api/orders.py", "create_order", "python", 1, 0.1f, 0);
        chunk("api/payments.py", "charge", "python", 0.9f, 0.1f, 0);
        chunk("db/schema.sql", "orders", "sql", 0, 1, 0);
        save();

        ProjectMap map = builder.build(project);

        assertEquals(project.toString(), map.projectPath());
        assertEquals(3, map.totalFiles());
        assertEquals(4, map.totalChunks());
        assertEquals(2, map.components().size());

        ProjectComponent api = map.components().get(0);
        assertEquals("api", api.label());
        assertEquals(List.of("api/orders.py", "api/payments.py"), api.files());
        assertEquals(2, api.fileCount());
        assertEquals(List.of("charge", "create_order"), api.symbols());
        assertEquals("api", api.directory());
        assertEquals(List.of("python"), api.languages());

        ProjectComponent db = map.components().get(1);
        assertEquals("db", db.label());
        assertEquals(List.of("sql"), db.languages());
        assertTrue(map.relationships().isEmpty(), map.relationships().toString());
    }

    @Test
    void shouldRelateComponentsAboveRelationshipThreshold() throws Exception {
        chunk("x/a.py", "a", "python", 1, 0, 0);
        chunk("y/b.py", "b", "python", 0.6f, 0.8f, 0);
        save();

        ProjectMap map = builder.build(project);

        assertEquals(2, map.components().size());
        assertEquals(1, map.relationships().size());
        ComponentRelationship relationship = map.relationships().get(0);
        assertEquals("x", relationship.source());
        assertEquals("y", relationship.target());
        assertEquals(0.6, relationship.similarity(), 1e-4);
    }

    @Test
    void shouldBuildDirectoryTreeWithNullLeaves() throws Exception {
        chunk("src/app/main.py", "main", "python", 1, 0, 0);
        chunk("README.md", "", "markdown", 0, 1, 0);
        save();

        Map<String, Object> tree = builder.build(project).directoryStructure();

        assertTrue(tree.containsKey("README.md"));
        assertEquals(null, tree.get("README.md"));
        @SuppressWarnings("unchecked")
        Map<String, Object> src = (Map<String, Object>) tree.get("src");
        @SuppressWarnings("unchecked")
        Map<String, Object> app = (Map<String, Object>) src.get("app");
        assertTrue(app.containsKey("main.py"));
    }

    @Test
    void shouldLabelByFileNameOrMostCommonSymbol() {
        assertEquals("main", ProjectMapBuilder.label(List.of("main.py"), Map.of()));
        assertEquals("handler", ProjectMapBuilder.label(List.of("a.py", "b.py"), Map.of(
                "a.py", List.of("(imports)", "handler"),
                "b.py", List.of("handler", "util"))));
        assertEquals("a", ProjectMapBuilder.label(List.of("a.py", "b.py"), Map.of()));
    }

    @Test
    void shouldPreferDeepestSharedDirectoryAsLabel() {
        assertEquals("orders", ProjectMapBuilder.label(
                List.of("src/orders/api.py", "src/orders/model.py"), Map.of()));
    }

    @Test
    void shouldRejectProjectsWithoutChunks() throws Exception {
        assertThrows(ProjectNotIndexedException.class, () -> builder.build(project));

        save();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> builder.build(project));
        assertTrue(error.getMessage().contains("no indexed chunks"), error.getMessage());
    }
}
