package com.coderag.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coderag.embedding.HashingEmbeddingProvider;
import com.coderag.store.ChunkMetadata;
import com.coderag.store.ChunkRecord;
import com.coderag.store.CollectionMetadata;
import com.coderag.store.CollectionNames;
import com.coderag.store.LocalJsonVectorStore;

class CodeSearchServiceTest {

    @TempDir
    Path tempDir;

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(128);
    private LocalJsonVectorStore store;
    private CodeSearchService search;
    private Path billing;
    private Path auth;

    @BeforeEach
    void setUp() throws Exception {
        store = new LocalJsonVectorStore(tempDir.resolve("store"));
        search = new CodeSearchService(store, provider);
        billing = tempDir.resolve("billing").toAbsolutePath().normalize();
        auth = tempDir.resolve("auth").toAbsolutePath().normalize();

        index(billing, "local", "invoice.py", "def compute_invoice_total(items):\n    return sum(items)\n");
        index(auth, "local", "login.py", "def verify_password(user, password):\n    return check(user, password)\n");
    }

    private void index(Path project, String providerName, String file, String content) throws Exception {
        String name = CollectionNames.forProject(project);
        store.getOrCreateCollection(name,
                new CollectionMetadata(project.toString(), providerName, provider.model(), provider.dimensions()));
        ChunkMetadata metadata = new ChunkMetadata(file, 1, 2, "python", "", "hash", project.toString());
        store.upsert(name, List.of(new ChunkRecord(file + "_0", content, metadata,
                provider.embed(List.of(content)).get(0))));
    }

    @Test
    void shouldSearchAcrossAllProjects() throws Exception {
        List<SearchHit> hits = search.search("verify password of user", null, 5);

        assertEquals(2, hits.size());
        assertEquals("login.py", hits.get(0).filePath());
        assertEquals(auth.toString(), hits.get(0).projectPath());
        assertTrue(hits.get(0).similarity() >= hits.get(1).similarity());
    }

    @Test
    void shouldRestrictToOneProjectAndLimitResults() throws Exception {
        List<SearchHit> hits = search.search("invoice total", billing, 5);
        List<SearchHit> limited = search.search("invoice total", null, 1);

        assertEquals(List.of("invoice.py"), hits.stream().map(SearchHit::filePath).toList());
        assertEquals(1, limited.size());
        assertEquals("invoice.py", limited.get(0).filePath());
    }

    @Test
    void shouldRoundSimilarityToFourDecimals() throws Exception {
        double similarity = search.search("invoice total", billing, 1).get(0).similarity();

        assertEquals(similarity, Math.round(similarity * 10_000d) / 10_000d, 0.0);
    }

    @Test
    void shouldSkipCollectionsOfOtherProviders() throws Exception {
        Path legacy = tempDir.resolve("legacy").toAbsolutePath().normalize();
        index(legacy, "openai", "old.py", "def verify_password():\n    pass\n");

        List<SearchHit> hits = search.search("verify password", null, 10);

        assertTrue(hits.stream().noneMatch(hit -> hit.filePath().equals("old.py")));
    }

    @Test
    void shouldRejectUnknownProjectAndBlankQuery() {
        assertThrows(ProjectNotIndexedException.class,
                () -> search.search("anything", tempDir.resolve("unknown"), 5));
        assertThrows(IllegalArgumentException.class, () -> search.search("  ", null, 5));
    }

    @Test
    void shouldReturnNothingForNonPositiveTopK() throws Exception {
        assertTrue(search.search("invoice", null, 0).isEmpty());
    }
}
