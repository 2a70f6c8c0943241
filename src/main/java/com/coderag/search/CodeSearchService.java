package com.coderag.search;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.embedding.EmbeddingException;
import com.coderag.embedding.EmbeddingProvider;
import com.coderag.store.ChunkMetadata;
import com.coderag.store.CollectionInfo;
import com.coderag.store.CollectionNames;
import com.coderag.store.ScoredRecord;
import com.coderag.store.VectorStore;
import com.coderag.store.VectorStoreException;

/**
 * Vector search over one project or every indexed project. Collections built with another embedding
 * provider are skipped because their vectors are not comparable with the query vector.
 */
public class CodeSearchService {
    private static final Logger log = LoggerFactory.getLogger(CodeSearchService.class);

    private final VectorStore store;
    private final EmbeddingProvider embeddingProvider;

    public CodeSearchService(VectorStore store, EmbeddingProvider embeddingProvider) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
    }

    /**
     * @param project project root, or {@code null} to search all indexed projects
     * @throws ProjectNotIndexedException if {@code project} has no collection
     */
    public List<SearchHit> search(String query, Path project, int topK) throws EmbeddingException, VectorStoreException {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (topK <= 0) {
            return List.of();
        }

        List<CollectionInfo> collections = new ArrayList<>();
        if (project != null) {
            Path normalized = project.toAbsolutePath().normalize();
            Optional<CollectionInfo> info = store.getCollection(CollectionNames.forProject(normalized));
            collections.add(info.orElseThrow(() -> new ProjectNotIndexedException(normalized)));
        } else {
            collections.addAll(store.listCollections());
        }

        float[] queryVector = embeddingProvider.embedQuery(query);
        List<SearchHit> hits = new ArrayList<>();
        for (CollectionInfo collection : collections) {
            if (collection.count() == 0) {
                continue;
            }
            String provider = collection.metadata() == null ? null : collection.metadata().embeddingProvider();
            if (provider != null && !provider.equals(embeddingProvider.name())) {
                log.warn("search.collection.skipped name={} stored={} active={}",
                        collection.name(), provider, embeddingProvider.name());
                continue;
            }
            for (ScoredRecord scored : store.query(collection.name(), queryVector, topK)) {
                hits.add(toHit(scored));
            }
        }

        hits.sort(Comparator.comparingDouble(SearchHit::similarity).reversed());
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
    }

    private static SearchHit toHit(ScoredRecord scored) {
        ChunkMetadata metadata = scored.record().metadata();
        double similarity = Math.round(scored.similarity() * 10_000d) / 10_000d;
        return new SearchHit(
                metadata.filePath(),
                metadata.startLine(),
                metadata.endLine(),
                metadata.symbolName(),
                metadata.language(),
                scored.record().document(),
                similarity,
                metadata.projectPath());
    }
}
