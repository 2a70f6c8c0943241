package com.coderag.explore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.chunking.CascadingChunker;
import com.coderag.search.ProjectNotIndexedException;
import com.coderag.store.ChunkMetadata;
import com.coderag.store.ChunkRecord;
import com.coderag.store.CollectionInfo;
import com.coderag.store.CollectionNames;
import com.coderag.store.VectorStore;
import com.coderag.store.VectorStoreException;
import com.coderag.store.Vectors;

/**
 * Builds a map of an indexed project from its stored vectors. Each file is represented by the mean of its
 * chunk embeddings; files at cosine similarity of at least {@value #COMPONENT_THRESHOLD} end up in the same
 * component (single linkage). Components whose mean vectors reach {@value #RELATIONSHIP_THRESHOLD} are
 * reported as related.
 */
public class ProjectMapBuilder {
    private static final Logger log = LoggerFactory.getLogger(ProjectMapBuilder.class);

    static final double COMPONENT_THRESHOLD = 0.7;
    static final double RELATIONSHIP_THRESHOLD = 0.5;
    static final int MAX_SYMBOLS = 20;
    static final int MAX_RELATIONSHIPS = 20;

    private static final Set<String> STRUCTURAL_SYMBOLS =
            Set.of(CascadingChunker.IMPORTS_SYMBOL, CascadingChunker.TRAILING_SYMBOL);

    private final VectorStore store;

    public ProjectMapBuilder(VectorStore store) {
        this.store = store;
    }

    /**
     * @throws ProjectNotIndexedException if the project has no collection
     * @throws IllegalArgumentException if the collection holds no chunks
     */
    public ProjectMap build(Path project) throws VectorStoreException {
        Path root = project.toAbsolutePath().normalize();
        CollectionInfo collection = store.getCollection(CollectionNames.forProject(root))
                .orElseThrow(() -> new ProjectNotIndexedException(root));
        if (collection.count() == 0) {
            throw new IllegalArgumentException("Project has no indexed chunks: " + root + ". Run index first.");
        }

        List<ChunkRecord> records = store.getAll(collection.name());
        Map<String, List<float[]>> chunkVectors = new TreeMap<>();
        Map<String, List<String>> fileSymbols = new HashMap<>();
        Map<String, String> fileLanguages = new HashMap<>();
        for (ChunkRecord record : records) {
            ChunkMetadata metadata = record.metadata();
            String filePath = metadata == null ? null : metadata.filePath();
            if (filePath == null || filePath.isEmpty() || record.embedding() == null) {
                continue;
            }
            chunkVectors.computeIfAbsent(filePath, key -> new ArrayList<>()).add(record.embedding());
            if (!metadata.symbolName().isEmpty()) {
                fileSymbols.computeIfAbsent(filePath, key -> new ArrayList<>()).add(metadata.symbolName());
            }
            if (!metadata.language().isEmpty()) {
                fileLanguages.put(filePath, metadata.language());
            }
        }

        Map<String, float[]> fileVectors = new LinkedHashMap<>();
        chunkVectors.forEach((file, vectors) -> fileVectors.put(file, Vectors.average(vectors)));

        List<List<String>> groups = cluster(fileVectors);
        List<ProjectComponent> components = new ArrayList<>();
        List<float[]> componentVectors = new ArrayList<>();
        for (List<String> files : groups) {
            int id = components.size();
            components.add(new ProjectComponent(
                    id,
                    label(files, fileSymbols),
                    files,
                    files.size(),
                    symbols(files, fileSymbols),
                    primaryDirectory(files),
                    languages(files, fileLanguages)));
            List<float[]> vectors = new ArrayList<>();
            files.forEach(file -> vectors.add(fileVectors.get(file)));
            componentVectors.add(Vectors.average(vectors));
        }

        List<ComponentRelationship> relationships = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            for (int j = i + 1; j < components.size(); j++) {
                double similarity = Vectors.cosine(componentVectors.get(i), componentVectors.get(j));
                if (similarity >= RELATIONSHIP_THRESHOLD) {
                    relationships.add(new ComponentRelationship(
                            components.get(i).label(),
                            components.get(j).label(),
                            Math.round(similarity * 10_000d) / 10_000d));
                }
            }
        }
        relationships.sort(Comparator.comparingDouble(ComponentRelationship::similarity).reversed());

        log.debug("project.map.built path={} files={} components={} relationships={}",
                root, fileVectors.size(), components.size(), relationships.size());
        return new ProjectMap(
                root.toString(),
                fileVectors.size(),
                records.size(),
                components,
                relationships.size() > MAX_RELATIONSHIPS
                        ? List.copyOf(relationships.subList(0, MAX_RELATIONSHIPS))
                        : relationships,
                directoryTree(fileVectors.keySet()));
    }

    /**
     * Union-find over every file pair. Groups come back largest first, each sorted by path.
     */
    static List<List<String>> cluster(Map<String, float[]> fileVectors) {
        List<String> files = new ArrayList<>(fileVectors.keySet());
        int[] parent = new int[files.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < files.size(); i++) {
            for (int j = i + 1; j < files.size(); j++) {
                double similarity = Vectors.cosine(fileVectors.get(files.get(i)), fileVectors.get(files.get(j)));
                if (similarity >= COMPONENT_THRESHOLD) {
                    int rootI = find(parent, i);
                    int rootJ = find(parent, j);
                    if (rootI != rootJ) {
                        parent[rootI] = rootJ;
                    }
                }
            }
        }

        Map<Integer, List<String>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            byRoot.computeIfAbsent(find(parent, i), key -> new ArrayList<>()).add(files.get(i));
        }
        List<List<String>> groups = new ArrayList<>();
        for (List<String> group : byRoot.values()) {
            group.sort(Comparator.naturalOrder());
            groups.add(List.copyOf(group));
        }
        groups.sort(Comparator.<List<String>>comparingInt(List::size).reversed()
                .thenComparing(group -> group.get(0)));
        return groups;
    }

    private static int find(int[] parent, int node) {
        while (parent[node] != node) {
            parent[node] = parent[parent[node]];
            node = parent[node];
        }
        return node;
    }

    /**
     * Deepest directory shared by every file, else the file name for a single file, else the most frequent
     * symbol, else the first file name.
     */
    static String label(List<String> files, Map<String, List<String>> fileSymbols) {
        List<String[]> paths = new ArrayList<>();
        files.forEach(file -> paths.add(file.split("/")));
        if (paths.stream().allMatch(parts -> parts.length > 1)) {
            Set<String> common = new TreeSet<>(directories(paths.get(0)));
            for (String[] parts : paths.subList(1, paths.size())) {
                common.retainAll(directories(parts));
            }
            String deepest = null;
            int deepestIndex = -1;
            for (String directory : common) {
                int index = deepestIndex(directory, paths);
                if (index > deepestIndex) {
                    deepest = directory;
                    deepestIndex = index;
                }
            }
            if (deepest != null && !deepest.isEmpty() && !".".equals(deepest)) {
                return deepest;
            }
        }

        if (files.size() == 1) {
            return baseName(files.get(0));
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String file : files) {
            for (String symbol : fileSymbols.getOrDefault(file, List.of())) {
                if (!symbol.isEmpty() && !STRUCTURAL_SYMBOLS.contains(symbol)) {
                    counts.merge(symbol, 1, Integer::sum);
                }
            }
        }
        String top = null;
        int topCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > topCount) {
                top = entry.getKey();
                topCount = entry.getValue();
            }
        }
        return top != null ? top : baseName(files.get(0));
    }

    private static List<String> directories(String[] parts) {
        return List.of(parts).subList(0, parts.length - 1);
    }

    private static int deepestIndex(String directory, List<String[]> paths) {
        int deepest = -1;
        for (String[] parts : paths) {
            for (int i = 0; i < parts.length; i++) {
                if (parts[i].equals(directory)) {
                    deepest = Math.max(deepest, i);
                }
            }
        }
        return deepest;
    }

    private static String baseName(String file) {
        String name = file.substring(file.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<String> symbols(List<String> files, Map<String, List<String>> fileSymbols) {
        Set<String> symbols = new TreeSet<>();
        for (String file : files) {
            for (String symbol : fileSymbols.getOrDefault(file, List.of())) {
                if (!STRUCTURAL_SYMBOLS.contains(symbol)) {
                    symbols.add(symbol);
                }
            }
        }
        return symbols.stream().limit(MAX_SYMBOLS).toList();
    }

    private static String primaryDirectory(List<String> files) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String file : files) {
            int slash = file.indexOf('/');
            counts.merge(slash > 0 ? file.substring(0, slash) : ".", 1, Integer::sum);
        }
        String primary = ".";
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                primary = entry.getKey();
                best = entry.getValue();
            }
        }
        return primary;
    }

    private static List<String> languages(List<String> files, Map<String, String> fileLanguages) {
        Set<String> languages = new TreeSet<>();
        for (String file : files) {
            String language = fileLanguages.get(file);
            if (language != null) {
                languages.add(language);
            }
        }
        return List.copyOf(languages);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> directoryTree(Iterable<String> files) {
        Map<String, Object> tree = new TreeMap<>();
        for (String file : files) {
            String[] parts = file.split("/");
            Map<String, Object> current = tree;
            for (int i = 0; i < parts.length - 1; i++) {
                Object child = current.get(parts[i]);
                if (!(child instanceof Map)) {
                    child = new TreeMap<String, Object>();
                    current.put(parts[i], child);
                }
                current = (Map<String, Object>) child;
            }
            current.putIfAbsent(parts[parts.length - 1], null);
        }
        return tree;
    }
}
