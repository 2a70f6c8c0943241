package com.coderag.chunking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the chunker for a file extension: syntax-tree detector first, then the pattern detector, then
 * plain sliding windows. Selection never fails; a tier that is unavailable is skipped.
 */
public class ChunkerSelector {
    private static final Logger log = LoggerFactory.getLogger(ChunkerSelector.class);

    private final Map<String, Supplier<BoundaryDetector>> astDetectors;
    private final Map<String, Supplier<BoundaryDetector>> patternDetectors;
    private final boolean astEnabled;

    public ChunkerSelector(boolean astEnabled) {
        this(defaultAstDetectors(), defaultPatternDetectors(), astEnabled);
    }

    ChunkerSelector(
            Map<String, Supplier<BoundaryDetector>> astDetectors,
            Map<String, Supplier<BoundaryDetector>> patternDetectors,
            boolean astEnabled) {
        this.astDetectors = Map.copyOf(astDetectors);
        this.patternDetectors = Map.copyOf(patternDetectors);
        this.astEnabled = astEnabled;
    }

    public CodeChunker select(String extension) {
        String key = normalize(extension);
        List<BoundaryDetector> tiers = new ArrayList<>(2);
        if (astEnabled) {
            addTier(tiers, astDetectors, key);
        }
        addTier(tiers, patternDetectors, key);
        if (tiers.isEmpty()) {
            return new SlidingWindowChunker();
        }
        return new CascadingChunker(tiers);
    }

    public CodeChunker selectForFile(String fileName) {
        return select(extensionOf(fileName));
    }

    public Set<String> supportedExtensions() {
        Set<String> extensions = new TreeSet<>(patternDetectors.keySet());
        extensions.addAll(astDetectors.keySet());
        return extensions;
    }

    public static String extensionOf(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static void addTier(List<BoundaryDetector> tiers, Map<String, Supplier<BoundaryDetector>> registry, String key) {
        Supplier<BoundaryDetector> factory = registry.get(key);
        if (factory == null) {
            return;
        }
        try {
            tiers.add(factory.get());
        } catch (RuntimeException | LinkageError e) {
            log.warn("chunking.tier.unavailable extension={} reason={}", key, e.toString());
        }
    }

    private static String normalize(String extension) {
        if (extension == null || extension.isBlank()) {
            return "";
        }
        String lower = extension.toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }

    /**
     * No tree-sitter grammar is registered for {@code .tsx} or {@code .sql}; those go straight to the
     * pattern tier.
     */
    private static Map<String, Supplier<BoundaryDetector>> defaultAstDetectors() {
        Map<String, Supplier<BoundaryDetector>> detectors = new LinkedHashMap<>();
        if (JavaParserBoundaryDetector.isAvailable()) {
            detectors.put(".java", JavaParserBoundaryDetector::new);
        }
        detectors.put(".py", TreeSitterBoundaryDetector::python);
        detectors.put(".js", TreeSitterBoundaryDetector::javascript);
        detectors.put(".jsx", TreeSitterBoundaryDetector::javascript);
        detectors.put(".mjs", TreeSitterBoundaryDetector::javascript);
        detectors.put(".cjs", TreeSitterBoundaryDetector::javascript);
        detectors.put(".ts", TreeSitterBoundaryDetector::typescript);
        detectors.put(".kt", TreeSitterBoundaryDetector::kotlin);
        detectors.put(".kts", TreeSitterBoundaryDetector::kotlin);
        return detectors;
    }

    private static Map<String, Supplier<BoundaryDetector>> defaultPatternDetectors() {
        Map<String, Supplier<BoundaryDetector>> detectors = new LinkedHashMap<>();
        detectors.put(".py", LanguageDetectors::python);
        detectors.put(".java", LanguageDetectors::java);
        detectors.put(".kt", LanguageDetectors::kotlin);
        detectors.put(".kts", LanguageDetectors::kotlin);
        detectors.put(".js", LanguageDetectors::javascript);
        detectors.put(".jsx", LanguageDetectors::javascript);
        detectors.put(".mjs", LanguageDetectors::javascript);
        detectors.put(".cjs", LanguageDetectors::javascript);
        detectors.put(".ts", LanguageDetectors::typescript);
        detectors.put(".tsx", LanguageDetectors::typescript);
        detectors.put(".sql", LanguageDetectors::sql);
        return detectors;
    }
}
