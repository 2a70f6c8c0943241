package com.coderag.chunking;

import java.util.List;
import java.util.Optional;

/**
 * Finds the top-level declarations of one language.
 *
 * <p>An empty {@code Optional} means the detector cannot handle this content (for example the parser
 * rejected it) and the next detector in the cascade should be tried. An empty list means the content was
 * understood but holds no declarations.
 */
public interface BoundaryDetector {
    String language();

    Optional<List<DeclarationSpan>> detect(List<String> lines);

    /**
     * Whether span ends come straight from a syntax tree. Such detectors also get a trailing chunk for the
     * lines after their last declaration.
     */
    default boolean reportsExactEnds() {
        return false;
    }
}
