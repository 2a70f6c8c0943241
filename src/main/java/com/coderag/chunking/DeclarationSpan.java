package com.coderag.chunking;

/**
 * A top-level declaration found by a {@link BoundaryDetector}. Lines are 1-indexed and inclusive.
 */
public record DeclarationSpan(int startLine, int endLine, String name) {
}
