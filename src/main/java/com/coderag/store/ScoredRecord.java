package com.coderag.store;

/**
 * A query hit. {@code distance} is the cosine distance in {@code [0, 2]}.
 */
public record ScoredRecord(ChunkRecord record, float distance) {

    public float similarity() {
        return 1f - distance / 2f;
    }
}
