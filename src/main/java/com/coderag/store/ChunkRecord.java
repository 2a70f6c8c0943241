package com.coderag.store;

public record ChunkRecord(String id, String document, ChunkMetadata metadata, float[] embedding) {
}
