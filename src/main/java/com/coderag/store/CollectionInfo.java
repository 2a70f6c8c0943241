package com.coderag.store;

public record CollectionInfo(String name, CollectionMetadata metadata, int count) {
}
