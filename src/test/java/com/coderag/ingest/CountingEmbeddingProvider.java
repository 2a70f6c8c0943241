package com.coderag.ingest;

import java.util.ArrayList;
import java.util.List;

import com.coderag.embedding.EmbeddingException;
import com.coderag.embedding.EmbeddingProvider;
import com.coderag.embedding.HashingEmbeddingProvider;

/**
 * Hashing vectors under a configurable provider name, recording every batch it is asked to embed.
 */
class CountingEmbeddingProvider implements EmbeddingProvider {
    private final String name;
    private final HashingEmbeddingProvider delegate = new HashingEmbeddingProvider(32);
    final List<Integer> batchSizes = new ArrayList<>();
    EmbeddingException failure;

    CountingEmbeddingProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return name + "-model";
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }

    @Override
    public List<float[]> embed(List<String> texts) throws EmbeddingException {
        batchSizes.add(texts.size());
        if (failure != null) {
            throw failure;
        }
        return delegate.embed(texts);
    }

    int calls() {
        return batchSizes.size();
    }

    int textsEmbedded() {
        return batchSizes.stream().mapToInt(Integer::intValue).sum();
    }
}
