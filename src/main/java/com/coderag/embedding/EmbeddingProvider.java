package com.coderag.embedding;

import java.util.List;

public interface EmbeddingProvider {
    String name();

    String model();

    int dimensions();

    /**
     * Returns one vector per input text, in input order.
     */
    List<float[]> embed(List<String> texts) throws EmbeddingException;

    default float[] embedQuery(String query) throws EmbeddingException {
        return embed(List.of(query)).get(0);
    }
}
