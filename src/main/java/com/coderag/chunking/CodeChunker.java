package com.coderag.chunking;

import java.util.List;

public interface CodeChunker {
    String language();

    List<Chunk> chunk(String content, String filePath);
}
