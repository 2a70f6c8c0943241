package com.coderag.chunking;

import java.util.ArrayList;
import java.util.List;

public class SlidingWindowChunker implements CodeChunker {
    static final int WINDOW_LINES = 50;
    static final int STRIDE_LINES = 40;

    private final String language;

    public SlidingWindowChunker() {
        this("");
    }

    public SlidingWindowChunker(String language) {
        this.language = language == null ? "" : language;
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public List<Chunk> chunk(String content, String filePath) {
        List<String> lines = SourceLines.split(content);
        if (lines.size() <= WINDOW_LINES) {
            return List.of(new Chunk(content, filePath, 1, lines.size(), null, language));
        }
        return windows(lines, filePath, language);
    }

    static List<Chunk> windows(List<String> lines, String filePath, String language) {
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < lines.size()) {
            int endExclusive = Math.min(lines.size(), start + WINDOW_LINES);
            chunks.add(new Chunk(
                    SourceLines.join(lines, start + 1, endExclusive),
                    filePath,
                    start + 1,
                    endExclusive,
                    null,
                    language));
            if (endExclusive == lines.size()) {
                break;
            }
            start += STRIDE_LINES;
        }
        return chunks;
    }
}
