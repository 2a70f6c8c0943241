package com.coderag.embedding;

import java.util.ArrayList;
import java.util.List;

final class EmbeddingTexts {
    static final int MAX_CHARS = 6000;
    static final int MIN_CHARS = 500;

    private EmbeddingTexts() {
    }

    static List<String> sanitize(List<String> texts) {
        List<String> sanitized = new ArrayList<>(texts.size());
        for (String text : texts) {
            sanitized.add(truncate(sanitize(text), MAX_CHARS));
        }
        return sanitized;
    }

    // some providers reject empty input
    static String sanitize(String text) {
        String stripped = text == null ? "" : text.strip();
        return stripped.isEmpty() ? " " : stripped;
    }

    static String truncate(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) : text;
    }
}
