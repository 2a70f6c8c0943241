package com.coderag.chunking;

import java.util.Arrays;
import java.util.List;

final class SourceLines {
    private SourceLines() {
    }

    static List<String> split(String content) {
        String[] parts = content.split("\n", -1);
        int length = parts.length;
        // a terminating newline closes the last line, it does not open a new one
        if (length > 1 && parts[length - 1].isEmpty()) {
            length--;
        }
        return Arrays.asList(Arrays.copyOf(parts, length));
    }

    static String join(List<String> lines, int startLine, int endLine) {
        return String.join("\n", lines.subList(startLine - 1, endLine));
    }

    static boolean isBlank(List<String> lines, int startLine, int endLine) {
        for (int i = startLine - 1; i < endLine; i++) {
            if (!lines.get(i).isBlank()) {
                return false;
            }
        }
        return true;
    }
}
