package com.coderag.explore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.coderag.ingest.IndexMaintainer;

/**
 * Reads the lines around a search hit and marks where the chunk starts and ends.
 */
public final class ChunkContextReader {
    public static final int DEFAULT_CONTEXT_LINES = 15;

    static final String START_MARKER = ">>> CHUNK START >>> ";
    static final String END_MARKER = "<<< CHUNK END <<<   ";
    static final String SINGLE_LINE_END = " <<< CHUNK END <<<";
    static final String PLAIN_PREFIX = "                   ";

    private ChunkContextReader() {
    }

    public static ChunkContext read(Path file, int startLine, int endLine) throws IOException {
        return read(file, startLine, endLine, DEFAULT_CONTEXT_LINES, DEFAULT_CONTEXT_LINES);
    }

    /**
     * @throws NoSuchFileException if {@code file} is not a regular file
     * @throws IllegalArgumentException if the line range is invalid or starts past the end of the file
     */
    public static ChunkContext read(Path file, int startLine, int endLine, int before, int after) throws IOException {
        Path target = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(target)) {
            throw new NoSuchFileException(target.toString(), null, "File not found");
        }
        if (startLine < 1 || endLine < 1) {
            throw new IllegalArgumentException("Line numbers must be >= 1");
        }
        if (startLine > endLine) {
            throw new IllegalArgumentException("start line (" + startLine + ") cannot be > end line (" + endLine + ")");
        }
        if (before < 0 || after < 0) {
            throw new IllegalArgumentException("Context line counts must be >= 0");
        }

        List<String> lines = lines(IndexMaintainer.readContent(target));
        if (startLine > lines.size()) {
            throw new IllegalArgumentException(
                    "start line (" + startLine + ") exceeds file length (" + lines.size() + ")");
        }

        int first = Math.max(1, startLine - before);
        int last = Math.min(lines.size(), endLine + after);
        List<String> output = new ArrayList<>(last - first + 1);
        for (int lineNumber = first; lineNumber <= last; lineNumber++) {
            String line = lines.get(lineNumber - 1);
            if (lineNumber == startLine && lineNumber == endLine) {
                output.add(START_MARKER + line + SINGLE_LINE_END);
            } else if (lineNumber == startLine) {
                output.add(START_MARKER + line);
            } else if (lineNumber == endLine) {
                output.add(END_MARKER + line);
            } else {
                output.add(PLAIN_PREFIX + line);
            }
        }

        return new ChunkContext(
                target.toString(),
                String.join("\n", output),
                first,
                last,
                startLine - first + 1,
                endLine - first + 1);
    }

    private static List<String> lines(String content) {
        List<String> lines = new ArrayList<>(List.of(content.split("\r\n|\r|\n", -1)));
        // a terminating newline closes the last line
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
