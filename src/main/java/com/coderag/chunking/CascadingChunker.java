package com.coderag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ordered list of detectors and assembles chunks from the first one that can handle the content.
 * When none can, the file is cut into sliding windows.
 */
public class CascadingChunker implements CodeChunker {
    private static final Logger log = LoggerFactory.getLogger(CascadingChunker.class);

    static final int SMALL_FILE_LINES = 30;
    public static final String IMPORTS_SYMBOL = "(imports)";
    public static final String TRAILING_SYMBOL = "(trailing)";

    private final List<BoundaryDetector> detectors;

    public CascadingChunker(List<BoundaryDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    @Override
    public String language() {
        return detectors.isEmpty() ? "" : detectors.get(0).language();
    }

    List<BoundaryDetector> detectors() {
        return detectors;
    }

    @Override
    public List<Chunk> chunk(String content, String filePath) {
        List<String> lines = SourceLines.split(content);
        if (lines.size() <= SMALL_FILE_LINES) {
            return List.of(new Chunk(content, filePath, 1, lines.size(), null, language()));
        }

        for (BoundaryDetector detector : detectors) {
            Optional<List<DeclarationSpan>> spans;
            try {
                spans = detector.detect(lines);
            } catch (RuntimeException e) {
                log.warn("chunking.detector.failed language={} file={} reason={}", detector.language(), filePath, e.toString());
                continue;
            }
            if (spans.isPresent()) {
                return assemble(detector, lines, spans.get(), filePath);
            }
            log.debug("chunking.detector.skipped language={} file={}", detector.language(), filePath);
        }
        return SlidingWindowChunker.windows(lines, filePath, "");
    }

    private List<Chunk> assemble(BoundaryDetector detector, List<String> lines, List<DeclarationSpan> spans, String filePath) {
        String language = detector.language();
        if (spans.isEmpty()) {
            return SlidingWindowChunker.windows(lines, filePath, language);
        }

        int lastLine = lines.size();
        List<Chunk> chunks = new ArrayList<>(spans.size() + 2);
        int firstStart = spans.get(0).startLine();
        if (firstStart > 1 && !SourceLines.isBlank(lines, 1, firstStart - 1)) {
            chunks.add(new Chunk(SourceLines.join(lines, 1, firstStart - 1), filePath, 1, firstStart - 1, IMPORTS_SYMBOL, language));
        }

        int previousEnd = 0;
        for (DeclarationSpan span : spans) {
            int start = Math.max(span.startLine(), previousEnd + 1);
            int end = Math.min(Math.max(span.endLine(), start), lastLine);
            if (start > lastLine) {
                break;
            }
            chunks.add(new Chunk(SourceLines.join(lines, start, end), filePath, start, end, span.name(), language));
            previousEnd = end;
        }

        if (detector.reportsExactEnds() && previousEnd < lastLine && !SourceLines.isBlank(lines, previousEnd + 1, lastLine)) {
            chunks.add(new Chunk(SourceLines.join(lines, previousEnd + 1, lastLine), filePath, previousEnd + 1, lastLine, TRAILING_SYMBOL, language));
        }
        return chunks;
    }
}
