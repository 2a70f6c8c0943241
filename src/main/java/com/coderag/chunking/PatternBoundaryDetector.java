package com.coderag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented detector: a declaration starts on a column-zero line matching {@code declarationPattern}.
 * A declaration runs until the line before the next one; for brace languages the end is pulled in to the
 * line that closes the first block opened by the declaration.
 */
public class PatternBoundaryDetector implements BoundaryDetector {
    private final String language;
    private final Pattern declarationPattern;
    private final Function<Matcher, String> nameExtractor;
    private final boolean braceBlocks;
    private final Pattern attachedPrefixPattern;

    public PatternBoundaryDetector(
            String language,
            Pattern declarationPattern,
            Function<Matcher, String> nameExtractor,
            boolean braceBlocks,
            Pattern attachedPrefixPattern) {
        this.language = language;
        this.declarationPattern = declarationPattern;
        this.nameExtractor = nameExtractor;
        this.braceBlocks = braceBlocks;
        this.attachedPrefixPattern = attachedPrefixPattern;
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public Optional<List<DeclarationSpan>> detect(List<String> lines) {
        List<Integer> starts = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) {
                continue;
            }
            Matcher matcher = declarationPattern.matcher(line);
            if (matcher.lookingAt()) {
                starts.add(i);
                names.add(blankToNull(nameExtractor.apply(matcher)));
            }
        }

        attachPrefixes(lines, starts);

        List<DeclarationSpan> spans = new ArrayList<>(starts.size());
        for (int idx = 0; idx < starts.size(); idx++) {
            int start = starts.get(idx);
            int maxEnd = idx + 1 < starts.size() ? starts.get(idx + 1) - 1 : lines.size() - 1;
            int end = braceBlocks ? blockEnd(lines, start, maxEnd) : maxEnd;
            spans.add(new DeclarationSpan(start + 1, end + 1, names.get(idx)));
        }
        return Optional.of(spans);
    }

    private void attachPrefixes(List<String> lines, List<Integer> starts) {
        if (attachedPrefixPattern == null) {
            return;
        }
        for (int idx = 0; idx < starts.size(); idx++) {
            int floor = idx == 0 ? -1 : starts.get(idx - 1);
            int start = starts.get(idx);
            while (start - 1 > floor && attachedPrefixPattern.matcher(lines.get(start - 1)).lookingAt()) {
                start--;
            }
            starts.set(idx, start);
        }
    }

    static int blockEnd(List<String> lines, int start, int maxEnd) {
        int depth = 0;
        boolean opened = false;
        for (int i = start; i <= maxEnd; i++) {
            String line = lines.get(i);
            for (int c = 0; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                }
            }
            if (depth > 0) {
                opened = true;
            } else if (opened) {
                return i;
            }
        }
        return maxEnd;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
