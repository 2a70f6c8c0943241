package com.coderag.chunking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * Syntax-tree detector for Java sources. Top-level types become declarations; a type's leading comment is
 * kept with it. Sources the parser rejects are reported as not applicable so the pattern detector runs
 * instead.
 */
public class JavaParserBoundaryDetector implements BoundaryDetector {
    private static final Logger log = LoggerFactory.getLogger(JavaParserBoundaryDetector.class);
    private static final String PARSER_CLASS = "com.github.javaparser.JavaParser";

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
            .setAttributeComments(true);

    public static boolean isAvailable() {
        try {
            Class.forName(PARSER_CLASS, false, JavaParserBoundaryDetector.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    @Override
    public String language() {
        return "java";
    }

    @Override
    public boolean reportsExactEnds() {
        return true;
    }

    @Override
    public Optional<List<DeclarationSpan>> detect(List<String> lines) {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(String.join("\n", lines));
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("chunking.ast.rejected language=java problems={}", result.getProblems().size());
            return Optional.empty();
        }

        List<DeclarationSpan> spans = new ArrayList<>();
        for (TypeDeclaration<?> type : result.getResult().get().getTypes()) {
            Optional<Range> range = type.getRange();
            if (range.isEmpty()) {
                continue;
            }
            int start = type.getComment()
                    .flatMap(Node::getRange)
                    .map(comment -> Math.min(comment.begin.line, range.get().begin.line))
                    .orElse(range.get().begin.line);
            spans.add(new DeclarationSpan(start, range.get().end.line, type.getNameAsString()));
        }
        spans.sort(Comparator.comparingInt(DeclarationSpan::startLine));
        return Optional.of(merge(spans));
    }

    static List<DeclarationSpan> merge(List<DeclarationSpan> sorted) {
        List<DeclarationSpan> merged = new ArrayList<>();
        for (DeclarationSpan span : sorted) {
            if (!merged.isEmpty()) {
                DeclarationSpan previous = merged.get(merged.size() - 1);
                if (span.startLine() <= previous.endLine() + 1) {
                    String name = previous.name() != null && !previous.name().isEmpty() ? previous.name() : span.name();
                    merged.set(merged.size() - 1,
                            new DeclarationSpan(previous.startLine(), Math.max(previous.endLine(), span.endLine()), name));
                    continue;
                }
            }
            merged.add(span);
        }
        return merged;
    }
}
