package com.coderag.chunking;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterKotlin;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

/**
 * Syntax-tree detector backed by the tree-sitter grammars. Direct children of the root node whose type is
 * a declaration type become spans; wrapper nodes such as {@code export_statement} or
 * {@code decorated_definition} take their name from the declaration they wrap.
 *
 * <p>The grammars ship as native libraries. When one cannot be loaded on this platform the detector
 * answers {@link Optional#empty()} and the pattern detector runs instead.
 */
public class TreeSitterBoundaryDetector implements BoundaryDetector {
    private static final Logger log = LoggerFactory.getLogger(TreeSitterBoundaryDetector.class);

    private static final Set<String> NAME_TYPES =
            Set.of("identifier", "name", "property_identifier", "type_identifier", "simple_identifier");
    private static final Set<String> NESTED_NAME_TYPES = Set.of("identifier", "name", "simple_identifier");
    private static final Set<String> UNAVAILABLE = ConcurrentHashMap.newKeySet();

    private final String language;
    private final Supplier<TSLanguage> grammar;
    private final Set<String> declarationTypes;
    private final Set<String> wrapperTypes;
    private final String wrappedField;

    /**
     * @param wrappedField field of a wrapper node that holds the wrapped declaration, or {@code null}
     */
    TreeSitterBoundaryDetector(String language, Supplier<TSLanguage> grammar, Set<String> declarationTypes,
            Set<String> wrapperTypes, String wrappedField) {
        this.language = language;
        this.grammar = grammar;
        this.declarationTypes = Set.copyOf(declarationTypes);
        this.wrapperTypes = Set.copyOf(wrapperTypes);
        this.wrappedField = wrappedField;
    }

    public static TreeSitterBoundaryDetector python() {
        return new TreeSitterBoundaryDetector("python", TreeSitterPython::new,
                Set.of("function_definition", "class_definition", "decorated_definition"),
                Set.of("decorated_definition"), "definition");
    }

    public static TreeSitterBoundaryDetector javascript() {
        return new TreeSitterBoundaryDetector("javascript", TreeSitterJavascript::new,
                Set.of("function_declaration", "class_declaration", "export_statement",
                        "lexical_declaration", "variable_declaration"),
                Set.of("export_statement"), "declaration");
    }

    public static TreeSitterBoundaryDetector typescript() {
        return new TreeSitterBoundaryDetector("typescript", TreeSitterTypescript::new,
                Set.of("function_declaration", "class_declaration", "export_statement",
                        "lexical_declaration", "variable_declaration", "interface_declaration",
                        "type_alias_declaration", "enum_declaration"),
                Set.of("export_statement"), "declaration");
    }

    public static TreeSitterBoundaryDetector kotlin() {
        return new TreeSitterBoundaryDetector("kotlin", TreeSitterKotlin::new,
                Set.of("class_declaration", "object_declaration", "function_declaration", "property_declaration"),
                Set.of(), null);
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public boolean reportsExactEnds() {
        return true;
    }

    @Override
    public Optional<List<DeclarationSpan>> detect(List<String> lines) {
        if (UNAVAILABLE.contains(language)) {
            return Optional.empty();
        }
        String source = String.join("\n", lines);
        TSTree tree;
        try {
            TSParser parser = new TSParser();
            if (!parser.setLanguage(grammar.get())) {
                markUnavailable("grammar version not supported by the runtime");
                return Optional.empty();
            }
            tree = parser.parseString(null, source);
        } catch (RuntimeException | LinkageError e) {
            markUnavailable(e.toString());
            return Optional.empty();
        }

        TSNode root = tree.getRootNode();
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        List<DeclarationSpan> spans = new ArrayList<>();
        for (int i = 0; i < root.getChildCount(); i++) {
            TSNode child = root.getChild(i);
            if (declarationTypes.contains(child.getType())) {
                spans.add(new DeclarationSpan(
                        child.getStartPoint().getRow() + 1,
                        child.getEndPoint().getRow() + 1,
                        nameOf(child, bytes)));
            }
        }
        if (spans.isEmpty() && root.hasError()) {
            log.debug("chunking.ast.rejected language={} reason=syntax_errors", language);
            return Optional.empty();
        }
        spans.sort(Comparator.comparingInt(DeclarationSpan::startLine));
        return Optional.of(JavaParserBoundaryDetector.merge(spans));
    }

    String nameOf(TSNode node, byte[] source) {
        TSNode target = node;
        if (wrapperTypes.contains(node.getType())) {
            target = wrapped(node);
        }

        for (int i = 0; i < target.getChildCount(); i++) {
            TSNode child = target.getChild(i);
            if (NAME_TYPES.contains(child.getType())) {
                return text(child, source);
            }
        }
        for (int i = 0; i < target.getChildCount(); i++) {
            TSNode child = target.getChild(i);
            if (!child.isNamed()) {
                continue;
            }
            for (int j = 0; j < child.getChildCount(); j++) {
                TSNode grandchild = child.getChild(j);
                if (NESTED_NAME_TYPES.contains(grandchild.getType())) {
                    return text(grandchild, source);
                }
            }
        }
        return node.getType();
    }

    /**
     * The wrapped declaration field when present, else the first named child that is not itself a wrapper.
     */
    private TSNode wrapped(TSNode wrapper) {
        if (wrappedField != null) {
            TSNode declaration = wrapper.getChildByFieldName(wrappedField);
            if (declaration != null && !declaration.isNull()) {
                return declaration;
            }
        }
        for (int i = 0; i < wrapper.getChildCount(); i++) {
            TSNode child = wrapper.getChild(i);
            if (child.isNamed() && !wrapperTypes.contains(child.getType())) {
                return child;
            }
        }
        return wrapper;
    }

    private static String text(TSNode node, byte[] source) {
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(source.length, node.getEndByte());
        return end > start ? new String(source, start, end - start, StandardCharsets.UTF_8) : "";
    }

    private void markUnavailable(String reason) {
        if (UNAVAILABLE.add(language)) {
            log.warn("chunking.ast.unavailable language={} reason={}", language, reason);
        }
    }
}
