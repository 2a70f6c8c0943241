package com.coderag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered ignore predicates evaluated short-circuit: directory names, extensions, {@code .gitignore}
 * patterns, size ceiling. Paths are relative to the project root with {@code /} separators.
 */
public final class IgnoreRules {
    private static final Logger log = LoggerFactory.getLogger(IgnoreRules.class);

    public static final long UNKNOWN_SIZE = -1;

    public static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of(
            ".git", ".idea", ".vscode", "node_modules", "__pycache__",
            ".gradle", "build", "dist", "target", ".next", "venv", ".venv",
            ".mypy_cache", ".pytest_cache", ".tox", "vendor");

    public static final Set<String> DEFAULT_IGNORED_EXTENSIONS = Set.of(
            ".pyc", ".class", ".jar", ".war", ".o", ".so", ".dylib",
            ".exe", ".dll", ".png", ".jpg", ".jpeg", ".gif", ".svg",
            ".ico", ".woff", ".woff2", ".ttf", ".eot", ".mp3", ".mp4",
            ".zip", ".tar", ".gz", ".lock", ".min.js", ".min.css");

    @FunctionalInterface
    interface IgnoreRule {
        Optional<IgnoreReason> test(String relativePath, long sizeBytes);
    }

    private final Set<String> ignoredDirectories;
    private final List<IgnoreRule> rules;

    IgnoreRules(IndexingSettings settings, List<String> ignoreFilePatterns) {
        Set<String> directories = new HashSet<>(DEFAULT_IGNORED_DIRECTORIES);
        directories.addAll(settings.extraIgnoredDirectories());
        this.ignoredDirectories = Set.copyOf(directories);

        Set<String> extensions = new HashSet<>(DEFAULT_IGNORED_EXTENSIONS);
        settings.extraIgnoredExtensions().forEach(ext -> extensions.add(ext.toLowerCase(Locale.ROOT)));

        List<PatternMatcher> patterns = ignoreFilePatterns.stream().map(PatternMatcher::new).toList();
        long maxSize = settings.maxFileSizeBytes();

        this.rules = List.of(
                (path, size) -> directoryRule(path),
                (path, size) -> extensionRule(path, extensions),
                (path, size) -> patterns.stream().anyMatch(pattern -> pattern.matches(path))
                        ? Optional.of(IgnoreReason.IGNORE_FILE_PATTERN)
                        : Optional.empty(),
                (path, size) -> size > maxSize ? Optional.of(IgnoreReason.TOO_LARGE) : Optional.empty());
    }

    public static IgnoreRules withoutIgnoreFile(IndexingSettings settings) {
        return new IgnoreRules(settings, List.of());
    }

    /**
     * Rules for a project, including the basic patterns of its root {@code .gitignore}. An unreadable ignore
     * file is logged and treated as empty.
     */
    public static IgnoreRules forProject(Path root, IndexingSettings settings) {
        return new IgnoreRules(settings, loadIgnoreFile(root.resolve(".gitignore")));
    }

    public boolean isIgnoredDirectory(String directoryName) {
        return ignoredDirectories.contains(directoryName);
    }

    public Optional<IgnoreReason> check(String relativePath, long sizeBytes) {
        for (IgnoreRule rule : rules) {
            Optional<IgnoreReason> reason = rule.test(relativePath, sizeBytes);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }

    public boolean isIgnored(String relativePath, long sizeBytes) {
        return check(relativePath, sizeBytes).isPresent();
    }

    private Optional<IgnoreReason> directoryRule(String relativePath) {
        String[] parts = relativePath.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (ignoredDirectories.contains(parts[i])) {
                return Optional.of(IgnoreReason.IGNORED_DIRECTORY);
            }
        }
        return Optional.empty();
    }

    private static Optional<IgnoreReason> extensionRule(String relativePath, Set<String> extensions) {
        String fileName = relativePath.substring(relativePath.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) {
                return Optional.of(IgnoreReason.IGNORED_EXTENSION);
            }
        }
        return Optional.empty();
    }

    static List<String> loadIgnoreFile(Path ignoreFile) {
        if (!Files.isRegularFile(ignoreFile)) {
            return List.of();
        }
        List<String> patterns = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(ignoreFile, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("!")) {
                    continue;
                }
                patterns.add(trimmed);
            }
        } catch (IOException e) {
            log.warn("ingest.ignore_file.unreadable path={} reason={}", ignoreFile, e.toString());
            return List.of();
        }
        return patterns;
    }

    /**
     * Basic ignore-file matching: substring or suffix match on the relative path, plus glob matching on the
     * path and the file name when the pattern holds a wildcard.
     */
    static final class PatternMatcher {
        private final String pattern;
        private final PathMatcher glob;

        PatternMatcher(String raw) {
            String stripped = raw;
            while (stripped.endsWith("/")) {
                stripped = stripped.substring(0, stripped.length() - 1);
            }
            if (stripped.startsWith("/")) {
                stripped = stripped.substring(1);
            }
            this.pattern = stripped;
            this.glob = stripped.contains("*") || stripped.contains("?") ? compileGlob(stripped) : null;
        }

        private static PathMatcher compileGlob(String pattern) {
            try {
                return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            } catch (PatternSyntaxException e) {
                log.warn("ingest.ignore_pattern.invalid pattern={} reason={}", pattern, e.getDescription());
                return null;
            }
        }

        boolean matches(String relativePath) {
            if (pattern.isEmpty()) {
                return false;
            }
            if (relativePath.contains(pattern) || relativePath.endsWith(pattern)) {
                return true;
            }
            if (glob == null) {
                return false;
            }
            Path path = Path.of(relativePath);
            if (glob.matches(path) || (path.getFileName() != null && glob.matches(path.getFileName()))) {
                return true;
            }
            for (Path parent = path.getParent(); parent != null; parent = parent.getParent()) {
                if (parent.getFileName() != null && glob.matches(parent.getFileName())) {
                    return true;
                }
            }
            return false;
        }
    }
}
