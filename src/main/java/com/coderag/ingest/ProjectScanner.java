package com.coderag.ingest;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a project tree once, pruning ignored directories, and returns the indexable files ordered by
 * relative path.
 */
public class ProjectScanner {
    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    public List<CandidateFile> scan(Path root, IgnoreRules rules) throws IOException {
        List<CandidateFile> candidates = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && rules.isIgnoredDirectory(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                String relative = relativePath(root, file);
                if (!rules.isIgnored(relative, attrs.size())) {
                    candidates.add(new CandidateFile(file, relative));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("ingest.scan.unreadable path={} reason={}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
        candidates.sort(Comparator.comparing(CandidateFile::relativePath));
        return candidates;
    }

    public static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace(File.separatorChar, '/');
    }
}
