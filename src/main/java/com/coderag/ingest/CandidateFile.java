package com.coderag.ingest;

import java.nio.file.Path;

public record CandidateFile(Path absolutePath, String relativePath) {
}
