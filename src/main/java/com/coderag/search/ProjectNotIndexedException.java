package com.coderag.search;

import java.nio.file.Path;

public class ProjectNotIndexedException extends IllegalArgumentException {
    public ProjectNotIndexedException(Path projectPath) {
        super("Project not indexed: " + projectPath + ". Run index first.");
    }
}
