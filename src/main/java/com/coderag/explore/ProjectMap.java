package com.coderag.explore;

import java.util.List;
import java.util.Map;

/**
 * @param directoryStructure nested directory names; files map to {@code null}
 */
public record ProjectMap(
        String projectPath,
        int totalFiles,
        int totalChunks,
        List<ProjectComponent> components,
        List<ComponentRelationship> relationships,
        Map<String, Object> directoryStructure) {
}
