package com.coderag.explore;

public record ComponentRelationship(String source, String target, double similarity) {
}
