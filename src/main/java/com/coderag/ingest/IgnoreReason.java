package com.coderag.ingest;

public enum IgnoreReason {
    IGNORED_DIRECTORY,
    IGNORED_EXTENSION,
    IGNORE_FILE_PATTERN,
    TOO_LARGE
}
