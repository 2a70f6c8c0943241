package com.coderag.watch;

public enum FileEventKind {
    CREATED,
    MODIFIED,
    DELETED
}
