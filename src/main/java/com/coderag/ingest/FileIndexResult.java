package com.coderag.ingest;

public record FileIndexResult(FileIndexStatus status, String filePath, int chunksIndexed, String message) {

    static FileIndexResult of(FileIndexStatus status, String filePath, String message) {
        return new FileIndexResult(status, filePath, 0, message);
    }
}
