package com.coderag.watch;

import java.nio.file.Path;

public record WatchResult(Status status, Path projectPath, String message) {

    public enum Status {
        STARTED,
        ALREADY_WATCHING,
        NOT_A_DIRECTORY,
        FAILED,
        STOPPED,
        NOT_WATCHING
    }

    static WatchResult of(Status status, Path projectPath) {
        return new WatchResult(status, projectPath, null);
    }
}
