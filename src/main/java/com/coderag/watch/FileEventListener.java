package com.coderag.watch;

@FunctionalInterface
public interface FileEventListener {
    void onEvent(FileEvent event);
}
