package com.coderag.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Delivers create, modify and delete notifications for everything below {@code root}, recursively.
 */
public interface FileEventSource {
    Subscription subscribe(Path root, FileEventListener listener) throws IOException;
}
