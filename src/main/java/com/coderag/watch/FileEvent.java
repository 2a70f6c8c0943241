package com.coderag.watch;

import java.nio.file.Path;

public record FileEvent(FileEventKind kind, Path path, boolean directory) {
}
