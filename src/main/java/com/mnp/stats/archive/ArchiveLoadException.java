package com.mnp.stats.archive;

import java.nio.file.Path;

/**
 * Raised when the match archive or one of its reference files cannot be read.
 */
public class ArchiveLoadException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public ArchiveLoadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
