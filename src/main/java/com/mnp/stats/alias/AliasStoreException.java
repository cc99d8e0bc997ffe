package com.mnp.stats.alias;

import java.nio.file.Path;

/**
 * The alias store could not be read or written.
 */
public class AliasStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public AliasStoreException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
