package com.mnp.stats.config;

import java.nio.file.Path;

public class ConfigLoadException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConfigLoadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
    }
}
