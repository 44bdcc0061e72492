package com.grantradar.catalog.store;

import java.nio.file.Path;

public class CatalogWriteException extends RuntimeException {
    private final transient Path path;

    public CatalogWriteException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
