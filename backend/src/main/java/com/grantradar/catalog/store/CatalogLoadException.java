package com.grantradar.catalog.store;

import java.nio.file.Path;

/**
 * A whole catalog file could not be read. Loads are all-or-nothing, so no records from the
 * file are returned when this is thrown.
 */
public class CatalogLoadException extends RuntimeException {
    private final transient Path path;

    public CatalogLoadException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public CatalogLoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
