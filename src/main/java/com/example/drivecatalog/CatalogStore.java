package com.example.drivecatalog;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persistence of a {@link Catalog}.
 */
public interface CatalogStore {
    /**
     * Reads a catalog.
     *
     * @throws CatalogValidationException if the file has no header or lacks the id column
     */
    Catalog load(Path path) throws IOException;

    /**
     * Writes the catalog, creating parent directories as needed.
     */
    void save(Path path, Catalog catalog) throws IOException;
}
