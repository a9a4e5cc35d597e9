package com.example.drivecatalog;

import java.nio.file.Path;

@FunctionalInterface
public interface CatalogPublisher extends AutoCloseable {
    /**
     * Ships a freshly saved catalog file somewhere else. Failures are reported, not thrown.
     */
    void publish(Path catalogFile);

    @Override
    default void close() {
        // no-op
    }

    static CatalogPublisher noop() {
        return path -> {
        };
    }
}
