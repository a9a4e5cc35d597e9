package com.example.drivecatalog;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for a catalog scan.
 */
public record CatalogConfig(
        Path output,
        Optional<String> folderId,
        boolean update,
        Path credentials,
        Path tokensDirectory,
        String applicationName,
        int pageSize,
        int maxAncestorDepth,
        String linkTemplate,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
}
