package com.example.drivecatalog;

import com.example.drivecatalog.remote.RemoteStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Orchestrates one catalog run: load the existing catalog (update mode), enumerate the remote
 * tree, merge, save, then publish.
 */
public final class CatalogScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogScanner.class);

    private final CatalogConfig config;
    private final RemoteStoreClient client;
    private final CatalogStore store;
    private final CatalogPublisher publisher;
    private final ScanProgressListener listener;

    public CatalogScanner(CatalogConfig config, RemoteStoreClient client, CatalogStore store) {
        this(config, client, store, CatalogPublisher.noop(), ScanProgressListener.NONE);
    }

    public CatalogScanner(CatalogConfig config,
                          RemoteStoreClient client,
                          CatalogStore store,
                          CatalogPublisher publisher,
                          ScanProgressListener listener) {
        this.config = config;
        this.client = client;
        this.store = store;
        this.publisher = publisher;
        this.listener = listener;
    }

    /**
     * Executes a run and returns the catalog that was written. The existing catalog is read
     * before any remote call, so an invalid file fails fast with
     * {@link CatalogValidationException}. Listing failures abort the run and nothing is saved.
     */
    public Catalog run() throws IOException {
        Catalog existing = loadExisting();

        TreeEnumerator enumerator = new TreeEnumerator(
                client,
                new AncestorPathResolver(client, config.maxAncestorDepth()),
                new FileRecordExtractor(config.linkTemplate()),
                listener
        );
        ScanResult result = enumerator.scan(config.folderId().orElse(null));
        LOGGER.info("Found {} files", result.records().size());
        if (result.truncatedPaths() > 0) {
            LOGGER.warn("{} file paths could not be fully resolved", result.truncatedPaths());
        }

        Catalog merged = CatalogMerger.merge(existing, result.records());
        if (config.update()) {
            LOGGER.info("Merged catalog contains {} total entries", merged.size());
        }

        store.save(config.output(), merged);
        LOGGER.info("Catalog saved to {} ({} entries)", config.output(), merged.size());
        publisher.publish(config.output());
        return merged;
    }

    private Catalog loadExisting() throws IOException {
        if (!config.update()) {
            return new Catalog();
        }
        if (!Files.exists(config.output())) {
            LOGGER.info("No existing catalog at {}; starting a new one", config.output());
            return new Catalog();
        }
        LOGGER.info("Loading existing catalog from {}", config.output());
        Catalog existing = store.load(config.output());
        LOGGER.info("Loaded {} existing entries", existing.size());
        return existing;
    }
}
