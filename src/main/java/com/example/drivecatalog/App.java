package com.example.drivecatalog;

import com.example.drivecatalog.remote.DriveRemoteStoreClient;
import com.example.drivecatalog.remote.DriveServiceFactory;
import com.example.drivecatalog.remote.RemoteStoreClient;
import com.google.api.services.drive.Drive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final String VERSION = "0.1.0";

    private App() {
    }

    public static void main(String[] args) {
        // CLI contract: "scan <config.json>" or "version".
        if (args.length >= 1 && "version".equals(args[0])) {
            System.out.println("drive-catalog version " + VERSION);
            return;
        }
        if (args.length < 2 || !"scan".equals(args[0])) {
            LOGGER.error("Usage: java -jar drive-catalog.jar scan <config.json> | version");
            System.exit(1);
        }
        System.exit(scan(Path.of(args[1])));
    }

    static int scan(Path configPath) {
        try {
            CatalogConfig config = new ConfigLoader().load(configPath);
            if (!Files.exists(config.credentials())) {
                LOGGER.error("Credentials file not found at {}. To use this tool: create a Google Cloud project, "
                        + "enable the Google Drive API, create OAuth 2.0 credentials for a desktop app, download "
                        + "the JSON file and point the 'credentials' setting at it.", config.credentials());
                return 1;
            }
            LOGGER.info("Initializing Google Drive connection...");
            Drive drive = DriveServiceFactory.create(config.credentials(), config.tokensDirectory(), config.applicationName());
            RemoteStoreClient client = new DriveRemoteStoreClient(drive, config.pageSize());
            try (CatalogPublisher publisher = publisherFor(config)) {
                ScanProgressListener progress = (folderId, pages, recordsSoFar) ->
                        LOGGER.info("Scanned folder {} ({} page(s)); {} files so far", folderId, pages, recordsSoFar);
                Catalog catalog = new CatalogScanner(config, client, new CsvCatalogStore(), publisher, progress).run();
                LOGGER.info("Total files cataloged: {}", catalog.size());
            }
            return 0;
        } catch (CatalogValidationException ex) {
            LOGGER.error("Existing catalog has an invalid format: {}. Fix the file or turn off 'update'.", ex.getMessage());
            return 1;
        } catch (Exception ex) {
            LOGGER.error("Scan failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }

    private static CatalogPublisher publisherFor(CatalogConfig config) {
        if (!config.s3SyncEnabled()) {
            return CatalogPublisher.noop();
        }
        return new S3CatalogPublisher(
                config.s3Bucket().orElseThrow(),
                config.s3Prefix().orElse(""),
                config.s3Region()
        );
    }
}
