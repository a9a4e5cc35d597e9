package com.example.drivecatalog;

import com.example.drivecatalog.metadata.Entry;
import com.example.drivecatalog.metadata.FileRecord;
import com.example.drivecatalog.remote.EntryPage;
import com.example.drivecatalog.remote.RemoteStoreClient;
import com.example.drivecatalog.remote.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Breadth-first enumeration of every regular file under a folder.
 *
 * <p>Folders are queued in discovery order and listed at most once per scan, page by page,
 * one remote call at a time. Sub-folders are traversed but never emitted; store-native
 * documents are skipped. A failed listing aborts the whole scan, since a partial listing
 * would silently under-report the catalog.
 */
public final class TreeEnumerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeEnumerator.class);

    private final RemoteStoreClient client;
    private final AncestorPathResolver pathResolver;
    private final FileRecordExtractor extractor;
    private final ScanProgressListener listener;

    public TreeEnumerator(RemoteStoreClient client) {
        this(client, new AncestorPathResolver(client), new FileRecordExtractor(), ScanProgressListener.NONE);
    }

    public TreeEnumerator(RemoteStoreClient client,
                          AncestorPathResolver pathResolver,
                          FileRecordExtractor extractor,
                          ScanProgressListener listener) {
        this.client = client;
        this.pathResolver = pathResolver;
        this.extractor = extractor;
        this.listener = listener == null ? ScanProgressListener.NONE : listener;
    }

    /**
     * Returns the records of every regular file under {@code rootFolderId}, or under the
     * drive root when it is null or blank.
     */
    public List<FileRecord> enumerate(String rootFolderId) throws RemoteStoreException {
        return scan(rootFolderId).records();
    }

    public ScanResult scan(String rootFolderId) throws RemoteStoreException {
        String root = rootFolderId == null || rootFolderId.isBlank() ? RemoteStoreClient.DRIVE_ROOT : rootFolderId;
        ScanState state = new ScanState(root);
        List<FileRecord> records = new ArrayList<>();
        int pagesFetched = 0;
        int skippedDocuments = 0;
        int truncatedPaths = 0;

        String folderId;
        while ((folderId = state.nextFolder()) != null) {
            String pageToken = null;
            int folderPages = 0;
            do {
                EntryPage page = client.listEntries(folderId, pageToken);
                folderPages++;
                for (Entry entry : page.entries()) {
                    switch (entry.type()) {
                        case FOLDER -> state.enqueue(entry.id());
                        case NATIVE_DOCUMENT -> skippedDocuments++;
                        case REGULAR_FILE -> {
                            PathResolution resolution = pathResolver.resolve(entry.name(), entry.parentId(), state.folderCache());
                            if (!resolution.isComplete()) {
                                truncatedPaths++;
                                LOGGER.warn("Path of {} truncated ({}): {}", entry.id(), resolution.outcome(), resolution.path());
                            }
                            records.add(extractor.extract(entry, resolution.path()));
                        }
                    }
                }
                pageToken = page.hasNextPage() ? page.nextPageToken() : null;
            } while (pageToken != null);

            pagesFetched += folderPages;
            LOGGER.debug("Folder {} listed in {} page(s); {} records so far", folderId, folderPages, records.size());
            listener.folderListed(folderId, folderPages, records.size());
        }

        LOGGER.info("Enumerated {} files across {} folders ({} pages, {} native documents skipped)",
                records.size(), state.visited().size(), pagesFetched, skippedDocuments);
        return new ScanResult(records, state.visited(), pagesFetched, skippedDocuments, truncatedPaths);
    }
}
