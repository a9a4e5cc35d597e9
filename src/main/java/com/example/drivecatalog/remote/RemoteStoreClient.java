package com.example.drivecatalog.remote;

import com.example.drivecatalog.metadata.Entry;

/**
 * Paginated listing and point lookups against a remote tree. Implementations own transport,
 * authentication, timeouts and any retry policy; callers never retry.
 */
public interface RemoteStoreClient {
    /**
     * Folder id that addresses the top of the store when no explicit scan root is given.
     */
    String DRIVE_ROOT = "root";

    /**
     * Returns one page of the direct children of {@code folderId}.
     *
     * @param folderId  folder to list, or {@link #DRIVE_ROOT}
     * @param pageToken continuation token from the previous page, or null for the first page
     */
    EntryPage listEntries(String folderId, String pageToken) throws RemoteStoreException;

    /**
     * Looks up a single entry; at minimum name and parent are populated.
     */
    Entry getEntry(String id) throws RemoteStoreException;
}
