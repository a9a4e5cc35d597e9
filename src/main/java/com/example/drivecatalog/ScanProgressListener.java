package com.example.drivecatalog;

public interface ScanProgressListener {
    /**
     * Called after every page of {@code folderId} has been fetched and processed.
     */
    void folderListed(String folderId, int pages, int recordsSoFar);

    /**
     * Listener used when nobody is watching the scan.
     */
    ScanProgressListener NONE = (folderId, pages, recordsSoFar) -> {
    };
}
