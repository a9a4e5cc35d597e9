package com.example.drivecatalog.remote;

/**
 * Listing a folder failed. Aborts the scan.
 */
public class EntryListException extends RemoteStoreException {
    private final String folderId;

    public EntryListException(String message, String folderId, Integer statusCode, Throwable cause) {
        super(message, folderId == null ? "list entries" : "list entries in folder '" + folderId + "'", statusCode, cause);
        this.folderId = folderId;
    }

    public String getFolderId() {
        return folderId;
    }
}
