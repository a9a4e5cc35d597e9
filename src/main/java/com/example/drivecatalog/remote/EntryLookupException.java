package com.example.drivecatalog.remote;

/**
 * A point lookup for a single entry failed.
 */
public class EntryLookupException extends RemoteStoreException {
    private final String entryId;

    public EntryLookupException(String message, String entryId, Integer statusCode, Throwable cause) {
        super(message, "get entry '" + entryId + "'", statusCode, cause);
        this.entryId = entryId;
    }

    public String getEntryId() {
        return entryId;
    }
}
