package com.example.drivecatalog.remote;

public class EntryNotFoundException extends EntryLookupException {
    public EntryNotFoundException(String entryId, Throwable cause) {
        super("entry does not exist or is not visible", entryId, 404, cause);
    }

    public EntryNotFoundException(String entryId) {
        this(entryId, null);
    }
}
