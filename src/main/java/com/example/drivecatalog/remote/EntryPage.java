package com.example.drivecatalog.remote;

import com.example.drivecatalog.metadata.Entry;

import java.util.List;

/**
 * One page of a folder listing. A null or empty {@code nextPageToken} ends the listing.
 */
public record EntryPage(List<Entry> entries, String nextPageToken) {
    public EntryPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static EntryPage last(List<Entry> entries) {
        return new EntryPage(entries, null);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
