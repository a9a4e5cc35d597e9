package com.example.drivecatalog;

import com.example.drivecatalog.metadata.Entry;
import com.example.drivecatalog.metadata.EntryType;
import com.example.drivecatalog.remote.EntryListException;
import com.example.drivecatalog.remote.EntryLookupException;
import com.example.drivecatalog.remote.EntryNotFoundException;
import com.example.drivecatalog.remote.EntryPage;
import com.example.drivecatalog.remote.RemoteStoreClient;
import com.example.drivecatalog.remote.RemoteStoreException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory remote store. Folders are listed from explicitly registered pages; point lookups
 * are answered from registered entries and count every call.
 */
final class FakeRemoteStoreClient implements RemoteStoreClient {
    private final Map<String, List<EntryPage>> pages = new HashMap<>();
    private final Map<String, Entry> entries = new HashMap<>();
    private final Set<String> failingListings = new HashSet<>();
    private final Set<String> failingLookups = new HashSet<>();
    final List<String> listCalls = new ArrayList<>();
    final List<String> pageTokens = new ArrayList<>();
    final List<String> lookupCalls = new ArrayList<>();

    /**
     * Registers the pages of a folder; page N carries token "folderId#N+1" unless it is last.
     */
    @SafeVarargs
    final FakeRemoteStoreClient folder(String folderId, List<Entry>... folderPages) {
        List<EntryPage> result = new ArrayList<>();
        for (int i = 0; i < folderPages.length; i++) {
            String next = i + 1 < folderPages.length ? folderId + "#" + (i + 1) : null;
            result.add(new EntryPage(folderPages[i], next));
        }
        pages.put(folderId, result);
        return this;
    }

    FakeRemoteStoreClient entry(Entry entry) {
        entries.put(entry.id(), entry);
        return this;
    }

    FakeRemoteStoreClient failListing(String folderId) {
        failingListings.add(folderId);
        return this;
    }

    FakeRemoteStoreClient failLookup(String id) {
        failingLookups.add(id);
        return this;
    }

    @Override
    public EntryPage listEntries(String folderId, String pageToken) throws RemoteStoreException {
        listCalls.add(folderId);
        pageTokens.add(pageToken);
        if (failingListings.contains(folderId)) {
            throw new EntryListException("backend error", folderId, 500, null);
        }
        List<EntryPage> folderPages = pages.get(folderId);
        if (folderPages == null || folderPages.isEmpty()) {
            return EntryPage.last(List.of());
        }
        int index = pageToken == null ? 0 : Integer.parseInt(pageToken.substring(pageToken.lastIndexOf('#') + 1));
        return folderPages.get(index);
    }

    @Override
    public Entry getEntry(String id) throws RemoteStoreException {
        lookupCalls.add(id);
        if (failingLookups.contains(id)) {
            throw new EntryLookupException("permission denied", id, 403, null);
        }
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new EntryNotFoundException(id);
        }
        return entry;
    }

    static Entry file(String id, String name, String parentId) {
        return new Entry(id, name, EntryType.REGULAR_FILE, "application/pdf", 1024L,
                "2024-01-15T10:30:00.000Z", parentId, null, null);
    }

    static Entry document(String id, String name, String parentId) {
        return new Entry(id, name, EntryType.NATIVE_DOCUMENT, "application/vnd.google-apps.document",
                null, null, parentId, null, null);
    }
}
