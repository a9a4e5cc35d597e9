package com.example.drivecatalog;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-scan memo of folder id to (name, parent). Entries are written once and never
 * invalidated; losing the cache only costs extra lookups.
 */
public final class FolderCache {
    private final Map<String, FolderCacheEntry> entries = new HashMap<>();

    public Optional<FolderCacheEntry> lookup(String folderId) {
        return Optional.ofNullable(entries.get(folderId));
    }

    /**
     * Records a folder unless it is already cached, and returns the cached value.
     */
    public FolderCacheEntry remember(String folderId, String name, String parentId) {
        FolderCacheEntry existing = entries.putIfAbsent(folderId, new FolderCacheEntry(name, parentId));
        return existing == null ? entries.get(folderId) : existing;
    }

    public boolean contains(String folderId) {
        return entries.containsKey(folderId);
    }
}
