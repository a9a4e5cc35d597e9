package com.example.drivecatalog;

/**
 * Memoized name and parent of a folder; {@code parentId} is null at the top of the tree.
 */
public record FolderCacheEntry(String name, String parentId) {
}
