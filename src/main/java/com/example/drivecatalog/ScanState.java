package com.example.drivecatalog;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable traversal state owned by a single scan: pending folders in discovery order,
 * folders already taken off the queue, and the folder-name memo.
 */
final class ScanState {
    private final Deque<String> pending = new ArrayDeque<>();
    private final Set<String> visited = new LinkedHashSet<>();
    private final FolderCache folderCache = new FolderCache();

    ScanState(String rootFolderId) {
        pending.addLast(rootFolderId);
    }

    void enqueue(String folderId) {
        pending.addLast(folderId);
    }

    /**
     * Pops folders until one that has not been visited yet is found and marks it visited.
     * Returns null when the queue is exhausted.
     */
    String nextFolder() {
        while (!pending.isEmpty()) {
            String folderId = pending.removeFirst();
            if (visited.add(folderId)) {
                return folderId;
            }
        }
        return null;
    }

    Set<String> visited() {
        return Collections.unmodifiableSet(visited);
    }

    FolderCache folderCache() {
        return folderCache;
    }
}
