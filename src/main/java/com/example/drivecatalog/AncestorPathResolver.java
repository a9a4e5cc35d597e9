package com.example.drivecatalog;

import com.example.drivecatalog.metadata.Entry;
import com.example.drivecatalog.remote.EntryNotFoundException;
import com.example.drivecatalog.remote.RemoteStoreClient;
import com.example.drivecatalog.remote.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Builds the absolute path of an entry by walking its parent chain upward.
 *
 * <p>Folder names are looked up through the remote store on first use and memoized in the
 * {@link FolderCache} handed to each call, so siblings sharing an ancestor cost one lookup.
 * The walk never fails: cycles, over-deep chains and lookup errors end it early and the
 * path accumulated so far is returned with the matching {@link PathResolution.Outcome}.
 */
public final class AncestorPathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(AncestorPathResolver.class);
    public static final int DEFAULT_MAX_DEPTH = 20;

    private final RemoteStoreClient client;
    private final int maxDepth;

    public AncestorPathResolver(RemoteStoreClient client) {
        this(client, DEFAULT_MAX_DEPTH);
    }

    public AncestorPathResolver(RemoteStoreClient client, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.client = client;
        this.maxDepth = maxDepth;
    }

    public String resolvePath(String entryName, String parentId, FolderCache cache) {
        return resolve(entryName, parentId, cache).path();
    }

    public PathResolution resolve(String entryName, String parentId, FolderCache cache) {
        String name = entryName == null ? "" : entryName;
        if (parentId == null || parentId.isEmpty()) {
            return new PathResolution("/" + name, PathResolution.Outcome.COMPLETE);
        }

        Deque<String> segments = new ArrayDeque<>();
        segments.addFirst(name);
        Set<String> seen = new HashSet<>();
        PathResolution.Outcome outcome = PathResolution.Outcome.COMPLETE;
        String current = parentId;
        int depth = 0;

        while (current != null) {
            if (depth >= maxDepth) {
                outcome = PathResolution.Outcome.DEPTH_LIMIT;
                break;
            }
            if (!seen.add(current)) {
                outcome = PathResolution.Outcome.CYCLE_DETECTED;
                break;
            }
            FolderCacheEntry folder = cache.lookup(current).orElse(null);
            if (folder == null) {
                try {
                    Entry entry = client.getEntry(current);
                    folder = cache.remember(current, entry.name(), entry.hasParent() ? entry.parentId() : null);
                } catch (EntryNotFoundException ex) {
                    LOGGER.debug("Ancestor {} of {} not found", current, name);
                    outcome = PathResolution.Outcome.NOT_FOUND;
                    break;
                } catch (RemoteStoreException ex) {
                    LOGGER.debug("Lookup of ancestor {} failed", current, ex);
                    outcome = PathResolution.Outcome.LOOKUP_FAILED;
                    break;
                }
            }
            if (folder.name() != null && !folder.name().isEmpty()) {
                segments.addFirst(folder.name());
            }
            current = folder.parentId();
            depth++;
        }

        return new PathResolution("/" + String.join("/", segments), outcome);
    }
}
