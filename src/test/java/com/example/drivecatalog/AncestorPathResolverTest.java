package com.example.drivecatalog;

import com.example.drivecatalog.metadata.Entry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AncestorPathResolverTest {
    @Test
    void fileWithoutParentSitsAtRoot() {
        FakeRemoteStoreClient client = new FakeRemoteStoreClient();
        AncestorPathResolver resolver = new AncestorPathResolver(client);

        PathResolution resolution = resolver.resolve("root_file.txt", null, new FolderCache());

        assertEquals("/root_file.txt", resolution.path());
        assertTrue(resolution.isComplete());
        assertTrue(client.lookupCalls.isEmpty());
    }

    @Test
    void usesCachedParentWithoutLookup() {
        FakeRemoteStoreClient client = new FakeRemoteStoreClient();
        FolderCache cache = new FolderCache();
        cache.remember("p1", "Docs", null);

        String path = new AncestorPathResolver(client).resolvePath("a.pdf", "p1", cache);

        assertEquals("/Docs/a.pdf", path);
        assertTrue(client.lookupCalls.isEmpty());
    }

    @Test
    void walksNestedFoldersAndMemoizesThem() {
        FakeRemoteStoreClient client = new FakeRemoteStoreClient()
                .entry(Entry.folder("reports", "Reports", "work"))
                .entry(Entry.folder("work", "Work", null));
        AncestorPathResolver resolver = new AncestorPathResolver(client);
        FolderCache cache = new FolderCache();

        assertEquals("/Work/Reports/annual.pdf", resolver.resolvePath("annual.pdf", "reports", cache));
        assertEquals("/Work/Reports/q1.pdf", resolver.resolvePath("q1.pdf", "reports", cache));
        assertEquals("/Work/notes.txt", resolver.resolvePath("notes.txt", "work", cache));

        assertEquals(List.of("reports", "work"), client.lookupCalls);
        assertEquals(new FolderCacheEntry("Reports", "work"), cache.lookup("reports").orElseThrow());
    }

    @Test
    void stopsOnCycleWithinBoundedLookups() {
        FakeRemoteStoreClient client = new FakeRemoteStoreClient()
                .entry(Entry.folder("A", "Alpha", "B"))
                .entry(Entry.folder("B", "Beta", "A"));

        PathResolution resolution = new AncestorPathResolver(client).resolve("leaf.txt", "A", new FolderCache());

        assertEquals(PathResolution.Outcome.CYCLE_DETECTED, resolution.outcome());
        assertEquals("/Beta/Alpha/leaf.txt", resolution.path());
        assertEquals(2, client.lookupCalls.size());
    }

    @Test
    void selfParentedFolderIsACycle() {
        FolderCache cache = new FolderCache();
        cache.remember("loop", "Loop", "loop");

        PathResolution resolution = new AncestorPathResolver(new FakeRemoteStoreClient()).resolve("file.txt", "loop", cache);

        assertEquals(PathResolution.Outcome.CYCLE_DETECTED, resolution.outcome());
        assertEquals("/Loop/file.txt", resolution.path());
    }

    @Test
    void truncatesChainsDeeperThanLimit() {
        FolderCache cache = new FolderCache();
        for (int i = 0; i < 10; i++) {
            cache.remember("f" + i, "d" + i, i == 9 ? null : "f" + (i + 1));
        }

        PathResolution limited = new AncestorPathResolver(new FakeRemoteStoreClient(), 3).resolve("x", "f0", cache);
        PathResolution exact = new AncestorPathResolver(new FakeRemoteStoreClient(), 10).resolve("x", "f0", cache);

        assertEquals(PathResolution.Outcome.DEPTH_LIMIT, limited.outcome());
        assertEquals("/d2/d1/d0/x", limited.path());
        assertTrue(exact.isComplete());
        assertEquals("/d9/d8/d7/d6/d5/d4/d3/d2/d1/d0/x", exact.path());
    }

    @Test
    void lookupFailureReturnsPartialPath() {
        FakeRemoteStoreClient client = new FakeRemoteStoreClient()
                .entry(Entry.folder("inner", "Inner", "locked"))
                .failLookup("locked");
        FolderCache cache = new FolderCache();

        PathResolution resolution = new AncestorPathResolver(client).resolve("file.txt", "inner", cache);

        assertEquals(PathResolution.Outcome.LOOKUP_FAILED, resolution.outcome());
        assertEquals("/Inner/file.txt", resolution.path());
        assertFalse(cache.contains("locked"));
    }

    @Test
    void missingAncestorIsReportedAsNotFound() {
        PathResolution resolution = new AncestorPathResolver(new FakeRemoteStoreClient())
                .resolve("file.txt", "gone", new FolderCache());

        assertEquals(PathResolution.Outcome.NOT_FOUND, resolution.outcome());
        assertEquals("/file.txt", resolution.path());
    }

    @Test
    void unnamedAncestorsAddNoSegment() {
        FolderCache cache = new FolderCache();
        cache.remember("blank", "", "top");
        cache.remember("top", "Top", null);

        assertEquals("/Top/file.txt", new AncestorPathResolver(new FakeRemoteStoreClient()).resolvePath("file.txt", "blank", cache));
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new AncestorPathResolver(new FakeRemoteStoreClient(), 0));
    }
}
