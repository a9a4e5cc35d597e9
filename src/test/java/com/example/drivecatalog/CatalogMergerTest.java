package com.example.drivecatalog;

import com.example.drivecatalog.metadata.FileRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class CatalogMergerTest {
    private static FileRecord record(String id, String name, String size) {
        return new FileRecord(id, name, size, "", "/" + name, "link-" + id, "2024-01-01T00:00:00.000Z", "application/pdf");
    }

    @Test
    void addsNewAndReplacesExistingEntries() {
        Catalog existing = Catalog.of(List.of(record("file1", "old_name.pdf", "512"), record("keep", "keep.pdf", "1")));

        Catalog merged = CatalogMerger.merge(existing, List.of(record("file1", "new_name.pdf", "1024"), record("new", "new.pdf", "2")));

        assertEquals(3, merged.size());
        assertEquals("new_name.pdf", merged.get("file1").orElseThrow().name());
        assertEquals("1024", merged.get("file1").orElseThrow().sizeBytes());
        assertEquals(existing.get("keep").orElseThrow(), merged.get("keep").orElseThrow());
        assertEquals(List.of("file1", "keep", "new"), List.copyOf(merged.asMap().keySet()));
    }

    @Test
    void neverPrunesEntriesMissingFromFreshScan() {
        Catalog existing = Catalog.of(List.of(record("deleted-remotely", "gone.pdf", "9")));

        Catalog merged = CatalogMerger.merge(existing, List.of());

        assertEquals(existing, merged);
    }

    @Test
    void mergeIsIdempotent() {
        Catalog existing = Catalog.of(List.of(record("a", "a.pdf", "1"), record("b", "b.pdf", "2")));
        List<FileRecord> fresh = List.of(record("b", "b2.pdf", "3"), record("c", "c.pdf", "4"));

        Catalog once = CatalogMerger.merge(existing, fresh);

        assertEquals(once, CatalogMerger.merge(once, fresh));
    }

    @Test
    void leavesInputCatalogUntouched() {
        Catalog existing = Catalog.of(List.of(record("a", "a.pdf", "1")));

        CatalogMerger.merge(existing, List.of(record("b", "b.pdf", "2")));

        assertEquals(1, existing.size());
        assertFalse(existing.contains("b"));
    }

    @Test
    void laterDuplicateInFreshScanWins() {
        Catalog merged = CatalogMerger.merge(new Catalog(), List.of(record("a", "first.pdf", "1"), record("a", "second.pdf", "2")));

        assertEquals(1, merged.size());
        assertEquals("second.pdf", merged.get("a").orElseThrow().name());
    }
}
