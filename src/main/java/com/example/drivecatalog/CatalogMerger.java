package com.example.drivecatalog;

import com.example.drivecatalog.metadata.FileRecord;

import java.util.List;

public final class CatalogMerger {
    private CatalogMerger() {
    }

    /**
     * Returns a copy of {@code existing} with every fresh record added or replacing the record
     * with the same id. Ids missing from {@code fresh} are kept unchanged; nothing is pruned.
     */
    public static Catalog merge(Catalog existing, List<FileRecord> fresh) {
        Catalog merged = existing.copy();
        for (FileRecord record : fresh) {
            merged.upsert(record);
        }
        return merged;
    }
}
