package com.example.drivecatalog;

import com.example.drivecatalog.metadata.FileRecord;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records emitted by one scan, in breadth-first discovery order, plus traversal counters.
 * Visited folders keep the order in which they were listed.
 */
public record ScanResult(
        List<FileRecord> records,
        Set<String> visitedFolders,
        int pagesFetched,
        int skippedDocuments,
        int truncatedPaths
) {
    public ScanResult {
        records = List.copyOf(records);
        visitedFolders = Collections.unmodifiableSet(new LinkedHashSet<>(visitedFolders));
    }
}
