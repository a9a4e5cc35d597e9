package com.example.drivecatalog;

import com.example.drivecatalog.metadata.FileRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * File records keyed and ordered by id. Records are only ever added or replaced.
 */
public final class Catalog {
    private final NavigableMap<String, FileRecord> records;

    public Catalog() {
        this.records = new TreeMap<>();
    }

    private Catalog(NavigableMap<String, FileRecord> records) {
        this.records = new TreeMap<>(records);
    }

    public static Catalog of(Collection<FileRecord> records) {
        Catalog catalog = new Catalog();
        records.forEach(catalog::upsert);
        return catalog;
    }

    public Catalog copy() {
        return new Catalog(records);
    }

    /**
     * Inserts the record, replacing any record with the same id.
     */
    public void upsert(FileRecord record) {
        records.put(record.id(), record);
    }

    public Optional<FileRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public boolean contains(String id) {
        return records.containsKey(id);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Collection<FileRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public NavigableMap<String, FileRecord> asMap() {
        return Collections.unmodifiableNavigableMap(records);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Catalog)) {
            return false;
        }
        return records.equals(((Catalog) other).records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "Catalog" + records.keySet();
    }
}
