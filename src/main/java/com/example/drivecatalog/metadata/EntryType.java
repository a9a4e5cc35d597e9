package com.example.drivecatalog.metadata;

/**
 * Coarse classification of a remote entry, decided by the remote store adapter.
 */
public enum EntryType {
    /** Structural node; listed and traversed, never catalogued. */
    FOLDER,
    /** Store-native document with no byte representation (e.g. an online spreadsheet). */
    NATIVE_DOCUMENT,
    /** Ordinary file with bytes; the only kind that becomes a catalog record. */
    REGULAR_FILE
}
