package com.example.drivecatalog.metadata;

import java.util.Objects;

/**
 * One node of the remote tree as reported by a {@code RemoteStoreClient}.
 * Every field except {@code id} and {@code type} may be null when the store omits it.
 */
public record Entry(
        String id,
        String name,
        EntryType type,
        String mimeType,
        Long sizeBytes,
        String createdTime,
        String parentId,
        String webLink,
        Long durationMillis
) {
    public Entry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
    }

    public static Entry folder(String id, String name, String parentId) {
        return new Entry(id, name, EntryType.FOLDER, null, null, null, parentId, null, null);
    }

    public boolean hasParent() {
        return parentId != null && !parentId.isEmpty();
    }
}
