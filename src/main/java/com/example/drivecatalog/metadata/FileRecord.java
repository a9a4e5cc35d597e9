package com.example.drivecatalog.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Serialized catalog row describing a single remote file. {@code id} is the merge key;
 * every other column is replaced wholesale when a newer scan observes the file.
 */
@JsonPropertyOrder({"id", "name", "size_bytes", "duration_milliseconds", "path", "link", "created_at", "mime_type"})
public record FileRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("size_bytes") String sizeBytes,
        @JsonProperty("duration_milliseconds") String durationMillis,
        @JsonProperty("path") String path,
        @JsonProperty("link") String link,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("mime_type") String mimeType
) {
    public static final String ID_COLUMN = "id";
}
