package com.example.drivecatalog;

import com.example.drivecatalog.metadata.Entry;
import com.example.drivecatalog.metadata.FileRecord;
import org.apache.tika.mime.MediaType;

/**
 * Turns a regular-file entry and its resolved path into a catalog row.
 */
public class FileRecordExtractor {
    public static final String DEFAULT_LINK_TEMPLATE = "https://drive.google.com/file/d/%s/view";

    private final String linkTemplate;

    public FileRecordExtractor() {
        this(DEFAULT_LINK_TEMPLATE);
    }

    public FileRecordExtractor(String linkTemplate) {
        if (linkTemplate == null || !linkTemplate.contains("%s")) {
            throw new IllegalArgumentException("Link template must contain %s: " + linkTemplate);
        }
        this.linkTemplate = linkTemplate;
    }

    public FileRecord extract(Entry entry, String path) {
        String mimeType = orEmpty(entry.mimeType());
        // Duration hints are already in milliseconds and copied as-is.
        String duration = isTimedMedia(mimeType) && entry.durationMillis() != null
                ? String.valueOf(entry.durationMillis())
                : "";
        String link = entry.webLink() == null || entry.webLink().isEmpty()
                ? linkTemplate.replace("%s", entry.id())
                : entry.webLink();
        return new FileRecord(
                entry.id(),
                orEmpty(entry.name()),
                entry.sizeBytes() == null ? "0" : String.valueOf(entry.sizeBytes()),
                duration,
                path,
                link,
                orEmpty(entry.createdTime()),
                mimeType
        );
    }

    /**
     * True for audio/* and video/* types, ignoring parameters and case.
     */
    static boolean isTimedMedia(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return false;
        }
        MediaType mediaType = MediaType.parse(mimeType.trim());
        if (mediaType == null) {
            return false;
        }
        String type = mediaType.getType();
        return "audio".equalsIgnoreCase(type) || "video".equalsIgnoreCase(type);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
