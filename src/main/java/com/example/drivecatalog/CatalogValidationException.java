package com.example.drivecatalog;

import java.io.IOException;
import java.util.Set;
import java.util.TreeSet;

/**
 * A catalog file does not match the expected schema.
 */
public class CatalogValidationException extends IOException {
    private final String filePath;
    private final Set<String> missingColumns;
    private final Set<String> actualColumns;

    public CatalogValidationException(String message, String filePath, Set<String> missingColumns, Set<String> actualColumns) {
        this(message, filePath, missingColumns, actualColumns, null);
    }

    public CatalogValidationException(String message, String filePath, Set<String> missingColumns,
                                      Set<String> actualColumns, Throwable cause) {
        super(describe(message, filePath, missingColumns), cause);
        this.filePath = filePath;
        this.missingColumns = missingColumns == null ? Set.of() : Set.copyOf(missingColumns);
        this.actualColumns = actualColumns == null ? Set.of() : Set.copyOf(actualColumns);
    }

    public String getFilePath() {
        return filePath;
    }

    public Set<String> getMissingColumns() {
        return missingColumns;
    }

    public Set<String> getActualColumns() {
        return actualColumns;
    }

    private static String describe(String message, String filePath, Set<String> missingColumns) {
        String full = message;
        if (filePath != null) {
            full = "Invalid catalog file '" + filePath + "': " + message;
        }
        if (missingColumns != null && !missingColumns.isEmpty()) {
            full = full + ". Missing columns: " + new TreeSet<>(missingColumns);
        }
        return full;
    }
}
