package com.example.drivecatalog;

import com.example.drivecatalog.metadata.FileRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvReadException;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Stores the catalog as a UTF-8 CSV file with a header row, one row per file, ordered by id.
 * Hand-edited files are accepted as long as the id column survives: unknown columns are
 * ignored and missing ones load as empty strings.
 */
public final class CsvCatalogStore implements CatalogStore {
    static final Set<String> REQUIRED_COLUMNS = Set.of(FileRecord.ID_COLUMN);
    static final String EMPTY_FILE_MESSAGE = "file is empty or has no header row";
    private static final int BYTE_ORDER_MARK = '\uFEFF';
    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {
    };

    private final CsvMapper mapper;

    public CsvCatalogStore() {
        this.mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
    }

    @Override
    public Catalog load(Path path) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            if (!skipByteOrderMark(reader)) {
                throw new CatalogValidationException(EMPTY_FILE_MESSAGE, path.toString(), REQUIRED_COLUMNS, Set.of());
            }
            try (MappingIterator<Map<String, String>> rows = mapper.readerFor(ROW_TYPE).with(schema).readValues(reader)) {
                return readRows(rows, path);
            } catch (CsvReadException ex) {
                throw new CatalogValidationException("malformed CSV: " + ex.getOriginalMessage(), path.toString(), Set.of(), Set.of(), ex);
            }
        }
    }

    private Catalog readRows(MappingIterator<Map<String, String>> rows, Path path) throws IOException {
        // Reading ahead forces the header line to be parsed, even for header-only files.
        boolean hasRows = rows.hasNextValue();
        validateHeader(columnNames((CsvSchema) rows.getParserSchema()), path);

        Catalog catalog = new Catalog();
        while (hasRows && rows.hasNextValue()) {
            Map<String, String> row = rows.nextValue();
            String id = row.get(FileRecord.ID_COLUMN);
            if (id == null || id.isEmpty()) {
                continue;
            }
            catalog.upsert(new FileRecord(
                    id,
                    column(row, "name"),
                    column(row, "size_bytes"),
                    column(row, "duration_milliseconds"),
                    column(row, "path"),
                    column(row, "link"),
                    column(row, "created_at"),
                    column(row, "mime_type")
            ));
        }
        return catalog;
    }

    @Override
    public void save(Path path, Catalog catalog) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        CsvSchema schema = mapper.schemaFor(FileRecord.class).withHeader();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter sequence = mapper.writer(schema).writeValues(writer)) {
            sequence.writeAll(catalog.records());
        }
    }

    /**
     * Consumes a leading UTF-8 byte order mark, as written by spreadsheet tools. Returns false
     * when the reader holds no characters at all.
     */
    static boolean skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        int first = reader.read();
        if (first == -1) {
            return false;
        }
        if (first != BYTE_ORDER_MARK) {
            reader.reset();
        }
        return true;
    }

    static void validateHeader(Set<String> columns, Path path) throws CatalogValidationException {
        String file = path == null ? null : path.toString();
        if (columns.isEmpty()) {
            throw new CatalogValidationException(EMPTY_FILE_MESSAGE, file, REQUIRED_COLUMNS, columns);
        }
        Set<String> missing = new LinkedHashSet<>(REQUIRED_COLUMNS);
        missing.removeAll(columns);
        if (!missing.isEmpty()) {
            throw new CatalogValidationException("missing required columns", file, missing, columns);
        }
    }

    private static Set<String> columnNames(CsvSchema schema) {
        Set<String> names = new LinkedHashSet<>();
        if (schema != null) {
            for (CsvSchema.Column column : schema) {
                names.add(column.getName());
            }
        }
        return names;
    }

    private static String column(Map<String, String> row, String name) {
        String value = row.get(name);
        return value == null ? "" : value;
    }
}
