package com.example.drivecatalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class ConfigLoader {
    static final String DEFAULT_OUTPUT = "catalog.csv";
    static final String DEFAULT_CREDENTIALS = "credentials.json";
    static final String DEFAULT_TOKENS_DIRECTORY = "tokens";
    static final String DEFAULT_APPLICATION_NAME = "drive-catalog";
    static final int DEFAULT_PAGE_SIZE = 1000;
    static final int MAX_PAGE_SIZE = 1000;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CatalogConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        int pageSize = raw.pageSize != null && raw.pageSize > 0
                ? Math.min(raw.pageSize, MAX_PAGE_SIZE)
                : DEFAULT_PAGE_SIZE;
        int maxAncestorDepth = raw.maxAncestorDepth != null && raw.maxAncestorDepth > 0
                ? raw.maxAncestorDepth
                : AncestorPathResolver.DEFAULT_MAX_DEPTH;
        String linkTemplate = optionalString(raw.linkTemplate, FileRecordExtractor.DEFAULT_LINK_TEMPLATE);
        if (!linkTemplate.contains("%s")) {
            throw new IllegalArgumentException("linkTemplate must contain %s for the file id.");
        }

        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new CatalogConfig(
                Path.of(optionalString(raw.output, DEFAULT_OUTPUT)),
                Optional.ofNullable(raw.folderId).filter(value -> !value.isBlank()),
                raw.update != null && raw.update,
                Path.of(optionalString(raw.credentials, DEFAULT_CREDENTIALS)),
                Path.of(optionalString(raw.tokensDirectory, DEFAULT_TOKENS_DIRECTORY)),
                optionalString(raw.applicationName, DEFAULT_APPLICATION_NAME),
                pageSize,
                maxAncestorDepth,
                linkTemplate,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String output;
        public String folderId;
        public Boolean update;
        public String credentials;
        public String tokensDirectory;
        public String applicationName;
        public Integer pageSize;
        public Integer maxAncestorDepth;
        public String linkTemplate;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
