package com.example.fileingest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_CENTRAL_BASE = "/data/sorted";
    private static final String DEFAULT_INDEX_STORE = "data";
    private static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
    private static final int DEFAULT_WORKERS = 4;
    private static final int DEFAULT_RETENTION_DAYS = 30;
    private static final List<String> DEFAULT_INTERNAL_ROOTS = List.of("ORGA", "INFRA", "SALES", "HR");
    private static final List<String> DEFAULT_YEAR_FOLDERS = List.of("Projekte", "Archiv");
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information"
    );
    private static final Map<String, String> DEFAULT_CATEGORY_PATHS = Map.of(
            "finanzen", "{customer}/Finanzen/{year}",
            "projekte", "{customer}/Projekte/{project}/{year}",
            "personal", "{customer}/Personal/{year}",
            "footage", "{customer}/Footage/{project}",
            "unsorted", "{customer}/Allgemein"
    );

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ConfigLoader() {
        jsonMapper = configure(new ObjectMapper());
        yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads and validates the configuration file. YAML is used unless the file ends in {@code .json}.
     */
    public IngestConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        RawConfig raw;
        try {
            raw = mapperFor(path).readValue(path.toFile(), RawConfig.class);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to parse configuration " + path, ex);
        }
        if (raw == null) {
            throw new ConfigurationException("Configuration file is empty: " + path);
        }
        return toConfig(raw);
    }

    private ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? jsonMapper : yamlMapper;
    }

    private IngestConfig toConfig(RawConfig raw) {
        if (raw.shares == null || raw.shares.isEmpty()) {
            throw new ConfigurationException("Config must include at least one share to crawl.");
        }

        List<Path> shares = raw.shares.stream().map(Path::of).toList();
        List<String> internalRoots = raw.internalRoots == null || raw.internalRoots.isEmpty()
                ? DEFAULT_INTERNAL_ROOTS
                : List.copyOf(raw.internalRoots);
        Path centralBase = Path.of(optionalString(raw.centralBase, DEFAULT_CENTRAL_BASE));
        Path indexStore = Path.of(optionalString(raw.indexStorePath, DEFAULT_INDEX_STORE));

        RawSorting sorting = raw.sorting == null ? new RawSorting() : raw.sorting;
        boolean enableYear = sorting.enableYearSubfolders == null || sorting.enableYearSubfolders;
        List<String> yearFolders = sorting.yearFoldersUnder == null
                ? DEFAULT_YEAR_FOLDERS
                : List.copyOf(sorting.yearFoldersUnder);

        RawReview review = raw.review == null ? new RawReview() : raw.review;
        double threshold = review.confidenceThreshold == null ? DEFAULT_CONFIDENCE_THRESHOLD : review.confidenceThreshold;
        if (threshold < 0.0 || threshold > 1.0) {
            throw new ConfigurationException("review.confidence_threshold must be within [0, 1]: " + threshold);
        }

        RawProcessing processing = raw.processing == null ? new RawProcessing() : raw.processing;
        int workers = processing.workers != null && processing.workers > 0 ? processing.workers : DEFAULT_WORKERS;
        boolean backupEnabled = processing.backupEnabled != null && processing.backupEnabled;
        Path backupDir = processing.backupDir == null || processing.backupDir.isBlank()
                ? indexStore.resolve("backups")
                : Path.of(processing.backupDir);
        boolean snapshotsEnabled = processing.snapshotsEnabled == null || processing.snapshotsEnabled;
        Map<String, String> categoryPaths = new LinkedHashMap<>(DEFAULT_CATEGORY_PATHS);
        if (processing.categoryPaths != null) {
            processing.categoryPaths.forEach((category, template) -> {
                if (category != null && template != null && !template.isBlank()) {
                    categoryPaths.put(category.toLowerCase(Locale.ROOT), template);
                }
            });
        }

        RawSnapshots snapshots = raw.snapshots == null ? new RawSnapshots() : raw.snapshots;
        int retentionDays = snapshots.retentionDays != null && snapshots.retentionDays > 0
                ? snapshots.retentionDays
                : DEFAULT_RETENTION_DAYS;

        RawStorage storage = raw.storage == null ? new RawStorage() : raw.storage;
        Optional<String> s3Bucket = Optional.ofNullable(storage.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(storage.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(storage.s3Region).filter(value -> !value.isBlank());

        return new IngestConfig(
                shares,
                internalRoots,
                centralBase,
                enableYear,
                yearFolders,
                indexStore,
                raw.followLinks != null && raw.followLinks,
                mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns),
                threshold,
                workers,
                backupEnabled,
                backupDir,
                snapshotsEnabled,
                Map.copyOf(categoryPaths),
                retentionDays,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> shares = new ArrayList<>();
        public List<String> internalRoots;
        public String centralBase;
        public String indexStorePath;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public RawSorting sorting;
        public RawReview review;
        public RawProcessing processing;
        public RawSnapshots snapshots;
        public RawStorage storage;
    }

    private static class RawSorting {
        public Boolean enableYearSubfolders;
        public List<String> yearFoldersUnder;
    }

    private static class RawReview {
        public Double confidenceThreshold;
    }

    private static class RawProcessing {
        public Integer workers;
        public Boolean backupEnabled;
        public String backupDir;
        public Boolean snapshotsEnabled;
        public Map<String, String> categoryPaths;
    }

    private static class RawSnapshots {
        public Integer retentionDays;
    }

    private static class RawStorage {
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
