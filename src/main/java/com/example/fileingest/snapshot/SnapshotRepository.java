package com.example.fileingest.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One pretty-printed JSON file per snapshot, named after the snapshot id.
 */
public final class SnapshotRepository {
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotRepository.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_\\-]+");
    private static final String EXTENSION = ".json";

    private final ObjectMapper mapper;
    private final Path directory;

    public SnapshotRepository(Path directory) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.directory = directory;
    }

    /**
     * Writes a new snapshot. The file appears atomically and an existing snapshot is never replaced.
     */
    public void save(Snapshot snapshot) throws IOException {
        Path target = fileFor(snapshot.id());
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, snapshot.id(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public Optional<Snapshot> load(String id) throws IOException {
        if (!SAFE_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file)) {
            return Optional.of(mapper.readValue(reader, Snapshot.class));
        }
    }

    /**
     * All readable snapshots in no particular order. Unreadable files are logged and skipped.
     */
    public List<Snapshot> loadAll() throws IOException {
        List<Snapshot> result = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : stream) {
                try (Reader reader = Files.newBufferedReader(file)) {
                    result.add(mapper.readValue(reader, Snapshot.class));
                } catch (IOException ex) {
                    LOGGER.warn("Skipping unreadable snapshot {}", file, ex);
                }
            }
        }
        return result;
    }

    public boolean delete(String id) throws IOException {
        if (!SAFE_ID.matcher(id).matches()) {
            return false;
        }
        return Files.deleteIfExists(fileFor(id));
    }

    private Path fileFor(String id) {
        if (!SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid snapshot id: " + id);
        }
        return directory.resolve(id + EXTENSION);
    }
}
