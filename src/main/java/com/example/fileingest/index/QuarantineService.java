package com.example.fileingest.index;

import com.example.fileingest.ConflictException;
import com.example.fileingest.NotFoundException;
import com.example.fileingest.content.ContentHasher;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.content.PathClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Operator actions on the per-customer {@code _duplicates} folders below the central base.
 * <p>
 * Mutations are refused while a crawl is running, since the crawler owns the hash index for the
 * duration of a run.
 */
public final class QuarantineService {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuarantineService.class);

    private final HashIndex index;
    private final ContentHasher hasher;
    private final FileMover mover;
    private final PathClassifier classifier;
    private final Path centralBase;
    private final BooleanSupplier crawlRunning;

    public QuarantineService(HashIndex index,
                             ContentHasher hasher,
                             FileMover mover,
                             PathClassifier classifier,
                             Path centralBase,
                             BooleanSupplier crawlRunning) {
        this.index = index;
        this.hasher = hasher;
        this.mover = mover;
        this.classifier = classifier;
        this.centralBase = centralBase.toAbsolutePath().normalize();
        this.crawlRunning = crawlRunning;
    }

    /**
     * Lists quarantined files, newest first.
     *
     * @param customer restricts the listing to one customer root; null lists all
     */
    public QuarantinePage list(String customer, int limit, int offset) throws IOException {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        List<QuarantinedFile> all = new ArrayList<>();
        for (Path customerDir : customerDirectories(customer)) {
            Path quarantine = customerDir.resolve(PathClassifier.QUARANTINE_DIRECTORY);
            if (!Files.isDirectory(quarantine)) {
                continue;
            }
            String customerRoot = customerDir.getFileName().toString();
            try (Stream<Path> files = Files.walk(quarantine)) {
                for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                    BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                    all.add(new QuarantinedFile(
                            file.toString(),
                            customerRoot,
                            file.getFileName().toString(),
                            attrs.size(),
                            attrs.lastModifiedTime().toInstant()
                    ));
                }
            }
        }
        all.sort(Comparator.comparing(QuarantinedFile::modifiedTime).reversed()
                .thenComparing(QuarantinedFile::path));
        int from = Math.min(offset, all.size());
        int to = Math.min(from + limit, all.size());
        return new QuarantinePage(all.subList(from, to), all.size(), limit, offset);
    }

    /**
     * Makes a quarantined copy the primary for its digest. The current primary, if it still exists,
     * takes the copy's place in the quarantine of the customer that owns the record.
     *
     * @throws NotFoundException if the file is gone or its digest is not indexed
     */
    public PromoteResult promote(Path path) throws IOException {
        ensureIdle();
        Path duplicate = requireQuarantined(path);
        String digest = hasher.hash(duplicate);
        ContentRecord record = index.get(digest)
                .orElseThrow(() -> new NotFoundException("No primary recorded for " + duplicate));
        BasicFileAttributes attrs = Files.readAttributes(duplicate, BasicFileAttributes.class);
        Path primary = record.location();

        Path demoted = null;
        if (Files.exists(primary)) {
            demoted = mover.moveInto(primary, classifier.quarantineDirectory(centralBase, record.customerRoot()));
            try {
                mover.move(duplicate, primary);
            } catch (IOException ex) {
                try {
                    mover.move(demoted, primary);
                } catch (IOException restoreEx) {
                    LOGGER.error("Primary {} is stranded at {}", primary, demoted, restoreEx);
                    ex.addSuppressed(restoreEx);
                }
                throw ex;
            }
        } else {
            mover.move(duplicate, primary);
        }
        index.put(new ContentRecord(
                digest,
                record.path(),
                attrs.size(),
                attrs.lastModifiedTime().toInstant(),
                record.customerRoot()
        ));
        LOGGER.info("Promoted {} to {}{}", duplicate, primary,
                demoted == null ? "" : "; previous primary moved to " + demoted);
        return new PromoteResult(primary, demoted);
    }

    /**
     * Moves a quarantined file into {@code targetDirectory}. Relative targets resolve against the
     * central base.
     */
    public Path move(Path path, Path targetDirectory) throws IOException {
        ensureIdle();
        Path source = requireQuarantined(path);
        Path directory = targetDirectory.isAbsolute() ? targetDirectory : centralBase.resolve(targetDirectory);
        Path moved = mover.moveInto(source, directory.normalize());
        LOGGER.info("Moved quarantined file {} to {}", source, moved);
        return moved;
    }

    /**
     * Deletes quarantined files. Paths outside a quarantine folder or already gone are reported as
     * failures; the remaining paths are still processed.
     */
    public DeleteResult delete(List<Path> paths) {
        ensureIdle();
        List<String> deleted = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (Path path : paths) {
            try {
                Files.delete(requireQuarantined(path));
                deleted.add(path.toString());
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Failed to delete quarantined file {}", path, ex);
                failed.put(path.toString(), String.valueOf(ex.getMessage()));
            }
        }
        LOGGER.info("Deleted {} quarantined file(s), {} failed", deleted.size(), failed.size());
        return new DeleteResult(deleted, failed);
    }

    private List<Path> customerDirectories(String customer) throws IOException {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(centralBase)) {
            return result;
        }
        if (customer != null && !customer.isBlank()) {
            if (customer.contains("/") || customer.contains("\\") || customer.equals(".") || customer.equals("..")) {
                throw new IllegalArgumentException("Invalid customer: " + customer);
            }
            result.add(centralBase.resolve(customer));
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(centralBase, Files::isDirectory)) {
            for (Path entry : stream) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Accepts only files below {@code <central base>/<customer>/_duplicates/}.
     */
    private Path requireQuarantined(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(centralBase)) {
            throw new IllegalArgumentException("Not a quarantined file: " + path);
        }
        Path relative = centralBase.relativize(normalized);
        if (relative.getNameCount() < 3
                || !PathClassifier.QUARANTINE_DIRECTORY.equals(relative.getName(1).toString())) {
            throw new IllegalArgumentException("Not a quarantined file: " + path);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new NotFoundException("Quarantined file not found: " + path);
        }
        return normalized;
    }

    private void ensureIdle() {
        if (crawlRunning.getAsBoolean()) {
            throw new ConflictException("Quarantine cannot be changed while a crawl is running");
        }
    }
}
