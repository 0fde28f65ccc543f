package com.example.fileingest.index;

import com.example.fileingest.content.FileMover;
import com.example.fileingest.content.PathClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides which copy of a digest stays primary and relegates the loser to a quarantine folder.
 * <p>
 * The newer modification time wins; on a tie the larger file wins; on a full tie the existing
 * primary stays. A losing previous primary goes to the quarantine of the customer that owns it, a
 * losing newcomer to the quarantine of its own classified customer.
 */
public final class DuplicateResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateResolver.class);

    private final HashIndex index;
    private final FileMover mover;
    private final PathClassifier classifier;
    private final Path centralBase;

    public DuplicateResolver(HashIndex index, FileMover mover, PathClassifier classifier, Path centralBase) {
        this.index = index;
        this.mover = mover;
        this.classifier = classifier;
        this.centralBase = centralBase;
    }

    public Resolution resolve(ObservedFile observed) throws IOException {
        Path source = normalize(observed.source());
        Optional<ContentRecord> existing = index.get(observed.digest());

        if (existing.isPresent() && normalize(existing.get().location()).equals(source)) {
            return new Resolution(Resolution.Outcome.ALREADY_PRIMARY, source, null);
        }
        if (existing.isPresent() && !Files.exists(existing.get().location())) {
            LOGGER.info("Indexed primary {} no longer exists; {} takes its place",
                    existing.get().path(), source);
            existing = Optional.empty();
        }

        if (existing.isEmpty()) {
            return storeFirst(observed, source);
        }
        ContentRecord current = existing.get();
        if (wins(observed, current)) {
            return replacePrimary(observed, source, current);
        }
        Path quarantined = mover.moveInto(source, classifier.quarantineDirectory(centralBase, observed.customerRoot()));
        LOGGER.debug("Quarantined {} as duplicate of {}", source, current.path());
        return new Resolution(Resolution.Outcome.QUARANTINED, current.location(), quarantined);
    }

    /**
     * True when the observed file should displace the current primary.
     */
    static boolean wins(ObservedFile observed, ContentRecord current) {
        int byTime = observed.modifiedTime().compareTo(current.modifiedTime());
        if (byTime != 0) {
            return byTime > 0;
        }
        return observed.size() > current.size();
    }

    private Resolution storeFirst(ObservedFile observed, Path source) throws IOException {
        Path directory = normalize(observed.destinationDirectory());
        Path fileName = source.getFileName();
        if (directory.resolve(fileName).equals(source)) {
            index.put(recordFor(observed, source, observed.customerRoot()));
            return new Resolution(Resolution.Outcome.INDEXED_IN_PLACE, source, null);
        }
        Path destination = mover.moveInto(source, directory);
        index.put(recordFor(observed, destination, observed.customerRoot()));
        return new Resolution(Resolution.Outcome.STORED, destination, null);
    }

    private Resolution replacePrimary(ObservedFile observed, Path source, ContentRecord current) throws IOException {
        Path primary = current.location();
        Path quarantined = mover.moveInto(primary, classifier.quarantineDirectory(centralBase, current.customerRoot()));
        try {
            mover.move(source, primary);
        } catch (IOException ex) {
            // Put the previous primary back so the index still points at a real file.
            restore(quarantined, primary, ex);
            throw ex;
        }
        index.put(recordFor(observed, primary, current.customerRoot()));
        LOGGER.debug("{} replaced primary {}; previous copy quarantined at {}", source, primary, quarantined);
        return new Resolution(Resolution.Outcome.REPLACED_PRIMARY, primary, quarantined);
    }

    private void restore(Path quarantined, Path primary, IOException failure) {
        try {
            mover.move(quarantined, primary);
        } catch (IOException restoreEx) {
            LOGGER.error("Previous primary of {} is stranded at {}", primary, quarantined, restoreEx);
            failure.addSuppressed(restoreEx);
        }
    }

    private ContentRecord recordFor(ObservedFile observed, Path location, String customerRoot) {
        return new ContentRecord(
                observed.digest(),
                location.toString(),
                observed.size(),
                observed.modifiedTime(),
                customerRoot
        );
    }

    private Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
