package com.example.fileingest.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

/**
 * Filesystem moves used by every component that relocates files. A move is a rename when
 * source and destination share a filesystem, otherwise a copy followed by a delete.
 * Existing destinations are never overwritten.
 */
public class FileMover {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileMover.class);

    public Path move(Path source, Path destination) throws IOException {
        if (Files.exists(destination)) {
            throw new FileAlreadyExistsException(destination.toString());
        }
        Path parent = destination.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            return Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Rename not possible for {} -> {}, copying instead", source, destination);
            Files.copy(source, destination, StandardCopyOption.COPY_ATTRIBUTES);
            Files.delete(source);
            return destination;
        }
    }

    /**
     * Moves {@code source} into {@code directory}, keeping its name unless taken.
     */
    public Path moveInto(Path source, Path directory) throws IOException {
        return move(source, uniqueTarget(directory, source.getFileName().toString()));
    }

    public Path copy(Path source, Path destination) throws IOException {
        Path parent = destination.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.copy(source, destination, StandardCopyOption.COPY_ATTRIBUTES);
    }

    /**
     * Returns {@code directory/fileName}, or {@code directory/stem_N.ext} with the smallest free N.
     */
    public Path uniqueTarget(Path directory, String fileName) {
        return uniqueTarget(directory, fileName, Set.of());
    }

    /**
     * Like {@link #uniqueTarget(Path, String)}, also treating {@code reserved} paths as taken.
     */
    public Path uniqueTarget(Path directory, String fileName, Set<Path> reserved) {
        Path candidate = directory.resolve(fileName);
        if (!taken(candidate, reserved)) {
            return candidate;
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        int counter = 1;
        while (taken(candidate, reserved)) {
            candidate = directory.resolve(stem + "_" + counter + extension);
            counter++;
        }
        return candidate;
    }

    private boolean taken(Path candidate, Set<Path> reserved) {
        return Files.exists(candidate) || reserved.contains(candidate);
    }
}
