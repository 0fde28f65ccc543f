package com.example.fileingest.index;

import com.example.fileingest.ConflictException;
import com.example.fileingest.NotFoundException;
import com.example.fileingest.content.ContentHasher;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.content.PathClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuarantineServiceTest {
    private Path sorted;
    private HashIndex index;
    private QuarantineService service;
    private final AtomicBoolean crawling = new AtomicBoolean();
    private final ContentHasher hasher = new ContentHasher();

    @BeforeEach
    void setUp() throws Exception {
        Path root = Files.createTempDirectory("quarantine");
        sorted = Files.createDirectory(root.resolve("sorted"));
        index = new HashIndex(root.resolve("index/hash.log"));
        service = new QuarantineService(index, hasher, new FileMover(),
                new PathClassifier(List.of(), false, List.of()), sorted, crawling::get);
    }

    @Test
    void listsNewestFirstWithPaging() throws Exception {
        write("ORGA/_duplicates/old.txt", "1", 100);
        write("ORGA/_duplicates/nested/mid.txt", "2", 200);
        write("INFRA/_duplicates/new.txt", "3", 300);
        write("ORGA/Allgemein/primary.txt", "4", 400);

        QuarantinePage all = service.list(null, 10, 0);
        assertEquals(3, all.total());
        assertEquals(List.of("new.txt", "mid.txt", "old.txt"), all.items().stream().map(QuarantinedFile::name).toList());

        QuarantinePage orga = service.list("ORGA", 1, 1);
        assertEquals(2, orga.total());
        assertEquals("old.txt", orga.items().get(0).name());
        assertEquals("ORGA", orga.items().get(0).customerRoot());
    }

    @Test
    void promoteSwapsWithCurrentPrimary() throws Exception {
        Path primary = write("ORGA/Allgemein/doc.txt", "same", 200);
        Path duplicate = write("INFRA/_duplicates/doc_copy.txt", "same", 100);
        String digest = hasher.hash(primary);
        index.put(new ContentRecord(digest, primary.toString(), 4, Instant.ofEpochSecond(200), "ORGA"));

        PromoteResult result = service.promote(duplicate);

        assertEquals(primary, result.primaryPath());
        assertEquals(sorted.resolve("ORGA/_duplicates/doc.txt"), result.demotedPath());
        assertEquals(Instant.ofEpochSecond(100), Files.getLastModifiedTime(primary).toInstant());
        assertEquals(Instant.ofEpochSecond(200), Files.getLastModifiedTime(result.demotedPath()).toInstant());
        assertFalse(Files.exists(duplicate));
        ContentRecord record = index.get(digest).orElseThrow();
        assertEquals(primary.toString(), record.path());
        assertEquals(Instant.ofEpochSecond(100), record.modifiedTime());
    }

    @Test
    void failedPromoteReportsTheSwapFailureFirst() throws Exception {
        service = new QuarantineService(index, hasher, new FailingMover(1),
                new PathClassifier(List.of(), false, List.of()), sorted, crawling::get);
        Path primary = write("ORGA/Allgemein/doc.txt", "same", 200);
        Path duplicate = write("INFRA/_duplicates/doc_copy.txt", "same", 100);
        index.put(new ContentRecord(hasher.hash(primary), primary.toString(), 4, Instant.ofEpochSecond(200), "ORGA"));

        IOException ex = assertThrows(IOException.class, () -> service.promote(duplicate));

        assertEquals("move failure 1", ex.getMessage());
        assertEquals(1, ex.getSuppressed().length);
        assertEquals("move failure 2", ex.getSuppressed()[0].getMessage());
        assertTrue(Files.exists(duplicate));
    }

    @Test
    void promoteFillsVanishedPrimary() throws Exception {
        Path duplicate = write("ORGA/_duplicates/doc.txt", "same", 100);
        Path primary = sorted.resolve("ORGA/Allgemein/doc.txt");
        index.put(new ContentRecord(hasher.hash(duplicate), primary.toString(), 4, Instant.ofEpochSecond(200), "ORGA"));

        PromoteResult result = service.promote(duplicate);

        assertNull(result.demotedPath());
        assertTrue(Files.exists(primary));
    }

    @Test
    void promoteWithoutIndexRecordIsNotFound() throws Exception {
        Path duplicate = write("ORGA/_duplicates/orphan.txt", "orphan", 100);

        assertThrows(NotFoundException.class, () -> service.promote(duplicate));
        assertTrue(Files.exists(duplicate));
    }

    @Test
    void moveAndDelete() throws Exception {
        Path first = write("ORGA/_duplicates/a.txt", "a", 100);
        Path second = write("ORGA/_duplicates/b.txt", "b", 100);
        Files.writeString(Files.createDirectories(sorted.resolve("ORGA/Archiv")).resolve("a.txt"), "taken");

        Path moved = service.move(first, Path.of("ORGA/Archiv"));
        assertEquals(sorted.resolve("ORGA/Archiv/a_1.txt"), moved);

        Path outside = sorted.resolve("ORGA/Archiv/a.txt");
        DeleteResult result = service.delete(List.of(second, outside));
        assertEquals(List.of(second.toString()), result.deleted());
        assertTrue(result.failed().containsKey(outside.toString()));
        assertFalse(Files.exists(second));
        assertTrue(Files.exists(outside));
    }

    @Test
    void filesOutsideTheCentralQuarantineAreLeftAlone() throws Exception {
        Path foreign = sorted.resolveSibling("elsewhere/_duplicates/keep.txt");
        Files.createDirectories(foreign.getParent());
        Files.writeString(foreign, "keep");
        Path deep = write("ORGA/Allgemein/_duplicates/inner.txt", "inner", 100);
        Path escaping = sorted.resolve("ORGA/_duplicates/../../elsewhere/_duplicates/keep.txt");

        DeleteResult result = service.delete(List.of(foreign, deep, escaping));

        assertTrue(result.deleted().isEmpty());
        assertEquals(3, result.failed().size());
        assertTrue(Files.exists(foreign));
        assertTrue(Files.exists(deep));
        assertThrows(IllegalArgumentException.class, () -> service.move(foreign, Path.of("ORGA")));
        assertThrows(IllegalArgumentException.class, () -> service.promote(foreign));
        assertThrows(IllegalArgumentException.class, () -> service.list("..", 10, 0));
        assertThrows(IllegalArgumentException.class, () -> service.list("ORGA/../..", 10, 0));
    }

    @Test
    void mutationsRejectedWhileCrawling() throws Exception {
        Path duplicate = write("ORGA/_duplicates/a.txt", "a", 100);
        crawling.set(true);

        assertThrows(ConflictException.class, () -> service.promote(duplicate));
        assertThrows(ConflictException.class, () -> service.move(duplicate, Path.of("ORGA")));
        assertThrows(ConflictException.class, () -> service.delete(List.of(duplicate)));
        assertEquals(1, service.list(null, 10, 0).total());
    }

    private Path write(String relative, String content, long mtimeSeconds) throws Exception {
        Path file = sorted.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(mtimeSeconds)));
        return file;
    }
}
