package com.example.fileingest.content;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContentHasherTest {
    private final ContentHasher hasher = new ContentHasher();

    @Test
    void hashesKnownContent() throws Exception {
        Path file = Files.createTempDirectory("hasher").resolve("abc.txt");
        Files.writeString(file, "abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", hasher.hash(file));
    }

    @Test
    void sameBytesSameDigestAcrossLocations() throws Exception {
        Path dir = Files.createTempDirectory("hasher");
        byte[] content = new byte[ContentHasher.BLOCK_SIZE * 2 + 17];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i * 31);
        }
        Path first = Files.write(dir.resolve("a.bin"), content);
        Path second = Files.write(Files.createDirectory(dir.resolve("nested")).resolve("b.bin"), content);
        content[content.length - 1]++;
        Path third = Files.write(dir.resolve("c.bin"), content);

        assertEquals(hasher.hash(first), hasher.hash(second));
        assertNotEquals(hasher.hash(first), hasher.hash(third));
    }

    @Test
    void missingFileSurfacesIoError() throws Exception {
        Path missing = Files.createTempDirectory("hasher").resolve("gone.txt");

        assertThrows(IOException.class, () -> hasher.hash(missing));
    }
}
