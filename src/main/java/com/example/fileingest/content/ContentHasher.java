package com.example.fileingest.content;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams a file through SHA-256 in fixed-size blocks. Identical bytes always yield
 * the same lowercase hex digest, wherever the file lives.
 */
public final class ContentHasher {
    static final int BLOCK_SIZE = 1024 * 1024;

    public String hash(Path path) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[BLOCK_SIZE];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return toHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
