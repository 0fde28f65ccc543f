package com.example.fileingest.content;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

public class FileMetadataExtractor {
    private final Tika tika;
    private final ContentHasher hasher;

    public FileMetadataExtractor(Tika tika, ContentHasher hasher) {
        this.tika = tika;
        this.hasher = hasher;
    }

    public FileMetadata extract(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        if (!attributes.isRegularFile()) {
            throw new IOException("Not a regular file: " + path);
        }
        return new FileMetadata(
                path.toString(),
                path.getFileName().toString(),
                attributes.size(),
                detectMimeType(path),
                hasher.hash(path),
                attributes.creationTime().toInstant(),
                attributes.lastModifiedTime().toInstant()
        );
    }

    private String detectMimeType(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? "application/octet-stream" : mediaType.getBaseType().toString();
        } catch (IOException ex) {
            return "application/octet-stream";
        }
    }
}
