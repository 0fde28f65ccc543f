package com.example.fileingest.review;

import com.example.fileingest.index.JsonLogStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only newline-delimited log of operator decisions on reviewed classifications.
 */
public final class FeedbackLog {
    private final Path file;
    private final ObjectMapper mapper = JsonLogStore.defaultMapper();

    public FeedbackLog(Path file) {
        this.file = file;
    }

    public synchronized void append(FeedbackRecord record) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] json = mapper.writeValueAsBytes(record);
        ByteBuffer buffer = ByteBuffer.allocate(json.length + 1);
        buffer.put(json).put((byte) '\n').flip();
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
        }
    }

    public synchronized List<FeedbackRecord> readAll() throws IOException {
        List<FeedbackRecord> records = new ArrayList<>();
        if (!Files.exists(file)) {
            return records;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    records.add(mapper.readValue(line, FeedbackRecord.class));
                }
            }
        }
        return records;
    }

    public Path path() {
        return file;
    }
}
