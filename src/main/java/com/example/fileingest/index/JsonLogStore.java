package com.example.fileingest.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable string-keyed map backed by an append-only newline-delimited JSON log.
 * <p>
 * Every {@link #put} and {@link #remove} appends one record and forces it to disk before returning,
 * so the store survives a crash after any single write. The whole map is held in memory; on open the
 * log is replayed, and once dead records outnumber live ones the log is rewritten in place.
 */
public final class JsonLogStore<V> implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLogStore.class);
    private static final int COMPACTION_MIN_RECORDS = 256;

    private final Path file;
    private final ObjectMapper mapper;
    private final JavaType recordType;
    private final Map<String, V> entries = new LinkedHashMap<>();
    private FileChannel channel;
    private long recordCount;

    public JsonLogStore(Path file, ObjectMapper mapper, Class<V> valueType) throws IOException {
        this.file = file;
        this.mapper = mapper;
        this.recordType = mapper.getTypeFactory().constructParametricType(LogRecord.class, valueType);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        replay();
        truncateTornTail();
        openChannel();
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized Optional<V> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public synchronized void put(String key, V value) throws IOException {
        append(new LogRecord<>(LogRecord.PUT, key, value));
        entries.put(key, value);
        compactIfNeeded();
    }

    public synchronized boolean remove(String key) throws IOException {
        if (!entries.containsKey(key)) {
            return false;
        }
        append(new LogRecord<>(LogRecord.REMOVE, key, null));
        entries.remove(key);
        compactIfNeeded();
        return true;
    }

    public synchronized List<V> values() {
        return new ArrayList<>(entries.values());
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Drops the in-memory view and rebuilds it from the log on disk.
     */
    public synchronized void reload() throws IOException {
        closeChannel();
        replay();
        truncateTornTail();
        openChannel();
    }

    /**
     * Rewrites the log so it holds exactly one record per live key.
     */
    public synchronized void compact() throws IOException {
        closeChannel();
        Path temp = file.resolveSibling(file.getFileName() + ".compact");
        try (FileChannel out = FileChannel.open(temp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (Map.Entry<String, V> entry : entries.entrySet()) {
                out.write(encode(new LogRecord<>(LogRecord.PUT, entry.getKey(), entry.getValue())));
            }
            out.force(true);
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        recordCount = entries.size();
        openChannel();
        LOGGER.debug("Compacted {} to {} records", file, recordCount);
    }

    public Path path() {
        return file;
    }

    @Override
    public synchronized void close() throws IOException {
        closeChannel();
    }

    private void replay() throws IOException {
        entries.clear();
        recordCount = 0;
        if (!Files.exists(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                LogRecord<V> record;
                try {
                    record = mapper.readValue(line, recordType);
                } catch (JsonProcessingException ex) {
                    // A torn final write is expected after a crash; anything else is still skipped.
                    LOGGER.warn("Skipping unreadable record at {}:{}", file, lineNumber, ex);
                    continue;
                }
                recordCount++;
                if (LogRecord.REMOVE.equals(record.op())) {
                    entries.remove(record.key());
                } else {
                    entries.put(record.key(), record.value());
                }
            }
        }
    }

    private void append(LogRecord<V> record) throws IOException {
        ByteBuffer buffer = encode(record);
        long start = channel.size();
        try {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
        } catch (IOException ex) {
            // Drop the partial line so the next append starts on a fresh one.
            try {
                channel.truncate(start);
            } catch (IOException truncateEx) {
                ex.addSuppressed(truncateEx);
            }
            throw ex;
        }
        recordCount++;
    }

    /**
     * Cuts an unterminated last line, left by a crash during an append, so that later appends do
     * not run into it.
     */
    private void truncateTornTail() throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        try (FileChannel out = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = out.size();
            long end = size;
            ByteBuffer one = ByteBuffer.allocate(1);
            while (end > 0) {
                one.clear();
                out.read(one, end - 1);
                if (one.get(0) == '\n') {
                    break;
                }
                end--;
            }
            if (end < size) {
                LOGGER.warn("Truncating {} unterminated byte(s) at the end of {}", size - end, file);
                out.truncate(end);
                out.force(true);
            }
        }
    }

    private ByteBuffer encode(LogRecord<V> record) throws JsonProcessingException {
        byte[] json = mapper.writeValueAsBytes(record);
        ByteBuffer buffer = ByteBuffer.allocate(json.length + 1);
        buffer.put(json).put((byte) '\n').flip();
        return buffer;
    }

    private void compactIfNeeded() throws IOException {
        if (recordCount >= COMPACTION_MIN_RECORDS && recordCount > 2L * entries.size()) {
            compact();
        }
    }

    private void openChannel() throws IOException {
        channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private void closeChannel() throws IOException {
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    record LogRecord<T>(String op, String key, T value) {
        static final String PUT = "put";
        static final String REMOVE = "remove";
    }
}
