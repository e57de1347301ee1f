package com.judgmentrag.service.index;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.judgmentrag.exception.RagException;

import lombok.extern.slf4j.Slf4j;

/**
 * Append-only JSON-lines journal of keyed, versioned values.
 * <p>
 * Every line is {@code {"key":..,"version":..,"value":..}}; a null value is a tombstone.
 * Replay keeps the highest version per key, so the order in which concurrent writers
 * reach the file does not matter. An unreadable line (a write torn by a crash) is skipped.
 */
@Slf4j
public class VersionedJournal<T> {

    public record Versioned<T>(T value, long version) {

        public boolean isTombstone() {
            return value == null;
        }
    }

    public record Change<T>(String key, T value, long version) {
    }

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public VersionedJournal(Path file, ObjectMapper objectMapper, Class<T> type) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Latest version per key, tombstones included.
     */
    public synchronized Map<String, Versioned<T>> replay() {
        Map<String, Versioned<T>> state = new HashMap<>();
        if (!Files.exists(file)) {
            return state;
        }

        int lineNo = 0;
        int skipped = 0;
        boolean lastLineValid = true;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                lastLineValid = true;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    JsonNode node = objectMapper.readTree(line);
                    String key = node.get("key").asText();
                    long version = node.get("version").asLong();
                    JsonNode valueNode = node.get("value");
                    T value = valueNode == null || valueNode.isNull()
                            ? null
                            : objectMapper.treeToValue(valueNode, type);

                    Versioned<T> current = state.get(key);
                    if (current == null || current.version() <= version) {
                        state.put(key, new Versioned<>(value, version));
                    }
                } catch (Exception e) {
                    lastLineValid = false;
                    skipped++;
                    log.warn("Skipping unreadable journal line {} of {}: {}", lineNo, file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new RagException("Failed to read journal " + file, e);
        }

        repairTail(lastLineValid);
        log.info("Replayed {} lines from {} ({} keys, {} skipped)", lineNo, file.getFileName(), state.size(), skipped);
        return state;
    }

    /**
     * Makes sure the file ends with a line terminator so that the next append starts on a line of
     * its own. An unterminated last line that replayed cleanly gets its terminator; one that did
     * not is cut off.
     */
    private void repairTail(boolean lastLineValid) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            long end = size;
            ByteBuffer one = ByteBuffer.allocate(1);
            while (end > 0) {
                one.clear();
                channel.read(one, end - 1);
                if (one.get(0) == '\n') {
                    break;
                }
                end--;
            }
            if (end == size) {
                return;
            }

            if (lastLineValid) {
                log.warn("Terminating the last line of {}", file);
                ByteBuffer newline = ByteBuffer.wrap(new byte[] {'\n'});
                while (newline.hasRemaining()) {
                    channel.write(newline, size);
                }
            } else {
                log.warn("Truncating {} bytes of an unterminated line at the end of {}", size - end, file);
                channel.truncate(end);
            }
            channel.force(true);
        } catch (IOException e) {
            throw new RagException("Failed to repair journal " + file, e);
        }
    }

    /**
     * Appends the changes and forces them to disk before returning.
     */
    public synchronized void append(Collection<Change<T>> changes) {
        if (changes.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (Change<T> change : changes) {
            sb.append(toLine(change)).append('\n');
        }

        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new RagException("Failed to append to journal " + file, e);
        }
    }

    /**
     * Replaces the journal with exactly the given live values (temp file, then atomic move).
     */
    public synchronized void rewrite(Collection<Change<T>> live) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                for (Change<T> change : live) {
                    ByteBuffer buffer = ByteBuffer.wrap(
                            (toLine(change) + "\n").getBytes(StandardCharsets.UTF_8));
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                }
                channel.force(true);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RagException("Failed to compact journal " + file, e);
        }
    }

    private String toLine(Change<T> change) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("key", change.key());
        node.put("version", change.version());
        node.set("value", change.value() == null ? null : objectMapper.valueToTree(change.value()));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new RagException("Failed to serialize journal entry " + change.key(), e);
        }
    }
}
