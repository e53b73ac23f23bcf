package com.statute.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON Lines store: one record per line, in its canonical form plus
 * {@code record_hash}. Lines are only ever appended.
 */
public class JsonlAuditRepository implements AuditRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonlAuditRepository.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private final Path path;
    private int count;

    public JsonlAuditRepository(Path path) {
        this.path = path;
        this.count = Files.exists(path) ? loadAll().size() : 0;
        log.info("JSONL audit store opened at {} with {} records", path, count);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void save(AuditRecord record) {
        String line;
        try {
            line = mapper.writeValueAsString(CanonicalPayload.toStoredMap(record));
        } catch (JsonProcessingException e) {
            throw new AuditStorageException("Failed to serialize audit record " + record.id(), e);
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new AuditStorageException("Failed to append audit record " + record.id() + " to " + path, e);
        }
        count++;
    }

    @Override
    public synchronized List<AuditRecord> loadAll() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AuditStorageException("Failed to read audit store " + path, e);
        }
        List<AuditRecord> records = new ArrayList<>(lines.size());
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(CanonicalPayload.fromMap(mapper.readValue(line, MAP_TYPE)));
            } catch (JsonProcessingException | RuntimeException e) {
                throw new AuditStorageException("Unreadable audit record at " + path + ":" + lineNumber, e);
            }
        }
        return records;
    }

    @Override
    public synchronized int count() {
        return count;
    }
}
