package com.wyzinc.pricewatch.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wyzinc.pricewatch.domain.Snapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State kept as one JSON object keyed by product url. The whole file is rewritten on save.
 */
@Slf4j
public class JsonStateStore implements StateStore {
    private static final TypeReference<LinkedHashMap<String, Snapshot>> STATE_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Snapshot> entries;

    private JsonStateStore(Path file, ObjectMapper objectMapper, Map<String, Snapshot> entries) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.entries = entries;
    }

    public static JsonStateStore load(Path file) {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        Map<String, Snapshot> entries = new LinkedHashMap<>();
        if (Files.exists(file)) {
            try {
                Map<String, Snapshot> stored = objectMapper.readValue(file.toFile(), STATE_TYPE);
                if (stored != null) {
                    entries.putAll(stored);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read state file " + file, e);
            }
            log.info("Loaded {} stored snapshots from {}", entries.size(), file);
        } else {
            log.info("No state file at {}, starting empty", file);
        }
        return new JsonStateStore(file, objectMapper, entries);
    }

    @Override
    public Optional<Snapshot> get(String url) {
        return Optional.ofNullable(entries.get(url));
    }

    @Override
    public void put(Snapshot snapshot) {
        entries.put(snapshot.getUrl(), snapshot);
    }

    public Map<String, Snapshot> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Writes to a temporary sibling first and renames it over the state file, so an interrupted
     * save leaves the previous state intact.
     */
    @Override
    public void save() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), entries);
                try {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
            log.info("Saved {} snapshots to {}", entries.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save state file " + file, e);
        }
    }
}
