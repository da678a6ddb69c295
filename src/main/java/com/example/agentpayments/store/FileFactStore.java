package com.example.agentpayments.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps every record in a single JSON document keyed by {@code "<ownerId>:<key>"}.
 * Each call reloads the file; each {@link #set} rewrites it in full.
 */
public class FileFactStore implements FactStore {

    private static final Logger logger = LoggerFactory.getLogger(FileFactStore.class);
    private static final TypeReference<LinkedHashMap<String, FactRecord>> LAYOUT = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final boolean degraded;

    public FileFactStore(Path file, ObjectMapper objectMapper) {
        this(file, objectMapper, false);
    }

    public FileFactStore(Path file, ObjectMapper objectMapper, boolean degraded) {
        this.file = file;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.degraded = degraded;
    }

    @Override
    public synchronized void set(String ownerId, String key, Map<String, Object> value) {
        Map<String, FactRecord> data = load();
        data.put(compositeKey(ownerId, key), FactRecord.builder()
                .ownerId(ownerId)
                .key(key)
                .value(value)
                .ts(Instant.now().toString())
                .build());
        save(data);
    }

    @Override
    public synchronized Optional<FactRecord> get(String ownerId, String key) {
        // "a" + "b:k" and "a:b" + "k" share a composite key; only return the exact owner's record
        return Optional.ofNullable(load().get(compositeKey(ownerId, key)))
                .filter(r -> ownerId.equals(r.getOwnerId()) && key.equals(r.getKey()));
    }

    @Override
    public synchronized Map<String, FactRecord> list(String ownerId) {
        Map<String, FactRecord> out = new LinkedHashMap<>();
        load().values().forEach(v -> {
            if (ownerId.equals(v.getOwnerId())) out.put(v.getKey(), v);
        });
        return out;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.FILE;
    }

    @Override
    public boolean isDegraded() {
        return degraded;
    }

    public Path getFile() {
        return file;
    }

    private Map<String, FactRecord> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, FactRecord> data = objectMapper.readValue(file.toFile(), LAYOUT);
            return data != null ? data : new LinkedHashMap<>();
        } catch (IOException e) {
            logger.warn("Facts file {} unreadable, treating store as empty: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void save(Map<String, FactRecord> data) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), data);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write facts file " + file, e);
        }
    }

    static String compositeKey(String ownerId, String key) {
        return ownerId + ":" + key;
    }
}
