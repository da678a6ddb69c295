package com.example.agentpayments.store;

import java.util.Map;
import java.util.Optional;

/**
 * Keyed record storage, one record per (ownerId, key), last write wins.
 */
public interface FactStore {

    void set(String ownerId, String key, Map<String, Object> value);

    Optional<FactRecord> get(String ownerId, String key);

    /**
     * All records owned by {@code ownerId}, keyed by record key.
     */
    Map<String, FactRecord> list(String ownerId);

    StorageBackend backend();

    /**
     * True when a database was configured but could not be reached, so this store runs on the file fallback.
     */
    boolean isDegraded();
}
