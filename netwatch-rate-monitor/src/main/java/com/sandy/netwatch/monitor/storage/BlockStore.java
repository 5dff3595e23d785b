package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.model.StoredBlock;

import java.util.List;
import java.util.Optional;

/**
 * Key-value backing store for encoded series blocks. Implementations may block and may fail; callers go
 * through {@link StorageOperations} for timeouts and retries.
 */
public interface BlockStore {

    String RAW_PREFIX = "raw/";
    String AGGREGATE_PREFIX = "agg/";

    Optional<StoredBlock> read(String blockId);

    void write(String blockId, StoredBlock block);

    void delete(String blockId);

    /** Ids of all blocks whose id starts with {@code prefix}. */
    List<String> listIds(String prefix);

    static String rawId(String key) {
        return RAW_PREFIX + key;
    }

    static String aggregateId(String key) {
        return AGGREGATE_PREFIX + key;
    }
}
