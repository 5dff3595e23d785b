package com.sandy.netwatch.monitor;

import com.sandy.netwatch.monitor.model.StoredBlock;
import com.sandy.netwatch.monitor.storage.BlockStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Component
@Profile("test")
public class InMemoryBlockStoreTest implements BlockStore {
    private final Map<String, StoredBlock> blocks = new ConcurrentHashMap<>();
    private final AtomicBoolean failing = new AtomicBoolean();
    private final AtomicInteger writes = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public Optional<StoredBlock> read(String blockId) {
        check();
        return Optional.ofNullable(blocks.get(blockId));
    }

    @Override
    public void write(String blockId, StoredBlock block) {
        check();
        writes.incrementAndGet();
        blocks.put(blockId, block);
    }

    @Override
    public void delete(String blockId) {
        check();
        blocks.remove(blockId);
    }

    @Override
    public List<String> listIds(String prefix) {
        check();
        return blocks.keySet().stream().filter(id -> id.startsWith(prefix)).sorted().collect(Collectors.toList());
    }

    private void check() {
        calls.incrementAndGet();
        if (failing.get()) throw new IllegalStateException("store unreachable");
    }

    public void setFailing(boolean fail) {
        failing.set(fail);
    }

    /** Bypasses the failure switch. */
    public void put(String blockId, StoredBlock block) {
        blocks.put(blockId, block);
    }

    public StoredBlock get(String blockId) {
        return blocks.get(blockId);
    }

    public int writes() {
        return writes.get();
    }

    public int calls() {
        return calls.get();
    }

    public void clear() {
        blocks.clear();
        writes.set(0);
        calls.set(0);
        failing.set(false);
    }
}
