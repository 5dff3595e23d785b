package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.model.Bucket;
import com.sandy.netwatch.monitor.model.Sample;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory images of every known series, one {@link Buffer} per key.
 */
public class SeriesBuffers {

    /** Raw capacity for keys that were never registered, e.g. alarm history. */
    public static final int DEFAULT_CAPACITY = 10000;

    private final ConcurrentHashMap<String, Buffer> buffers = new ConcurrentHashMap<>();

    /** @return samples evicted when an existing buffer shrinks */
    public int register(String key, int capacity) {
        Buffer existing = buffers.putIfAbsent(key, new Buffer(key, capacity));
        if (existing == null) return 0;
        existing.lock().lock();
        try {
            return existing.resize(capacity);
        } finally {
            existing.lock().unlock();
        }
    }

    public Buffer getOrCreate(String key) {
        return buffers.computeIfAbsent(key, k -> new Buffer(k, DEFAULT_CAPACITY));
    }

    public Buffer get(String key) {
        return buffers.get(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(buffers.keySet());
    }

    /**
     * Raw ring and aggregates of one key. All access happens under {@link #lock()}.
     * <p>
     * Until the stored image has been loaded the buffer only holds samples seen since startup and must not be
     * written back, otherwise it would overwrite what the store already has.
     */
    public static class Buffer {

        private final String key;
        private final ReentrantLock lock = new ReentrantLock();
        private final ArrayDeque<Sample> raw = new ArrayDeque<>();
        private List<Bucket> aggregates = new ArrayList<>();
        private int capacity;
        private boolean loaded;

        Buffer(String key, int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Capacity must be > 0 for key " + key);
            }
            this.key = key;
            this.capacity = capacity;
        }

        public String key() {
            return key;
        }

        public ReentrantLock lock() {
            return lock;
        }

        public boolean isLoaded() {
            return loaded;
        }

        public Sample latest() {
            return raw.peekLast();
        }

        /** @return number of samples evicted from the head */
        public int add(Sample sample) {
            raw.addLast(sample);
            return evict();
        }

        /**
         * Merges the stored image underneath what arrived while the store was unreachable. Stored samples win
         * on equal timestamps.
         *
         * @return number of samples evicted to stay within capacity
         */
        public int mergeLoaded(List<Sample> storedRaw, List<Bucket> storedAggregates) {
            TreeMap<Long, Sample> byTs = new TreeMap<>();
            for (Sample s : raw) byTs.put(s.timestamp(), s);
            for (Sample s : storedRaw) byTs.put(s.timestamp(), s);
            raw.clear();
            raw.addAll(byTs.values());

            TreeMap<Long, Bucket> aggByTs = new TreeMap<>();
            for (Bucket b : aggregates) aggByTs.put(b.timestamp(), b);
            for (Bucket b : storedAggregates) aggByTs.put(b.timestamp(), b);
            aggregates = new ArrayList<>(aggByTs.values());
            loaded = true;
            return evict();
        }

        public void replace(List<Sample> newRaw, List<Bucket> newAggregates) {
            raw.clear();
            raw.addAll(newRaw);
            aggregates = new ArrayList<>(newAggregates);
        }

        public List<Sample> rawSnapshot() {
            return new ArrayList<>(raw);
        }

        public List<Bucket> aggregateSnapshot() {
            return new ArrayList<>(aggregates);
        }

        public int rawSize() {
            return raw.size();
        }

        public int aggregateSize() {
            return aggregates.size();
        }

        int resize(int newCapacity) {
            if (newCapacity <= 0) {
                throw new IllegalArgumentException("Capacity must be > 0 for key " + key);
            }
            this.capacity = newCapacity;
            return evict();
        }

        private int evict() {
            int evicted = 0;
            while (raw.size() > capacity) {
                raw.pollFirst();
                evicted++;
            }
            return evicted;
        }
    }
}
