package com.sandy.netwatch.monitor.monitor;

import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded per-key record of anomaly events plus a running count per anomaly type. Written only by the key's
 * own tick; readers get copies.
 */
public class AnomalyHistory {

    private final int capacity;
    private final ArrayDeque<AnomalyEvent> events;
    private final EnumMap<AnomalyType, Long> typeCounts = new EnumMap<>(AnomalyType.class);
    private long total;

    public AnomalyHistory(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    public synchronized void record(AnomalyEvent event) {
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
        total++;
        for (AnomalyType t : event.getTriggeredTypes()) {
            typeCounts.merge(t, 1L, Long::sum);
        }
    }

    /** The newest {@code limit} events, oldest first. */
    public synchronized List<AnomalyEvent> recent(int limit) {
        if (limit <= 0) return Collections.emptyList();
        List<AnomalyEvent> all = new ArrayList<>(events);
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    public synchronized int size() {
        return events.size();
    }

    /** Events ever recorded, including evicted ones. */
    public synchronized long total() {
        return total;
    }

    /** Counts per type over every event ever recorded. */
    public synchronized Map<AnomalyType, Long> typeDistribution() {
        return new EnumMap<>(typeCounts);
    }
}
