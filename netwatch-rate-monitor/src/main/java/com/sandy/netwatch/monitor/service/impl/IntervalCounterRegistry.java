package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.model.MonitoringKey;
import com.sandy.netwatch.monitor.service.CounterSource;
import com.sandy.netwatch.monitor.service.CounterUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Counter source fed by the capture side. {@link #count(String, double)} adds to every registered key of that
 * counter name ({@code total} feeds {@code total:s} and {@code total:m} alike); a read returns the amount
 * accumulated since the key's previous read and resets it.
 */
@Component
@Slf4j
public class IntervalCounterRegistry implements CounterSource {

    private final Map<String, DoubleAdder> counters = new ConcurrentHashMap<>();
    /** Adders of {@link #counters} grouped by counter name. */
    private final Map<String, List<DoubleAdder>> byName = new ConcurrentHashMap<>();
    private volatile boolean capturing = true;

    @Override
    public void register(String key) {
        counters.computeIfAbsent(key, k -> {
            DoubleAdder adder = new DoubleAdder();
            byName.computeIfAbsent(MonitoringKey.counterNameOf(k), n -> new CopyOnWriteArrayList<>()).add(adder);
            return adder;
        });
    }

    public void count(String name, double delta) {
        List<DoubleAdder> adders = byName.get(name);
        if (adders == null) return;
        for (DoubleAdder adder : adders) {
            adder.add(delta);
        }
    }

    public void count(String name) {
        count(name, 1);
    }

    @Override
    public double read(String key) throws CounterUnavailableException {
        if (!capturing) {
            throw new CounterUnavailableException("Capture is not running");
        }
        DoubleAdder adder = counters.get(key);
        if (adder == null) {
            throw new CounterUnavailableException("No counter registered for key " + key);
        }
        return adder.sumThenReset();
    }

    /** Marks the capture side up or down; while down every read fails. */
    public void setCapturing(boolean capturing) {
        if (this.capturing != capturing) {
            log.info("Counter capture {}", capturing ? "resumed" : "stopped");
        }
        this.capturing = capturing;
    }
}
