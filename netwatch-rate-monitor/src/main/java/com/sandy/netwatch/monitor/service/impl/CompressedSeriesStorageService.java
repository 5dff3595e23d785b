package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.model.AppendResult;
import com.sandy.netwatch.monitor.model.BlockEncoding;
import com.sandy.netwatch.monitor.model.Bucket;
import com.sandy.netwatch.monitor.model.MonitoringKey;
import com.sandy.netwatch.monitor.model.RetentionPolicy;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.StorageStatistics;
import com.sandy.netwatch.monitor.model.StoredBlock;
import com.sandy.netwatch.monitor.model.SweepReport;
import com.sandy.netwatch.monitor.service.SeriesStorageService;
import com.sandy.netwatch.monitor.storage.BlockCodec;
import com.sandy.netwatch.monitor.storage.BlockStore;
import com.sandy.netwatch.monitor.storage.SeriesAggregator;
import com.sandy.netwatch.monitor.storage.SeriesBuffers;
import com.sandy.netwatch.monitor.storage.StorageException;
import com.sandy.netwatch.monitor.storage.StorageOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Write-through series storage: every key keeps its raw ring and aggregates in memory and the whole raw block
 * is rewritten on each append. Reads are served from memory once the stored image has been loaded, so a dead
 * backing store never starves detection.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompressedSeriesStorageService implements SeriesStorageService {

    private final StorageOperations storage;
    private final BlockCodec codec;
    private final HealthReporter healthReporter;
    private final SeriesBuffers buffers = new SeriesBuffers();

    private final AtomicLong blocksWritten = new AtomicLong();
    private final AtomicLong compressedBlocks = new AtomicLong();
    private final AtomicLong bytesSaved = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();
    private final AtomicLong pointsAggregated = new AtomicLong();
    private final AtomicLong pointsDropped = new AtomicLong();
    private final AtomicLong lastSweepEpoch = new AtomicLong();

    private record LoadedImage(Optional<StoredBlock> raw, Optional<StoredBlock> aggregates) {
    }

    @Override
    public void register(MonitoringKey key) {
        pointsDropped.addAndGet(buffers.register(key.id(), key.maxSamples()));
        log.info("Registered series key={} unit={} maxSamples={}", key.id(), key.unit(), key.maxSamples());
    }

    @Override
    public AppendResult append(String key, Sample sample) {
        SeriesBuffers.Buffer buf = buffers.getOrCreate(key);
        buf.lock().lock();
        try {
            ensureLoaded(buf);
            Sample last = buf.latest();
            if (last != null && sample.timestamp() <= last.timestamp()) {
                log.debug("Rejected out-of-order sample key={} ts={} latestTs={}", key, sample.timestamp(), last.timestamp());
                return AppendResult.REJECTED;
            }
            pointsDropped.addAndGet(buf.add(sample));
            if (!buf.isLoaded()) {
                return AppendResult.BUFFERED;
            }
            return writeRaw(buf) ? AppendResult.STORED : AppendResult.BUFFERED;
        } finally {
            buf.lock().unlock();
        }
    }

    @Override
    public List<Sample> range(String key, long start, long end) {
        if (start > end) return Collections.emptyList();
        List<Sample> out = new ArrayList<>();
        View view = view(key);
        for (Bucket b : view.aggregates()) {
            if (b.timestamp() >= start && b.timestamp() <= end) out.add(b.toSample());
        }
        for (Sample s : view.raw()) {
            if (s.timestamp() >= start && s.timestamp() <= end) out.add(s);
        }
        out.sort(Comparator.comparingLong(Sample::timestamp));
        return out;
    }

    @Override
    public List<Sample> recent(String key, int limit) {
        if (limit <= 0) return Collections.emptyList();
        List<Sample> raw = view(key).raw();
        return new ArrayList<>(raw.subList(Math.max(0, raw.size() - limit), raw.size()));
    }

    @Override
    public Optional<Sample> latest(String key) {
        List<Sample> last = recent(key, 1);
        return last.isEmpty() ? Optional.empty() : Optional.of(last.get(0));
    }

    @Override
    public Set<String> keys() {
        Set<String> keys = new TreeSet<>(buffers.keys());
        try {
            List<String> ids = storage.call("list", store -> {
                List<String> all = new ArrayList<>(store.listIds(BlockStore.RAW_PREFIX));
                all.addAll(store.listIds(BlockStore.AGGREGATE_PREFIX));
                return all;
            });
            for (String id : ids) {
                keys.add(id.substring(id.indexOf('/') + 1));
            }
        } catch (StorageException e) {
            log.warn("Listing stored series failed, returning in-memory keys only: {}", e.getMessage());
        }
        return keys;
    }

    @Override
    public Optional<SweepReport> applyRetention(String key, RetentionPolicy policy, long nowEpoch) {
        SeriesBuffers.Buffer buf = buffers.getOrCreate(key);
        buf.lock().lock();
        try {
            if (!ensureLoaded(buf)) {
                return Optional.empty();
            }
            List<Sample> raw = buf.rawSnapshot();
            List<Bucket> aggregates = buf.aggregateSnapshot();
            SeriesAggregator.Result result = SeriesAggregator.apply(raw, aggregates, policy, nowEpoch);
            SweepReport report = new SweepReport(key, policy.name(), raw.size(), result.raw().size(),
                    aggregates.size(), result.aggregates().size(), result.bucketsCreated(), result.aggregatesDropped());
            lastSweepEpoch.set(nowEpoch);
            if (!report.changed()) {
                return Optional.of(report);
            }
            StoredBlock rawBlock = result.raw().isEmpty() ? null : codec.encode(result.raw());
            StoredBlock aggBlock = result.aggregates().isEmpty() ? null : codec.encodeBuckets(result.aggregates());
            try {
                storage.run("sweep", store -> {
                    if (rawBlock == null) store.delete(BlockStore.rawId(key));
                    else store.write(BlockStore.rawId(key), rawBlock);
                    if (aggBlock == null) store.delete(BlockStore.aggregateId(key));
                    else store.write(BlockStore.aggregateId(key), aggBlock);
                });
                healthReporter.storageRecovered(key, "sweep");
            } catch (StorageException e) {
                writeFailures.incrementAndGet();
                healthReporter.storageFailure(key, "sweep", e);
                return Optional.empty();
            }
            if (rawBlock != null) recordWrite(rawBlock);
            if (aggBlock != null) recordWrite(aggBlock);
            buf.replace(result.raw(), result.aggregates());
            pointsAggregated.addAndGet(raw.size() - result.raw().size());
            log.debug("Retention applied key={} policy={} raw {}->{} aggregates {}->{}", key, policy.name(),
                    report.rawBefore(), report.rawAfter(), report.aggregatedBefore(), report.aggregatedAfter());
            return Optional.of(report);
        } finally {
            buf.lock().unlock();
        }
    }

    @Override
    public StorageStatistics statistics() {
        return StorageStatistics.builder()
                .keys(buffers.keys().size())
                .blocksWritten(blocksWritten.get())
                .compressedBlocks(compressedBlocks.get())
                .bytesSaved(bytesSaved.get())
                .writeFailures(writeFailures.get())
                .pointsAggregated(pointsAggregated.get())
                .pointsDropped(pointsDropped.get())
                .lastSweepEpoch(lastSweepEpoch.get())
                .build();
    }

    private record View(List<Sample> raw, List<Bucket> aggregates) {
    }

    /** Buffered keys are served from memory; others are read from the store without being cached. */
    private View view(String key) {
        SeriesBuffers.Buffer buf = buffers.get(key);
        if (buf != null) {
            buf.lock().lock();
            try {
                ensureLoaded(buf);
                return new View(buf.rawSnapshot(), buf.aggregateSnapshot());
            } finally {
                buf.lock().unlock();
            }
        }
        try {
            LoadedImage image = load(key);
            return new View(decode(image.raw()), decodeBuckets(image.aggregates()));
        } catch (StorageException e) {
            healthReporter.storageFailure(key, "read", e);
            return new View(Collections.emptyList(), Collections.emptyList());
        }
    }

    private boolean ensureLoaded(SeriesBuffers.Buffer buf) {
        if (buf.isLoaded()) return true;
        try {
            LoadedImage image = load(buf.key());
            pointsDropped.addAndGet(buf.mergeLoaded(decode(image.raw()), decodeBuckets(image.aggregates())));
            healthReporter.storageRecovered(buf.key(), "load");
            log.debug("Loaded series key={} raw={} aggregates={}", buf.key(), buf.rawSize(), buf.aggregateSize());
            return true;
        } catch (StorageException e) {
            healthReporter.storageFailure(buf.key(), "load", e);
            return false;
        }
    }

    private LoadedImage load(String key) {
        return storage.call("load", store -> new LoadedImage(
                store.read(BlockStore.rawId(key)),
                store.read(BlockStore.aggregateId(key))));
    }

    private List<Sample> decode(Optional<StoredBlock> block) {
        return block.map(codec::decode).orElse(Collections.emptyList());
    }

    private List<Bucket> decodeBuckets(Optional<StoredBlock> block) {
        return block.map(codec::decodeBuckets).orElse(Collections.emptyList());
    }

    private boolean writeRaw(SeriesBuffers.Buffer buf) {
        StoredBlock block = codec.encode(buf.rawSnapshot());
        try {
            storage.run("write", store -> store.write(BlockStore.rawId(buf.key()), block));
        } catch (StorageException e) {
            writeFailures.incrementAndGet();
            healthReporter.storageFailure(buf.key(), "write", e);
            return false;
        }
        recordWrite(block);
        healthReporter.storageRecovered(buf.key(), "write");
        return true;
    }

    private void recordWrite(StoredBlock block) {
        blocksWritten.incrementAndGet();
        if (block.encoding() == BlockEncoding.COMPRESSED) {
            compressedBlocks.incrementAndGet();
            bytesSaved.addAndGet(block.rawSize() - block.storedSize());
        }
    }
}
