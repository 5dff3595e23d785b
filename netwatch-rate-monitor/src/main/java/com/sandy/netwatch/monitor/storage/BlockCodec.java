package com.sandy.netwatch.monitor.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.netwatch.monitor.model.BlockEncoding;
import com.sandy.netwatch.monitor.model.Bucket;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.StoredBlock;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Serializes sample runs as JSON {@code [[ts, value], ...]} and zlib-compresses them when that pays off.
 * Aggregate blocks carry a third element, the bucket's sample count; pairs read back as a count of one.
 * <p>
 * Blocks written by the older text-list format carry a {@code RAW:} or {@code ZLIB:} prefix, or no prefix at
 * all with one {@code [t, v]} pair per line; those decode through {@link BlockEncoding#LEGACY}.
 */
@Slf4j
public class BlockCodec {

    static final byte[] RAW_MARKER = "RAW:".getBytes(StandardCharsets.US_ASCII);
    static final byte[] ZLIB_MARKER = "ZLIB:".getBytes(StandardCharsets.US_ASCII);

    private final ObjectMapper objectMapper;
    private final boolean compressionEnabled;
    private final int compressionLevel;
    private final int minCompressionSize;

    public BlockCodec(ObjectMapper objectMapper, boolean compressionEnabled, int compressionLevel, int minCompressionSize) {
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("compressionLevel must be 0..9, got " + compressionLevel);
        }
        this.objectMapper = objectMapper;
        this.compressionEnabled = compressionEnabled;
        this.compressionLevel = compressionLevel;
        this.minCompressionSize = minCompressionSize;
    }

    public StoredBlock encode(List<Sample> samples) {
        List<Object[]> points = new ArrayList<>(samples.size());
        for (Sample s : samples) {
            points.add(new Object[]{s.timestamp(), s.value()});
        }
        return pack(points);
    }

    public StoredBlock encodeBuckets(List<Bucket> buckets) {
        List<Object[]> points = new ArrayList<>(buckets.size());
        for (Bucket b : buckets) {
            points.add(new Object[]{b.timestamp(), b.value(), b.count()});
        }
        return pack(points);
    }

    private StoredBlock pack(List<Object[]> points) {
        byte[] raw = serialize(points);
        if (compressionEnabled && raw.length >= minCompressionSize) {
            byte[] compressed = deflate(raw);
            if (compressed.length < raw.length) {
                return new StoredBlock(BlockEncoding.COMPRESSED, compressed, points.size(), raw.length);
            }
            log.debug("Compression skipped, no gain: rawSize={} compressedSize={}", raw.length, compressed.length);
        }
        return new StoredBlock(BlockEncoding.RAW, raw, points.size(), raw.length);
    }

    /**
     * Decodes any block this codec or the older format produced. Never throws: an undecodable block yields an
     * empty series.
     */
    public List<Sample> decode(StoredBlock block) {
        List<Bucket> points = decodeBuckets(block);
        List<Sample> samples = new ArrayList<>(points.size());
        for (Bucket b : points) samples.add(b.toSample());
        return samples;
    }

    /** Same as {@link #decode} but keeps each point's sample count. */
    public List<Bucket> decodeBuckets(StoredBlock block) {
        if (block == null || block.payload() == null || block.payload().length == 0) {
            return Collections.emptyList();
        }
        try {
            return switch (block.encoding()) {
                case RAW -> parseJson(new String(block.payload(), StandardCharsets.UTF_8));
                case COMPRESSED -> parseJson(new String(inflate(block.payload()), StandardCharsets.UTF_8));
                case LEGACY -> decodeLegacy(block.payload());
            };
        } catch (IOException | DataFormatException | RuntimeException e) {
            log.warn("Undecodable series block encoding={} storedSize={} error={}, treating as empty", block.encoding(), block.storedSize(), e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<Bucket> decodeLegacy(byte[] payload) throws IOException, DataFormatException {
        String text;
        if (startsWith(payload, ZLIB_MARKER)) {
            text = new String(inflate(Arrays.copyOfRange(payload, ZLIB_MARKER.length, payload.length)), StandardCharsets.UTF_8);
        } else if (startsWith(payload, RAW_MARKER)) {
            text = new String(payload, RAW_MARKER.length, payload.length - RAW_MARKER.length, StandardCharsets.UTF_8);
        } else {
            text = new String(payload, StandardCharsets.UTF_8);
        }
        text = text.trim();
        if (text.isEmpty()) return Collections.emptyList();
        if (text.indexOf('\n') < 0) {
            return parseJson(text);
        }
        List<Bucket> samples = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            String l = line.trim();
            if (l.isEmpty()) continue;
            samples.addAll(parseJson(l));
        }
        return normalize(samples);
    }

    private List<Bucket> parseJson(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array but got " + (root == null ? "nothing" : root.getNodeType()));
        }
        if (root.size() == 0) return Collections.emptyList();
        List<Bucket> samples = new ArrayList<>(root.size());
        if (!root.get(0).isArray()) {
            samples.add(toPoint(root));
            return samples;
        }
        for (JsonNode point : root) {
            samples.add(toPoint(point));
        }
        return normalize(samples);
    }

    private Bucket toPoint(JsonNode point) throws IOException {
        if (!point.isArray() || point.size() < 2 || point.size() > 3) {
            throw new IOException("Expected a [timestamp, value] pair but got " + point);
        }
        JsonNode ts = point.get(0);
        JsonNode value = point.get(1);
        if (!ts.isNumber() || !(value.isNumber() || value.isTextual())) {
            throw new IOException("Non-numeric sample " + point);
        }
        long count = 1;
        if (point.size() == 3) {
            if (!point.get(2).canConvertToLong() || point.get(2).asLong() < 1) {
                throw new IOException("Invalid bucket count " + point);
            }
            count = point.get(2).asLong();
        }
        return new Bucket(ts.asLong(), value.isNumber() ? value.doubleValue() : Double.parseDouble(value.asText()), count);
    }

    /** Ascending timestamps, one sample per timestamp (the later one wins). */
    private static List<Bucket> normalize(List<Bucket> samples) {
        boolean sorted = true;
        for (int i = 1; i < samples.size(); i++) {
            if (samples.get(i).timestamp() <= samples.get(i - 1).timestamp()) {
                sorted = false;
                break;
            }
        }
        if (sorted) return samples;
        Map<Long, Bucket> byTs = new LinkedHashMap<>();
        for (Bucket s : samples) byTs.put(s.timestamp(), s);
        List<Bucket> out = new ArrayList<>(byTs.values());
        out.sort(Comparator.comparingLong(Bucket::timestamp));
        return out;
    }

    private byte[] serialize(List<Object[]> points) {
        try {
            return objectMapper.writeValueAsBytes(points);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize " + points.size() + " samples", e);
        }
    }

    private byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater(compressionLevel);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buf = new byte[4096];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] input) throws DataFormatException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 4);
            byte[] buf = new byte[4096];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated zlib stream");
                }
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) return false;
        }
        return true;
    }
}
