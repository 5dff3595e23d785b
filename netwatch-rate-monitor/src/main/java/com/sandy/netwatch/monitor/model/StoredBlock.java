package com.sandy.netwatch.monitor.model;

/**
 * Persisted form of a contiguous run of samples.
 *
 * @param rawSize size in bytes of the uncompressed serialized form
 */
public record StoredBlock(BlockEncoding encoding, byte[] payload, int sampleCount, int rawSize) {

    public int storedSize() {
        return payload == null ? 0 : payload.length;
    }
}
