package com.sandy.netwatch.monitor.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of one detector for one sample. An abstaining detector is never anomalous.
 */
public record DetectorVerdict(DetectorKind kind,
                              boolean anomalous,
                              double score,
                              Set<AnomalyType> types,
                              String detail) {

    public static DetectorVerdict abstain(DetectorKind kind, String reason) {
        return new DetectorVerdict(kind, false, 0.0, Collections.emptySet(), reason);
    }

    public static DetectorVerdict normal(DetectorKind kind, String detail) {
        return new DetectorVerdict(kind, false, 0.0, Collections.emptySet(), detail);
    }

    public static DetectorVerdict anomalous(DetectorKind kind, double score, Set<AnomalyType> types, String detail) {
        return new DetectorVerdict(kind, true, Math.min(1.0, Math.max(0.0, score)), Collections.unmodifiableSet(EnumSet.copyOf(types)), detail);
    }
}
