package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.DetectorVerdict;

/**
 * One scoring strategy. Implementations are stateless: the verdict depends only on the request and config.
 * <p>
 * Scores follow one convention: with {@code ratio = measure / cutoff}, the score is {@code min(1, ratio / 2)},
 * so a detector that just fires scores 0.5 and one at twice its cut-off scores 1.
 */
public interface AnomalyDetector {

    DetectorKind kind();

    DetectorVerdict evaluate(DetectionRequest request, DetectorConfig config);

    static double score(double ratio) {
        return Math.min(1.0, Math.max(0.0, ratio / 2.0));
    }
}
