package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

/**
 * z-score of the sample against the whole window.
 */
@Component
public class StatisticalDetector implements AnomalyDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public DetectorVerdict evaluate(DetectionRequest request, DetectorConfig config) {
        if (request.history().size() < config.getMinHistory()) {
            return DetectorVerdict.abstain(kind(), "history " + request.history().size() + " < " + config.getMinHistory());
        }
        WindowStatistics stats = WindowStatistics.of(request.history());
        double z = stats.zScore(request.sample().value(), config.getStddevFloor());
        String detail = String.format("z=%.2f mean=%.2f stddev=%.2f", z, stats.mean(), stats.stddev());
        if (Math.abs(z) <= config.getZscoreThreshold()) {
            return DetectorVerdict.normal(kind(), detail);
        }
        return DetectorVerdict.anomalous(kind(), AnomalyDetector.score(Math.abs(z) / config.getZscoreThreshold()),
                EnumSet.of(AnomalyType.STATISTICAL), detail);
    }
}
