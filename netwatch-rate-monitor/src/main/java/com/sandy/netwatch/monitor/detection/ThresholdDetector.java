package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import com.sandy.netwatch.monitor.model.Sample;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;

/**
 * Fires when a single sample is above the configured maximum, or is a spike against the mean of the few
 * preceding samples. Duration rules are applied by the scheduler, not here.
 */
@Component
public class ThresholdDetector implements AnomalyDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.THRESHOLD;
    }

    @Override
    public DetectorVerdict evaluate(DetectionRequest request, DetectorConfig config) {
        double value = request.sample().value();
        EnumSet<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        double score = 0;
        StringBuilder detail = new StringBuilder();

        double max = request.maxValue();
        if (value > max) {
            types.add(AnomalyType.THRESHOLD);
            score = max > 0 ? AnomalyDetector.score(value / max) : 1.0;
            detail.append(String.format("value %.2f above max %.2f", value, max));
        }

        List<Sample> history = request.history();
        int lookback = config.getSpikeLookback();
        if (history.size() >= lookback) {
            double sum = 0;
            for (Sample s : history.subList(history.size() - lookback, history.size())) sum += s.value();
            double mean = sum / lookback;
            double cutoff = config.getSpikeSensitivity() * mean;
            if (mean > 0 && value > cutoff) {
                types.add(AnomalyType.SPIKE);
                score = Math.max(score, AnomalyDetector.score(value / cutoff));
                if (detail.length() > 0) detail.append("; ");
                detail.append(String.format("spike %.2f over %.1fx recent mean %.2f", value, config.getSpikeSensitivity(), mean));
            }
        }

        if (types.isEmpty()) {
            return DetectorVerdict.normal(kind(), "within limits");
        }
        return DetectorVerdict.anomalous(kind(), score, types, detail.toString());
    }
}
