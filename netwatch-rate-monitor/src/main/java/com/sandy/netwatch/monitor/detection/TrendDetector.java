package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import com.sandy.netwatch.monitor.model.Sample;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Least-squares slope over the newest {@code trendWindow} points (new sample included), normalised by the
 * average step {@code (max - min) / (n - 1)} so a straight line scores 1 and noise stays near 0.
 */
@Component
public class TrendDetector implements AnomalyDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.TREND;
    }

    @Override
    public DetectorVerdict evaluate(DetectionRequest request, DetectorConfig config) {
        int n = config.getTrendWindow();
        List<Sample> history = request.history();
        if (history.size() + 1 < n) {
            return DetectorVerdict.abstain(kind(), "need " + n + " points, have " + (history.size() + 1));
        }
        List<Double> values = new ArrayList<>(n);
        for (Sample s : history.subList(history.size() - (n - 1), history.size())) values.add(s.value());
        values.add(request.sample().value());

        double trend = normalizedTrend(values);
        String detail = String.format("trend=%.3f over %d points", trend, n);
        if (Math.abs(trend) <= config.getTrendThreshold()) {
            return DetectorVerdict.normal(kind(), detail);
        }
        AnomalyType type = trend > 0 ? AnomalyType.INCREASING_TREND : AnomalyType.DECREASING_TREND;
        double ratio = config.getTrendThreshold() > 0 ? Math.abs(trend) / config.getTrendThreshold() : 2.0;
        return DetectorVerdict.anomalous(kind(), AnomalyDetector.score(ratio), EnumSet.of(type), detail);
    }

    /** In [-1, 1]; 0 for a flat series. */
    static double normalizedTrend(List<Double> values) {
        int n = values.size();
        if (n < 2) return 0;
        double xMean = (n - 1) / 2.0;
        double yMean = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            yMean += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        yMean /= n;
        double range = max - min;
        if (range == 0) return 0;
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            num += dx * (values.get(i) - yMean);
            den += dx * dx;
        }
        double slope = num / den;
        double trend = slope / (range / (n - 1));
        return Math.max(-1.0, Math.min(1.0, trend));
    }
}
