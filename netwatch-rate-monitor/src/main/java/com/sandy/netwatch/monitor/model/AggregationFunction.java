package com.sandy.netwatch.monitor.model;

import java.util.List;

/**
 * Reduction applied to the samples of one retention bucket.
 */
public enum AggregationFunction {
    AVG {
        @Override
        public double apply(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return (existing * existingCount + incoming * incomingCount) / (existingCount + incomingCount);
        }
    },
    MAX {
        @Override
        public double apply(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return Math.max(existing, incoming);
        }
    },
    MIN {
        @Override
        public double apply(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return Math.min(existing, incoming);
        }
    },
    SUM {
        @Override
        public double apply(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).sum();
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return existing + incoming;
        }
    },
    COUNT {
        @Override
        public double apply(List<Double> values) {
            return values.size();
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return existing + incoming;
        }
    },
    FIRST {
        @Override
        public double apply(List<Double> values) {
            return values.isEmpty() ? 0 : values.get(0);
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return existing;
        }
    },
    LAST {
        @Override
        public double apply(List<Double> values) {
            return values.isEmpty() ? 0 : values.get(values.size() - 1);
        }

        @Override
        public double merge(double existing, long existingCount, double incoming, long incomingCount) {
            return incoming;
        }
    };

    /** Values arrive in timestamp order. */
    public abstract double apply(List<Double> values);

    /**
     * Folds a later partial bucket into an earlier one for the same start.
     *
     * @param existing      value already stored for the bucket
     * @param existingCount samples behind {@code existing}
     * @param incoming      reduction of samples newer than all of {@code existing}'s
     * @param incomingCount samples behind {@code incoming}
     */
    public abstract double merge(double existing, long existingCount, double incoming, long incomingCount);

    public static AggregationFunction parse(String name) {
        if (name == null) throw new IllegalArgumentException("Aggregation function must not be null");
        return valueOf(name.trim().toUpperCase());
    }
}
