package io.liveprobe.core.metrics;

import io.liveprobe.core.workload.OperationKind;

import java.util.Arrays;
import java.util.EnumMap;

/**
 * Latency of recent operations, per operation kind.
 *
 * Each kind owns a ring of the last maxSamples durations plus a running
 * EWMA; p95/p99 come from a sorted copy of the ring at read time.
 */
public final class OperationLatencyTracker {

    public record Stats(double ewmaMillis, double p95Millis, double p99Millis, int sampleCount) {
        static final Stats EMPTY = new Stats(Double.NaN, Double.NaN, Double.NaN, 0);
    }

    private final double alpha;
    private final EnumMap<OperationKind, Ring> rings = new EnumMap<>(OperationKind.class);

    public OperationLatencyTracker(double alpha, int maxSamples) {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0,1], got " + alpha);
        }
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0");
        }
        this.alpha = alpha;
        for (OperationKind k : OperationKind.values()) {
            rings.put(k, new Ring(maxSamples));
        }
    }

    /** Negative durations (clock skew) are ignored. */
    public void recordSample(OperationKind kind, double millis) {
        if (millis >= 0.0) {
            rings.get(kind).add(millis, alpha);
        }
    }

    public Stats stats(OperationKind kind) {
        return rings.get(kind).stats();
    }

    /** Linear interpolation between the two closest ranks of a sorted array. */
    static double percentile(double[] sorted, double q) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double rank = q * (sorted.length - 1);
        int below = (int) rank;
        if (below + 1 >= sorted.length) {
            return sorted[sorted.length - 1];
        }
        double frac = rank - below;
        return sorted[below] + (sorted[below + 1] - sorted[below]) * frac;
    }

    // ---------- internals ----------

    private static final class Ring {
        private final double[] values;
        private long written;
        private double ewma = Double.NaN;

        Ring(int capacity) {
            this.values = new double[capacity];
        }

        synchronized void add(double millis, double alpha) {
            ewma = Double.isNaN(ewma) ? millis : ewma + alpha * (millis - ewma);
            values[(int) (written % values.length)] = millis;
            written++;
        }

        synchronized Stats stats() {
            int n = (int) Math.min(written, values.length);
            if (n == 0) {
                return Stats.EMPTY;
            }
            double[] sorted = Arrays.copyOf(values, n);
            Arrays.sort(sorted);
            return new Stats(ewma, percentile(sorted, 0.95), percentile(sorted, 0.99), n);
        }
    }
}
