package io.liveprobe.core.workload;

import io.liveprobe.core.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configured relative frequency of each operation kind.
 *
 * Weights are non-negative and need not sum to 100; they are normalized to
 * probabilities once, here, and never again on the draw path. At least one
 * weight must be positive.
 */
public final class OperationMix {

    public static final String DEFAULT_MIX = "find=70,insert=20,update=10";

    private final Map<OperationKind, Double> weights;
    private final Map<OperationKind, Double> probabilities;
    private final double totalWeight;

    public OperationMix(Map<OperationKind, ? extends Number> weights) {
        Objects.requireNonNull(weights, "weights");
        EnumMap<OperationKind, Double> w = new EnumMap<>(OperationKind.class);
        double total = 0.0;
        for (var e : weights.entrySet()) {
            OperationKind kind = Objects.requireNonNull(e.getKey(), "operation kind");
            double value = Objects.requireNonNull(e.getValue(), "weight for " + kind).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
                throw new ConfigurationException("weight for " + kind.wireName() + " must be a finite value >= 0, got " + value);
            }
            w.put(kind, value);
            total += value;
        }
        if (!(total > 0.0)) {
            throw new ConfigurationException("operation mix must contain at least one weight > 0: " + weights);
        }

        EnumMap<OperationKind, Double> p = new EnumMap<>(OperationKind.class);
        for (var e : w.entrySet()) {
            p.put(e.getKey(), e.getValue() / total);
        }
        this.weights = Collections.unmodifiableMap(w);
        this.probabilities = Collections.unmodifiableMap(p);
        this.totalWeight = total;
    }

    /**
     * Parse "find=70,insert=20,update=10".
     *
     * Whitespace around pairs is ignored; empty segments are skipped. Unknown
     * kinds, missing '=', non-numeric weights and duplicate kinds are rejected.
     */
    public static OperationMix parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("operation mix must not be empty");
        }
        EnumMap<OperationKind, Double> parsed = new EnumMap<>(OperationKind.class);
        for (String raw : text.split(",")) {
            String pair = raw.trim();
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new ConfigurationException("malformed operation mix entry '" + pair + "', expected kind=weight");
            }
            OperationKind kind = OperationKind.fromName(pair.substring(0, eq));
            double weight;
            try {
                weight = Double.parseDouble(pair.substring(eq + 1).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("invalid weight in operation mix entry '" + pair + "'", e);
            }
            if (parsed.put(kind, weight) != null) {
                throw new ConfigurationException("duplicate operation kind in mix: " + kind.wireName());
            }
        }
        return new OperationMix(parsed);
    }

    public static OperationMix defaults() {
        return parse(DEFAULT_MIX);
    }

    /** Raw configured weights (kinds not configured are absent). */
    public Map<OperationKind, Double> weights() {
        return weights;
    }

    /** Normalized probabilities, summing to 1. */
    public Map<OperationKind, Double> probabilities() {
        return probabilities;
    }

    public double probability(OperationKind kind) {
        return probabilities.getOrDefault(kind, 0.0);
    }

    public double totalWeight() {
        return totalWeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperationMix other)) return false;
        return probabilities.equals(other.probabilities);
    }

    @Override
    public int hashCode() {
        return probabilities.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (var e : weights.entrySet()) {
            if (sb.length() > 0) sb.append(',');
            sb.append(e.getKey().wireName()).append('=').append(e.getValue());
        }
        return sb.toString();
    }
}
