package io.liveprobe.core.workload;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Weighted random choice among operation kinds.
 *
 * Precomputes the cumulative weights once and then binary-searches them for
 * every draw, the same way a CDF sampler would. A draw u in [0, total) picks
 * the first bucket whose upper bound is strictly greater than u. Kinds with
 * weight 0 are left out of the table and can never be chosen.
 *
 * Immutable and safe to share between workers; each caller brings its own Random.
 */
public final class OperationSelector {

    private final OperationMix mix;
    private final OperationKind[] kinds;
    private final double[] cumulative;
    private final double total;

    public OperationSelector(OperationMix mix) {
        this.mix = Objects.requireNonNull(mix, "mix");

        // Zero-weight kinds get no bucket at all.
        var weights = mix.weights().entrySet().stream()
                .filter(e -> e.getValue() > 0.0)
                .toList();
        this.kinds = new OperationKind[weights.size()];
        this.cumulative = new double[weights.size()];

        double running = 0.0;
        int i = 0;
        for (var e : weights) {
            running += e.getValue();
            kinds[i] = e.getKey();
            cumulative[i] = running;
            i++;
        }
        this.total = running;
    }

    /** Draw using the calling thread's ThreadLocalRandom. */
    public OperationKind select() {
        return select(ThreadLocalRandom.current());
    }

    public OperationKind select(Random rnd) {
        double u = rnd.nextDouble() * total;
        int lo = 0;
        int hi = cumulative.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u < cumulative[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return kinds[lo];
    }

    public OperationMix mix() {
        return mix;
    }
}
