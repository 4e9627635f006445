package io.liveprobe.core.metrics;

import io.liveprobe.core.workload.OperationKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationLatencyTrackerTest {

    @Test
    void quantilesIncreaseWithHigherLatencies() {
        OperationLatencyTracker tracker = new OperationLatencyTracker(0.3, 256);

        double[] samplesMs = {5, 10, 15, 20, 25, 30, 40, 50, 60, 80, 100};
        for (double s : samplesMs) {
            tracker.recordSample(OperationKind.FIND, s);
        }

        OperationLatencyTracker.Stats stats = tracker.stats(OperationKind.FIND);
        assertEquals(samplesMs.length, stats.sampleCount());
        assertTrue(stats.p95Millis() >= 80 && stats.p95Millis() <= 100, "p95 should sit near the tail");
        assertTrue(stats.p99Millis() >= stats.p95Millis(), "p99 should be >= p95");
        assertTrue(stats.ewmaMillis() > 5 && stats.ewmaMillis() < 100);
    }

    @Test
    void kindsAreTrackedSeparately() {
        OperationLatencyTracker tracker = new OperationLatencyTracker(0.3, 256);
        tracker.recordSample(OperationKind.INSERT, 12.0);

        assertEquals(1, tracker.stats(OperationKind.INSERT).sampleCount());
        assertTrue(Double.isNaN(tracker.stats(OperationKind.UPDATE).p95Millis()));
        assertEquals(0, tracker.stats(OperationKind.FIND).sampleCount());
    }

    @Test
    void windowKeepsOnlyTheMostRecentSamples() {
        OperationLatencyTracker tracker = new OperationLatencyTracker(1.0, 4);
        for (int i = 0; i < 10; i++) {
            tracker.recordSample(OperationKind.FIND, 1000.0);
        }
        for (int i = 0; i < 4; i++) {
            tracker.recordSample(OperationKind.FIND, 2.0);
        }

        OperationLatencyTracker.Stats stats = tracker.stats(OperationKind.FIND);
        assertEquals(4, stats.sampleCount());
        assertEquals(2.0, stats.p99Millis(), 1e-9);
        assertEquals(2.0, stats.ewmaMillis(), 1e-9);
    }

    @Test
    void negativeDurationsAreIgnored() {
        OperationLatencyTracker tracker = new OperationLatencyTracker(0.5, 8);
        tracker.recordSample(OperationKind.UPDATE, -3.0);
        assertEquals(0, tracker.stats(OperationKind.UPDATE).sampleCount());
    }

    @Test
    void percentileInterpolatesBetweenRanks() {
        assertEquals(5.5, OperationLatencyTracker.percentile(new double[]{1, 10}, 0.5), 1e-9);
        assertEquals(10.0, OperationLatencyTracker.percentile(new double[]{1, 10}, 1.0), 1e-9);
        assertEquals(7.0, OperationLatencyTracker.percentile(new double[]{7}, 0.99), 1e-9);
        assertTrue(Double.isNaN(OperationLatencyTracker.percentile(new double[0], 0.5)));
    }
}
