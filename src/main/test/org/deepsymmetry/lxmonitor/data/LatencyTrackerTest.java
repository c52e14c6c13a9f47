package org.deepsymmetry.lxmonitor.data;

import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class LatencyTrackerTest {

    private static final long MS = TimeUnit.MILLISECONDS.toNanos(1);

    @Test
    public void noJitterWithFewerThanTwoIntervals() {
        final LatencyTracker tracker = new LatencyTracker();
        assertEquals(0.0, tracker.jitterMillis(), 0.0);
        tracker.record(0);
        tracker.record(25 * MS);
        assertEquals(0.0, tracker.jitterMillis(), 0.0);
    }

    @Test
    public void steadyArrivalsHaveNoJitter() {
        final LatencyTracker tracker = new LatencyTracker();
        for (int i = 0; i < 10; i++) {
            tracker.record(i * 25 * MS);
        }
        assertEquals(0.0, tracker.jitterMillis(), 1e-9);
    }

    @Test
    public void measuresPopulationStandardDeviation() {
        final LatencyTracker tracker = new LatencyTracker();
        tracker.record(0);
        tracker.record(20 * MS);
        tracker.record(50 * MS);
        // Intervals of 20 and 30 milliseconds.
        assertEquals(5.0, tracker.jitterMillis(), 1e-9);
    }

    @Test
    public void keepsOnlyRecentIntervals() {
        final LatencyTracker tracker = new LatencyTracker();
        long now = 0;
        tracker.record(now);
        for (int i = 0; i < 50; i++) {
            now += (i % 2 == 0) ? 10 * MS : 40 * MS;
            tracker.record(now);
        }
        assertTrue(tracker.jitterMillis() > 10.0);
        for (int i = 0; i < LatencyTracker.CAPACITY; i++) {
            now += 25 * MS;
            tracker.record(now);
        }
        assertEquals(0.0, tracker.jitterMillis(), 1e-9);
    }
}
