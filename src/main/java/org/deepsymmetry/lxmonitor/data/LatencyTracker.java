package org.deepsymmetry.lxmonitor.data;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Measures how irregularly packets arrive, as the population standard deviation of the most recent intervals
 * between them. Not thread-safe; the registry guards it.
 */
class LatencyTracker {

    /**
     * The number of intervals kept.
     */
    static final int CAPACITY = 100;

    private final Deque<Double> intervals = new ArrayDeque<>(CAPACITY);
    private long lastArrival;
    private boolean seen;

    /**
     * Note the arrival of a packet.
     *
     * @param now the monotonic time of arrival, in nanoseconds
     */
    void record(long now) {
        if (seen) {
            if (intervals.size() == CAPACITY) {
                intervals.removeFirst();
            }
            intervals.addLast((now - lastArrival) / 1_000_000.0);
        }
        lastArrival = now;
        seen = true;
    }

    /**
     * Compute the jitter of the recorded intervals.
     *
     * @return the standard deviation in milliseconds, or zero when fewer than two intervals are known
     */
    double jitterMillis() {
        final int count = intervals.size();
        if (count < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (double interval : intervals) {
            sum += interval;
        }
        final double mean = sum / count;
        double squares = 0.0;
        for (double interval : intervals) {
            final double deviation = interval - mean;
            squares += deviation * deviation;
        }
        return Math.sqrt(squares / count);
    }
}
