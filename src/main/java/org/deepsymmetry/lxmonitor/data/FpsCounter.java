package org.deepsymmetry.lxmonitor.data;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Counts packet arrivals within a trailing one second window. Not thread-safe; the registry guards it.
 */
class FpsCounter {

    /**
     * How far back arrivals are counted.
     */
    static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    /**
     * Monotonic arrival times, oldest first.
     */
    private final Deque<Long> arrivals = new ArrayDeque<>();

    /**
     * Note the arrival of a packet.
     *
     * @param now the monotonic time of arrival
     */
    void record(long now) {
        arrivals.addLast(now);
        prune(now);
    }

    /**
     * Find the current frame rate.
     *
     * @param now the current monotonic time
     *
     * @return how many packets arrived during the second before {@code now}
     */
    double fps(long now) {
        prune(now);
        return arrivals.size();
    }

    private void prune(long now) {
        while (!arrivals.isEmpty() && now - arrivals.peekFirst() > WINDOW_NANOS) {
            arrivals.removeFirst();
        }
    }
}
