package org.deepsymmetry.lxmonitor.data;

import java.util.concurrent.TimeUnit;

/**
 * Estimates packet loss from the 8-bit sequence numbers carried by DMX packets, over windows of five seconds.
 *
 * <p>The first packet of each window only establishes the baseline sequence number. Every later packet adds the
 * forward distance from the previous sequence number (modulo 256) to the count of packets expected, and one to
 * the count received. Loss is the shortfall of received against expected, as a percentage.</p>
 *
 * <p>Not thread-safe; the registry guards it.</p>
 */
class SequenceTracker {

    static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(5);

    private long windowStart;
    private int lastSequence = -1;
    private long expected;
    private long received;

    /**
     * Note the arrival of a packet.
     *
     * @param sequence its sequence number, 0 to 255
     * @param now the monotonic time of arrival
     */
    void record(int sequence, long now) {
        final int current = sequence & 0xff;
        if (lastSequence < 0 || now - windowStart >= WINDOW_NANOS) {
            windowStart = now;
            lastSequence = current;
            expected = 0;
            received = 1;
            return;
        }
        expected += (current - lastSequence) & 0xff;
        received++;
        lastSequence = current;
    }

    /**
     * Compute the loss seen in the current window.
     *
     * @return the percentage of expected packets which never arrived, between 0 and 100
     */
    double lossPercent() {
        if (expected == 0) {
            return 0.0;
        }
        final double loss = (expected - received) * 100.0 / expected;
        return Math.max(0.0, Math.min(100.0, loss));
    }

    long getExpected() {
        return expected;
    }

    long getReceived() {
        return received;
    }
}
