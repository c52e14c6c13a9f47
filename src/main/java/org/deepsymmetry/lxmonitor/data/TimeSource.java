package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

/**
 * Supplies the two clocks the registry needs: a monotonic one for measuring intervals between packets, and the
 * wall clock for the first and last seen times reported to callers. Tests substitute a manually advanced
 * implementation so that ageing and rate calculations can be checked without sleeping.
 */
@API(status = API.Status.STABLE)
public interface TimeSource {

    /**
     * Get the current reading of the monotonic clock.
     *
     * @return a nanosecond count with an arbitrary origin, which never goes backwards
     */
    long nanoTime();

    /**
     * Get the current wall-clock time.
     *
     * @return milliseconds since the epoch
     */
    long currentTimeMillis();

    /**
     * The time source backed by {@link System}.
     */
    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }
    };
}
