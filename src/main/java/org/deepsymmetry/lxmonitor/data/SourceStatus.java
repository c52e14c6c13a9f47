package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

/**
 * How recently a source has been heard from.
 */
@API(status = API.Status.STABLE)
public enum SourceStatus {

    /**
     * A packet arrived less than three seconds ago.
     */
    ACTIVE,

    /**
     * Silent for at least three seconds, but less than ten.
     */
    IDLE,

    /**
     * Silent for ten seconds or more. Sources are forgotten entirely after a minute.
     */
    STALE;

    /**
     * Milliseconds of silence after which a source stops being active.
     */
    public static final long IDLE_AFTER = 3000;

    /**
     * Milliseconds of silence after which a source is considered stale.
     */
    public static final long STALE_AFTER = 10000;

    /**
     * Milliseconds of silence after which a source is removed from the registry.
     */
    public static final long EVICT_AFTER = 60000;

    /**
     * Determine the status of a source given how long it has been silent.
     *
     * @param elapsedMillis milliseconds since its last packet
     *
     * @return the corresponding status
     */
    public static SourceStatus forElapsed(long elapsedMillis) {
        if (elapsedMillis < IDLE_AFTER) {
            return ACTIVE;
        }
        if (elapsedMillis < STALE_AFTER) {
            return IDLE;
        }
        return STALE;
    }
}
