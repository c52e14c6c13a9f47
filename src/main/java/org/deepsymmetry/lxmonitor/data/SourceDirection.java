package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

/**
 * Whether a source has been seen transmitting DMX data, being sent data, or both. Knowledge only accumulates:
 * once a direction is known it is never forgotten, and a source seen both ways stays {@link #BOTH}.
 */
@API(status = API.Status.STABLE)
public enum SourceDirection {
    UNKNOWN,
    SENDING,
    RECEIVING,
    BOTH;

    /**
     * Combine what we knew about a source with a new observation.
     *
     * @param observed the direction implied by the packet just seen
     *
     * @return the direction to record, which is never less informed than this one
     */
    public SourceDirection escalate(SourceDirection observed) {
        if (observed == null || observed == UNKNOWN || observed == this) {
            return this;
        }
        if (this == UNKNOWN) {
            return observed;
        }
        return BOTH;
    }
}
