package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

/**
 * Flags DMX refresh rates outside the range receivers handle comfortably.
 */
@API(status = API.Status.STABLE)
public enum FpsWarning {
    NONE(""),
    LOW("low"),
    HIGH("high");

    /**
     * Rates below this (but above zero) are flagged as low.
     */
    public static final double LOW_BELOW = 20.0;

    /**
     * Rates above this are flagged as high; DMX512 cannot refresh a full universe faster than about 44 Hz.
     */
    public static final double HIGH_ABOVE = 44.0;

    /**
     * The short text shown for the warning, empty when there is none.
     */
    public final String label;

    FpsWarning(String label) {
        this.label = label;
    }

    /**
     * Classify a measured frame rate.
     *
     * @param fps frames received in the last second
     *
     * @return the warning, if any, that applies
     */
    public static FpsWarning forRate(double fps) {
        if (fps > 0 && fps < LOW_BELOW) {
            return LOW;
        }
        if (fps > HIGH_ABOVE) {
            return HIGH;
        }
        return NONE;
    }
}
