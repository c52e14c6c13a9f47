package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;

/**
 * A structurally valid ACN packet which we do not interpret. This includes data packets with a non-zero start
 * code, which some consoles interleave with their dimmer data; treating those as frames makes the monitored
 * levels flicker.
 */
@API(status = API.Status.STABLE)
public final class SacnUnknown extends SacnPacket {

    /**
     * There is nothing to distinguish one unknown packet from another, so a single instance suffices.
     */
    static final SacnUnknown INSTANCE = new SacnUnknown();

    private SacnUnknown() {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitUnknown(this);
    }

    @Override
    public String toString() {
        return "SacnUnknown[]";
    }
}
