package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;

/**
 * A discovery request sent by a controller. We never answer these, since we only monitor the network, but we
 * recognize them (including the ones we broadcast ourselves).
 */
@API(status = API.Status.STABLE)
public final class ArtPoll extends ArtNetPacket {

    ArtPoll() {
    }

    @Override
    public ArtNetOpCode getOpCode() {
        return ArtNetOpCode.OP_POLL;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitPoll(this);
    }

    @Override
    public String toString() {
        return "ArtPoll[]";
    }
}
