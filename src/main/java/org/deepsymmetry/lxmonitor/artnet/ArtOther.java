package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;

/**
 * A structurally valid Art-Net packet whose content we do not interpret.
 */
@API(status = API.Status.STABLE)
public final class ArtOther extends ArtNetPacket {

    /**
     * The opcode value exactly as found in the packet.
     */
    private final int rawOpCode;

    ArtOther(int rawOpCode) {
        this.rawOpCode = rawOpCode;
    }

    /**
     * Get the opcode classification, which will be {@link ArtNetOpCode#UNKNOWN} for values we can't name.
     *
     * @return the kind of packet
     */
    @Override
    public ArtNetOpCode getOpCode() {
        return ArtNetOpCode.forValue(rawOpCode);
    }

    /**
     * Get the opcode value exactly as it was found in the packet, even if we could not name it.
     *
     * @return the sixteen-bit opcode
     */
    @API(status = API.Status.STABLE)
    public int getRawOpCode() {
        return rawOpCode;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitOther(this);
    }

    @Override
    public String toString() {
        return "ArtOther[opCode:" + String.format("0x%04x", rawOpCode) + ", kind:" + getOpCode().name + "]";
    }
}
