package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;

/**
 * A frame of DMX512 data for one universe, carried by an E1.31 data packet.
 */
@API(status = API.Status.STABLE)
public final class SacnDmx extends SacnPacket {

    private final SacnSource source;

    /**
     * The DMX start code. Since packets with any other start code are classified as {@link SacnUnknown}, this is
     * always zero, but we keep it so the frame can be described completely.
     */
    private final int startCode;

    private final byte[] data;

    SacnDmx(SacnSource source, int startCode, byte[] data) {
        this.source = source;
        this.startCode = startCode;
        this.data = data;
    }

    /**
     * Get the description of the sender and of the universe being sent.
     *
     * @return the framing layer details
     */
    @API(status = API.Status.STABLE)
    public SacnSource getSource() {
        return source;
    }

    @API(status = API.Status.STABLE)
    public int getStartCode() {
        return startCode;
    }

    /**
     * Get the DMX slot values carried by the packet, not including the start code.
     *
     * @return a copy of the data, at most 512 bytes long
     */
    @API(status = API.Status.STABLE)
    public byte[] getData() {
        return data.clone();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDmx(this);
    }

    @Override
    public String toString() {
        return "SacnDmx[source:" + source + ", startCode:" + startCode + ", slots:" + data.length + "]";
    }
}
