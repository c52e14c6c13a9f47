package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;

/**
 * A frame of DMX512 data for one universe, sent using the ArtDmx opcode.
 */
@API(status = API.Status.STABLE)
public final class ArtDmx extends ArtNetPacket {

    /**
     * The sequence number, used to detect lost or reordered packets. Zero means the sender is not sequencing.
     */
    private final int sequence;

    /**
     * The physical input port from which the data originated.
     */
    private final int physical;

    /**
     * The fifteen-bit port address, with the net in the high byte and the sub-net/universe in the low byte.
     */
    private final int universe;

    /**
     * The number of slots the sender claimed to be sending.
     */
    private final int length;

    /**
     * The slot values themselves.
     */
    private final byte[] data;

    ArtDmx(int sequence, int physical, int universe, int length, byte[] data) {
        this.sequence = sequence;
        this.physical = physical;
        this.universe = universe;
        this.length = length;
        this.data = data;
    }

    @Override
    public ArtNetOpCode getOpCode() {
        return ArtNetOpCode.OP_DMX;
    }

    /**
     * Get the packet sequence number.
     *
     * @return a value from 0 to 255; senders which do not sequence their packets always send 0
     */
    @API(status = API.Status.STABLE)
    public int getSequence() {
        return sequence;
    }

    /**
     * Get the physical input port number of the sender.
     *
     * @return the port number, for information only
     */
    @API(status = API.Status.STABLE)
    public int getPhysical() {
        return physical;
    }

    /**
     * Get the universe (port address) to which this data belongs.
     *
     * @return the fifteen-bit port address
     */
    @API(status = API.Status.STABLE)
    public int getUniverse() {
        return universe;
    }

    /**
     * Get the length field exactly as it was found in the packet, which may exceed the 512 slots we keep.
     *
     * @return the declared number of slots
     */
    @API(status = API.Status.STABLE)
    public int getLength() {
        return length;
    }

    /**
     * Get the DMX slot values carried by the packet.
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
        return "ArtDmx[universe:" + universe + ", sequence:" + sequence + ", physical:" + physical +
                ", length:" + length + "]";
    }
}
