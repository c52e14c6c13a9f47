package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.Util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Decodes the Art-Net packets we care about, and builds the one packet we send. Nothing here keeps any state, and
 * decoding never throws: anything that is not a well-formed Art-Net packet just yields {@code null}.
 */
@API(status = API.Status.STABLE)
public final class ArtNet {

    /**
     * The UDP port on which Art-Net traffic is sent and received.
     */
    @API(status = API.Status.STABLE)
    public static final int PORT = 6454;

    /**
     * The Art-Net protocol revision we claim in the packets we send.
     */
    @API(status = API.Status.STABLE)
    public static final int PROTOCOL_VERSION = 14;

    /**
     * The sequence of eight bytes which begins all Art-Net packets.
     */
    private static final byte[] HEADER = "Art-Net\0".getBytes(StandardCharsets.US_ASCII);

    /**
     * The offset at which the little-endian opcode is found.
     */
    public static final int OPCODE_OFFSET = 8;

    /**
     * Packets shorter than this can't be Art-Net.
     */
    public static final int MINIMUM_LENGTH = 12;

    /**
     * The size of the fixed part of an ArtDmx packet, which is also where the slot data begins.
     */
    public static final int DMX_HEADER_LENGTH = 18;

    /**
     * The most slots a DMX512 universe can have.
     */
    public static final int MAXIMUM_SLOTS = 512;

    /**
     * The ArtPoll flag bit asking nodes to send a new reply whenever their condition changes.
     */
    private static final byte FLAG_REPLY_ON_CHANGE = 0x02;

    /**
     * The lowest diagnostic message priority, which is all we want to hear about.
     */
    private static final byte DIAGNOSTICS_PRIORITY_LOW = 0x10;

    /**
     * Get the sequence of eight bytes which begins all Art-Net packets as a {@link ByteBuffer}.
     * Each call returns a new instance, so you don't need to worry about messing with buffer positions.
     *
     * @return a read-only {@link ByteBuffer} containing the header with which all Art-Net packets begin.
     */
    @API(status = API.Status.STABLE)
    public static ByteBuffer getHeader() {
        return ByteBuffer.wrap(HEADER).asReadOnlyBuffer();
    }

    /**
     * Try to interpret some bytes received from the network as an Art-Net packet.
     *
     * @param data the buffer holding the received bytes
     * @param length how many bytes at the start of the buffer were received
     *
     * @return the packet, or {@code null} if the bytes are too short, lack the Art-Net header, or are truncated
     *         in a way that makes the packet their opcode identifies impossible to read
     */
    @API(status = API.Status.STABLE)
    public static ArtNetPacket decode(byte[] data, int length) {
        if (length < MINIMUM_LENGTH || data.length < length) {
            return null;
        }
        if (!getHeader().equals(ByteBuffer.wrap(data, 0, HEADER.length))) {
            return null;
        }

        final int opCode = (int) Util.bytesToNumberLittleEndian(data, OPCODE_OFFSET, 2);
        switch (ArtNetOpCode.forValue(opCode)) {
            case OP_POLL:
                return new ArtPoll();

            case OP_POLL_REPLY:
                if (length < ArtPollReply.MINIMUM_LENGTH) {
                    return null;
                }
                return new ArtPollReply(data, length);

            case OP_DMX:
                return decodeDmx(data, length);

            default:
                return new ArtOther(opCode);
        }
    }

    /**
     * Convenience method to decode a complete buffer.
     *
     * @param data the bytes received
     *
     * @return the packet, or {@code null} if the bytes are not a usable Art-Net packet
     */
    @API(status = API.Status.STABLE)
    public static ArtNetPacket decode(byte[] data) {
        return decode(data, data.length);
    }

    /**
     * Interpret an ArtDmx packet.
     *
     * @param data the buffer holding the received bytes
     * @param length how many bytes at the start of the buffer were received
     *
     * @return the packet, or {@code null} if it is shorter than the header, or than the length it claims
     */
    private static ArtDmx decodeDmx(byte[] data, int length) {
        if (length < DMX_HEADER_LENGTH) {
            return null;
        }
        final int sequence = Util.unsign(data[12]);
        final int physical = Util.unsign(data[13]);
        final int universe = (int) Util.bytesToNumberLittleEndian(data, 14, 2);  // SubUni in low byte, Net in high
        final int declaredLength = (int) Util.bytesToNumber(data, 16, 2);
        final int slots = Math.min(declaredLength, MAXIMUM_SLOTS);
        if (length < DMX_HEADER_LENGTH + slots) {
            return null;
        }
        final byte[] slotData = new byte[slots];
        System.arraycopy(data, DMX_HEADER_LENGTH, slotData, 0, slots);
        return new ArtDmx(sequence, physical, universe, declaredLength, slotData);
    }

    /**
     * Combine the three parts of an Art-Net port address into the fifteen-bit universe number.
     *
     * @param net the net switch, of which seven bits are used
     * @param subNet the sub-net switch, of which four bits are used
     * @param universe the universe switch, of which four bits are used
     *
     * @return the port address
     */
    @API(status = API.Status.STABLE)
    public static int calculateUniverse(int net, int subNet, int universe) {
        return ((net & 0x7f) << 8) | ((subNet & 0x0f) << 4) | (universe & 0x0f);
    }

    /**
     * Build the ArtPoll packet we broadcast to discover nodes. It always has the same content: the header, the
     * poll opcode, our protocol version, a request for replies whenever a node's condition changes, and the
     * lowest diagnostics priority.
     *
     * @return the fourteen bytes of the poll packet
     */
    @API(status = API.Status.STABLE)
    public static byte[] encodePoll() {
        final byte[] packet = new byte[14];
        System.arraycopy(HEADER, 0, packet, 0, HEADER.length);
        Util.numberToBytesLittleEndian(ArtNetOpCode.OP_POLL.protocolValue, packet, OPCODE_OFFSET, 2);
        Util.numberToBytes(PROTOCOL_VERSION, packet, 10, 2);
        packet[12] = FLAG_REPLY_ON_CHANGE;
        packet[13] = DIAGNOSTICS_PRIORITY_LOW;
        return packet;
    }

    /**
     * Prevent instantiation.
     */
    private ArtNet() {
        // Nothing to do.
    }
}
