package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes streaming ACN (ANSI E1.31) packets, and computes the multicast groups on which universes are sent.
 * Nothing here keeps any state, and decoding never throws: anything that is not a well-formed ACN packet yields
 * {@code null}, and ACN packets we do not interpret yield {@link SacnUnknown}.
 */
@API(status = API.Status.STABLE)
public final class Sacn {

    private static final Logger logger = LoggerFactory.getLogger(Sacn.class);

    /**
     * The UDP port on which sACN traffic is sent.
     */
    @API(status = API.Status.STABLE)
    public static final int PORT = 5568;

    /**
     * The twelve bytes which identify an ACN packet, "ASC-E1.17" padded with zeros, found at offset 4.
     */
    private static final byte[] ACN_PACKET_IDENTIFIER = {
            0x41, 0x53, 0x43, 0x2d, 0x45, 0x31, 0x2e, 0x31, 0x37, 0x00, 0x00, 0x00
    };

    private static final int IDENTIFIER_OFFSET = 4;

    /**
     * The size of the root layer, which is as short as a packet we will consider can be.
     */
    public static final int MINIMUM_LENGTH = 38;

    private static final int PREAMBLE_SIZE = 0x0010;
    private static final int POSTAMBLE_SIZE = 0x0000;

    private static final int ROOT_VECTOR_OFFSET = 18;
    private static final int CID_OFFSET = 22;
    private static final int FRAMING_VECTOR_OFFSET = 40;
    private static final int SOURCE_NAME_OFFSET = 44;
    private static final int SOURCE_NAME_LENGTH = 64;

    /**
     * Root layer vector identifying a data packet.
     */
    public static final long VECTOR_ROOT_E131_DATA = 0x00000004;

    /**
     * Root layer vector identifying an extended (synchronization or discovery) packet.
     */
    public static final long VECTOR_ROOT_E131_EXTENDED = 0x00000008;

    /**
     * Framing layer vector of a synchronization packet.
     */
    public static final long VECTOR_E131_EXTENDED_SYNCHRONIZATION = 0x00000001;

    /**
     * Framing layer vector of a universe discovery packet.
     */
    public static final long VECTOR_E131_EXTENDED_DISCOVERY = 0x00000002;

    /**
     * DMP layer vector for setting property values, the only one used to carry DMX data.
     */
    public static final int VECTOR_DMP_SET_PROPERTY = 0x02;

    /**
     * Data packets must be at least this long to contain the framing layer.
     */
    private static final int FRAMING_LAYER_END = 115;

    /**
     * Data packets must be at least this long to contain the DMP layer through the start code.
     */
    private static final int DMP_LAYER_END = 126;

    /**
     * Extended packets must be at least this long to be discovery packets.
     */
    private static final int DISCOVERY_LAYER_END = 120;

    /**
     * The most slots a DMX512 universe can have.
     */
    public static final int MAXIMUM_SLOTS = 512;

    /**
     * Get the twelve byte ACN packet identifier as a {@link ByteBuffer}.
     * Each call returns a new instance, so you don't need to worry about messing with buffer positions.
     *
     * @return a read-only {@link ByteBuffer} containing the identifier
     */
    @API(status = API.Status.STABLE)
    public static ByteBuffer getPacketIdentifier() {
        return ByteBuffer.wrap(ACN_PACKET_IDENTIFIER).asReadOnlyBuffer();
    }

    /**
     * Try to interpret some bytes received from the network as an sACN packet.
     *
     * @param data the buffer holding the received bytes
     * @param length how many bytes at the start of the buffer were received
     *
     * @return the packet, or {@code null} if the bytes are not an ACN packet or are too short for the kind of
     *         packet their vectors announce
     */
    @API(status = API.Status.STABLE)
    public static SacnPacket decode(byte[] data, int length) {
        if (length < MINIMUM_LENGTH || data.length < length) {
            return null;
        }
        if (!getPacketIdentifier().equals(ByteBuffer.wrap(data, IDENTIFIER_OFFSET, ACN_PACKET_IDENTIFIER.length))) {
            return null;
        }
        if (Util.bytesToNumber(data, 0, 2) != PREAMBLE_SIZE || Util.bytesToNumber(data, 2, 2) != POSTAMBLE_SIZE) {
            return null;
        }

        final byte[] cid = new byte[16];
        System.arraycopy(data, CID_OFFSET, cid, 0, cid.length);

        final long rootVector = Util.bytesToNumber(data, ROOT_VECTOR_OFFSET, 4);
        if (rootVector == VECTOR_ROOT_E131_DATA) {
            return decodeData(data, length, cid);
        } else if (rootVector == VECTOR_ROOT_E131_EXTENDED) {
            return decodeExtended(data, length, cid);
        }
        return SacnUnknown.INSTANCE;
    }

    /**
     * Convenience method to decode a complete buffer.
     *
     * @param data the bytes received
     *
     * @return the packet, or {@code null} if the bytes are not a usable sACN packet
     */
    @API(status = API.Status.STABLE)
    public static SacnPacket decode(byte[] data) {
        return decode(data, data.length);
    }

    /**
     * Interpret a packet whose root vector marks it as E1.31 data: either DMX data or a synchronization packet.
     */
    private static SacnPacket decodeData(byte[] data, int length, byte[] cid) {
        if (length < FRAMING_LAYER_END) {
            return null;
        }
        final long framingVector = Util.bytesToNumber(data, FRAMING_VECTOR_OFFSET, 4);
        final String sourceName = Util.extractString(data, SOURCE_NAME_OFFSET, SOURCE_NAME_LENGTH);
        final int priority = Util.unsign(data[108]);
        final int syncAddress = (int) Util.bytesToNumber(data, 109, 2);
        final int sequence = Util.unsign(data[111]);
        final int options = Util.unsign(data[112]);
        final int universe = (int) Util.bytesToNumber(data, 113, 2);

        if (framingVector == VECTOR_E131_EXTENDED_SYNCHRONIZATION) {
            return new SacnSync(syncAddress);
        }

        if (length < DMP_LAYER_END) {
            return null;
        }
        if (Util.unsign(data[117]) != VECTOR_DMP_SET_PROPERTY) {
            return SacnUnknown.INSTANCE;
        }
        final int propertyCount = (int) Util.bytesToNumber(data, 123, 2);
        final int startCode = Util.unsign(data[125]);
        if (startCode != 0) {
            // Alternate start codes (text, system information, per-address priority) are not levels.
            logger.debug("Ignoring sACN packet with non-zero start code {} (priority {}, universe {})",
                    startCode, priority, universe);
            return SacnUnknown.INSTANCE;
        }

        final int slots = Math.min(Math.min(Math.max(propertyCount - 1, 0), MAXIMUM_SLOTS), length - DMP_LAYER_END);
        final byte[] slotData = new byte[slots];
        System.arraycopy(data, DMP_LAYER_END, slotData, 0, slots);

        final SacnSource source = new SacnSource(cid, sourceName, priority, syncAddress, sequence, options, universe);
        return new SacnDmx(source, startCode, slotData);
    }

    /**
     * Interpret a packet whose root vector marks it as an extended packet. We only understand universe discovery.
     */
    private static SacnPacket decodeExtended(byte[] data, int length, byte[] cid) {
        if (length < DISCOVERY_LAYER_END) {
            return null;
        }
        final long framingVector = Util.bytesToNumber(data, FRAMING_VECTOR_OFFSET, 4);
        if (framingVector != VECTOR_E131_EXTENDED_DISCOVERY) {
            return SacnUnknown.INSTANCE;
        }
        final String sourceName = Util.extractString(data, SOURCE_NAME_OFFSET, SOURCE_NAME_LENGTH);
        final int page = Util.unsign(data[118]);
        final int lastPage = Util.unsign(data[119]);

        final List<Integer> universes = new ArrayList<>();
        for (int offset = DISCOVERY_LAYER_END; offset + 1 < length; offset += 2) {
            final int universe = (int) Util.bytesToNumber(data, offset, 2);
            if (universe != 0) {
                universes.add(universe);
            }
        }
        return new SacnDiscovery(cid, sourceName, page, lastPage, universes);
    }

    /**
     * Calculate the multicast group to which data for a universe is sent: 239.255 followed by the high and low
     * bytes of the universe number.
     *
     * @param universe the universe of interest
     *
     * @return the address of its multicast group
     */
    @API(status = API.Status.STABLE)
    public static InetAddress multicastAddress(int universe) {
        final byte[] raw = {(byte) 239, (byte) 255, (byte) ((universe >> 8) & 0xff), (byte) (universe & 0xff)};
        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Four-byte address was rejected", e);
        }
    }

    /**
     * Format a component identifier the way UUIDs are written.
     *
     * @param cid the sixteen bytes of the identifier
     *
     * @return the dashed, lower-case hexadecimal form, like {@code 00010203-0405-0607-0809-0a0b0c0d0e0f}
     */
    @API(status = API.Status.STABLE)
    public static String cidToString(byte[] cid) {
        if (cid.length != 16) {
            throw new IllegalArgumentException("CID must be 16 bytes long");
        }
        final StringBuilder sb = new StringBuilder(36);
        for (int i = 0; i < cid.length; i++) {
            if (i == 4 || i == 6 || i == 8 || i == 10) {
                sb.append('-');
            }
            sb.append(String.format("%02x", Util.unsign(cid[i])));
        }
        return sb.toString();
    }

    /**
     * Check whether a component identifier is all zero, which is how we mark sources that were only seen receiving.
     *
     * @param cid the sixteen bytes of the identifier
     *
     * @return {@code true} if every byte is zero
     */
    @API(status = API.Status.STABLE)
    public static boolean isZeroCid(byte[] cid) {
        for (byte b : cid) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Prevent instantiation.
     */
    private Sacn() {
        // Nothing to do.
    }
}
