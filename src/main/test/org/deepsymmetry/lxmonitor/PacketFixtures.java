package org.deepsymmetry.lxmonitor;

import java.nio.charset.StandardCharsets;

/**
 * Builds raw Art-Net, sACN and Ethernet frames for tests.
 */
public final class PacketFixtures {

    private static final byte[] ART_NET_HEADER = "Art-Net\0".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ACN_IDENTIFIER = "ASC-E1.17\0\0\0".getBytes(StandardCharsets.US_ASCII);

    /**
     * A component identifier whose bytes count up from zero.
     */
    public static byte[] countingCid() {
        final byte[] cid = new byte[16];
        for (int i = 0; i < cid.length; i++) {
            cid[i] = (byte) i;
        }
        return cid;
    }

    private static byte[] artNet(int opCode, int length) {
        final byte[] packet = new byte[length];
        System.arraycopy(ART_NET_HEADER, 0, packet, 0, ART_NET_HEADER.length);
        Util.numberToBytesLittleEndian(opCode, packet, 8, 2);
        if (length >= 12) {
            Util.numberToBytes(14, packet, 10, 2);
        }
        return packet;
    }

    public static byte[] artPoll() {
        return artNet(0x2000, 14);
    }

    public static byte[] artOther(int opCode) {
        return artNet(opCode, 20);
    }

    public static byte[] artDmx(int sequence, int universe, byte[] slots) {
        final byte[] packet = artNet(0x5000, 18 + slots.length);
        packet[12] = (byte) sequence;
        packet[13] = 0;
        Util.numberToBytesLittleEndian(universe, packet, 14, 2);
        Util.numberToBytes(slots.length, packet, 16, 2);
        System.arraycopy(slots, 0, packet, 18, slots.length);
        return packet;
    }

    /**
     * Build an ArtPollReply.
     *
     * @param length the total packet length, at least 207
     */
    public static byte[] artPollReply(int length, byte[] ip, String shortName, String longName, int net, int subNet,
                                      int numPorts, int[] portTypes, int[] swOut, byte[] mac) {
        final byte[] packet = artNet(0x2100, length);
        System.arraycopy(ip, 0, packet, 10, 4);
        Util.numberToBytesLittleEndian(6454, packet, 14, 2);
        Util.numberToBytes(0x0102, packet, 16, 2);
        packet[18] = (byte) net;
        packet[19] = (byte) subNet;
        Util.numberToBytes(0x2b0a, packet, 20, 2);
        packet[23] = (byte) 0xd2;
        Util.numberToBytesLittleEndian(0x414c, packet, 24, 2);
        putString(packet, 26, 18, shortName);
        putString(packet, 44, 64, longName);
        putString(packet, 108, 64, "#0001 [0000] Power On Tests successful");
        Util.numberToBytes(numPorts, packet, 172, 2);
        for (int i = 0; i < portTypes.length; i++) {
            packet[174 + i] = (byte) portTypes[i];
            packet[190 + i] = (byte) swOut[i];
        }
        packet[200] = 0;
        System.arraycopy(mac, 0, packet, 201, 6);
        return packet;
    }

    private static void putString(byte[] packet, int start, int size, String value) {
        final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        System.arraycopy(bytes, 0, packet, start, Math.min(bytes.length, size - 1));
    }

    private static byte[] acnRoot(int length, long rootVector, byte[] cid) {
        final byte[] packet = new byte[length];
        Util.numberToBytes(0x0010, packet, 0, 2);
        System.arraycopy(ACN_IDENTIFIER, 0, packet, 4, ACN_IDENTIFIER.length);
        Util.numberToBytes(0x7000 | (length - 16), packet, 16, 2);
        Util.numberToBytes((int) rootVector, packet, 18, 4);
        System.arraycopy(cid, 0, packet, 22, 16);
        if (length >= 44) {
            Util.numberToBytes(0x7000 | (length - 38), packet, 38, 2);
        }
        return packet;
    }

    public static byte[] sacnDmx(byte[] cid, String sourceName, int priority, int sequence, int universe,
                                 int startCode, byte[] slots) {
        final byte[] packet = acnRoot(126 + slots.length, 0x4, cid);
        Util.numberToBytes(0x2, packet, 40, 4);
        putString(packet, 44, 64, sourceName);
        packet[108] = (byte) priority;
        packet[111] = (byte) sequence;
        Util.numberToBytes(universe, packet, 113, 2);
        Util.numberToBytes(0x7000 | (packet.length - 115), packet, 115, 2);
        packet[117] = 0x02;
        packet[118] = (byte) 0xa1;
        Util.numberToBytes(1, packet, 121, 2);
        Util.numberToBytes(slots.length + 1, packet, 123, 2);
        packet[125] = (byte) startCode;
        System.arraycopy(slots, 0, packet, 126, slots.length);
        return packet;
    }

    public static byte[] sacnSync(byte[] cid, int syncAddress) {
        final byte[] packet = acnRoot(115, 0x4, cid);
        Util.numberToBytes(0x1, packet, 40, 4);
        Util.numberToBytes(syncAddress, packet, 109, 2);
        return packet;
    }

    public static byte[] sacnDiscovery(byte[] cid, String sourceName, int page, int lastPage, int... universes) {
        final byte[] packet = acnRoot(120 + universes.length * 2, 0x8, cid);
        Util.numberToBytes(0x2, packet, 40, 4);
        putString(packet, 44, 64, sourceName);
        packet[118] = (byte) page;
        packet[119] = (byte) lastPage;
        for (int i = 0; i < universes.length; i++) {
            Util.numberToBytes(universes[i], packet, 120 + i * 2, 2);
        }
        return packet;
    }

    /**
     * Wrap a UDP payload in Ethernet and IPv4 headers.
     */
    public static byte[] ethernetFrame(byte[] source, byte[] destination, int sourcePort, int destinationPort,
                                       byte[] payload) {
        final byte[] frame = new byte[42 + payload.length];
        Util.numberToBytes(0x0800, frame, 12, 2);
        frame[14] = 0x45;
        Util.numberToBytes(20 + 8 + payload.length, frame, 16, 2);
        frame[22] = 64;
        frame[23] = 17;
        System.arraycopy(source, 0, frame, 26, 4);
        System.arraycopy(destination, 0, frame, 30, 4);
        Util.numberToBytes(sourcePort, frame, 34, 2);
        Util.numberToBytes(destinationPort, frame, 36, 2);
        Util.numberToBytes(8 + payload.length, frame, 38, 2);
        System.arraycopy(payload, 0, frame, 42, payload.length);
        return frame;
    }

    private PacketFixtures() {
    }
}
