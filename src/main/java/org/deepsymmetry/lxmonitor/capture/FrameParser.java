package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.Util;

import java.net.InetAddress;

/**
 * Digs UDP datagrams out of captured Ethernet frames carrying IPv4. Anything else, and anything truncated, is
 * quietly ignored.
 */
@API(status = API.Status.STABLE)
public final class FrameParser {

    private static final int ETHERNET_HEADER_LENGTH = 14;
    private static final int ETHER_TYPE_OFFSET = 12;
    private static final int ETHER_TYPE_IPV4 = 0x0800;
    private static final int MINIMUM_IP_HEADER_LENGTH = 20;
    private static final int PROTOCOL_UDP = 17;
    private static final int UDP_HEADER_LENGTH = 8;

    /**
     * The shortest frame which can hold Ethernet, minimal IPv4 and UDP headers.
     */
    @API(status = API.Status.STABLE)
    public static final int MINIMUM_FRAME_LENGTH = ETHERNET_HEADER_LENGTH + MINIMUM_IP_HEADER_LENGTH + UDP_HEADER_LENGTH;

    /**
     * Extract the UDP datagram from a captured frame.
     *
     * @param frame the captured bytes, starting with the Ethernet header
     * @param length how many bytes of the array were captured
     *
     * @return the datagram, or {@code null} if the frame is not a complete IPv4 UDP frame
     */
    @API(status = API.Status.STABLE)
    public static UdpDatagram parse(byte[] frame, int length) {
        if (length < MINIMUM_FRAME_LENGTH || frame.length < length) {
            return null;
        }
        if (Util.bytesToNumber(frame, ETHER_TYPE_OFFSET, 2) != ETHER_TYPE_IPV4) {
            return null;
        }

        final int ip = ETHERNET_HEADER_LENGTH;
        final int versionAndLength = Util.unsign(frame[ip]);
        if ((versionAndLength >> 4) != 4) {
            return null;
        }
        final int ipHeaderLength = (versionAndLength & 0x0f) * 4;
        if (ipHeaderLength < MINIMUM_IP_HEADER_LENGTH) {
            return null;
        }
        if (Util.unsign(frame[ip + 9]) != PROTOCOL_UDP) {
            return null;
        }
        final int udp = ip + ipHeaderLength;
        if (udp + UDP_HEADER_LENGTH > length) {
            return null;
        }

        final InetAddress source = Util.addressFromBytes(frame, ip + 12);
        final InetAddress destination = Util.addressFromBytes(frame, ip + 16);
        final int sourcePort = (int) Util.bytesToNumber(frame, udp, 2);
        final int destinationPort = (int) Util.bytesToNumber(frame, udp + 2, 2);

        final int payloadStart = udp + UDP_HEADER_LENGTH;
        int payloadLength = length - payloadStart;
        final int udpLength = (int) Util.bytesToNumber(frame, udp + 4, 2);
        if (udpLength >= UDP_HEADER_LENGTH && udpLength - UDP_HEADER_LENGTH < payloadLength) {
            payloadLength = udpLength - UDP_HEADER_LENGTH;  // Short frames are padded to the Ethernet minimum.
        }
        final byte[] payload = new byte[payloadLength];
        System.arraycopy(frame, payloadStart, payload, 0, payload.length);
        return new UdpDatagram(source, destination, sourcePort, destinationPort, payload);
    }

    /**
     * Convenience method to parse a complete frame.
     *
     * @param frame the captured bytes
     *
     * @return the datagram, or {@code null} if there is none
     */
    @API(status = API.Status.STABLE)
    public static UdpDatagram parse(byte[] frame) {
        return parse(frame, frame.length);
    }

    private FrameParser() {
        // Prevent instantiation.
    }
}
