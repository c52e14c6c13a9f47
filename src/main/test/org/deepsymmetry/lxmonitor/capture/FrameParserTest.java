package org.deepsymmetry.lxmonitor.capture;

import org.deepsymmetry.lxmonitor.PacketFixtures;
import org.junit.Test;

import static org.junit.Assert.*;

public class FrameParserTest {

    private static final byte[] SOURCE = {10, 0, 0, 1};
    private static final byte[] DESTINATION = {10, 0, 0, 50};

    @Test
    public void extractsDatagram() {
        final byte[] payload = {1, 2, 3, 4, 5};
        final UdpDatagram datagram = FrameParser.parse(
                PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 6454, 6454, payload));
        assertNotNull(datagram);
        assertEquals("10.0.0.1", datagram.getSourceAddress().getHostAddress());
        assertEquals("10.0.0.50", datagram.getDestinationAddress().getHostAddress());
        assertEquals(6454, datagram.getSourcePort());
        assertEquals(6454, datagram.getDestinationPort());
        assertArrayEquals(payload, datagram.getPayload());
    }

    @Test
    public void dropsShortFrames() {
        final byte[] frame = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 5568, 5568, new byte[0]);
        assertNotNull(FrameParser.parse(frame));
        assertNull(FrameParser.parse(frame, 41));
    }

    @Test
    public void dropsNonIpv4EtherTypes() {
        final byte[] frame = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 5568, 5568, new byte[4]);
        frame[12] = (byte) 0x86;
        frame[13] = (byte) 0xdd;
        assertNull(FrameParser.parse(frame));
    }

    @Test
    public void dropsOtherIpVersionsAndProtocols() {
        final byte[] frame = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 5568, 5568, new byte[4]);
        frame[14] = 0x65;
        assertNull(FrameParser.parse(frame));

        final byte[] tcp = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 5568, 5568, new byte[4]);
        tcp[23] = 6;
        assertNull(FrameParser.parse(tcp));
    }

    @Test
    public void dropsImpossibleHeaderLength() {
        final byte[] frame = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 5568, 5568, new byte[4]);
        frame[14] = 0x44;
        assertNull(FrameParser.parse(frame));
    }

    @Test
    public void honoursIpOptions() {
        final byte[] plain = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 1234, 5568, new byte[] {9, 8});
        final byte[] frame = new byte[plain.length + 4];
        System.arraycopy(plain, 0, frame, 0, 34);
        System.arraycopy(plain, 34, frame, 38, plain.length - 34);
        frame[14] = 0x46;
        final UdpDatagram datagram = FrameParser.parse(frame);
        assertEquals(1234, datagram.getSourcePort());
        assertArrayEquals(new byte[] {9, 8}, datagram.getPayload());
    }

    @Test
    public void ignoresEthernetPadding() {
        final byte[] plain = PacketFixtures.ethernetFrame(SOURCE, DESTINATION, 5568, 5568, new byte[] {7});
        final byte[] padded = new byte[60];
        System.arraycopy(plain, 0, padded, 0, plain.length);
        assertArrayEquals(new byte[] {7}, FrameParser.parse(padded).getPayload());
    }
}
