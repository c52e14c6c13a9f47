package org.deepsymmetry.lxmonitor.artnet;

import org.deepsymmetry.lxmonitor.PacketFixtures;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class ArtNetTest {

    private static final byte[] NODE_IP = {10, 0, 0, 7};
    private static final byte[] MAC = {0x00, 0x1a, 0x2b, 0x3c, 0x4d, 0x5e};

    @Test
    public void rejectsShortOrForeignPackets() {
        assertNull(ArtNet.decode(new byte[11]));
        final byte[] poll = PacketFixtures.artPoll();
        poll[0] = 'X';
        assertNull(ArtNet.decode(poll));
    }

    @Test
    public void decodesPoll() {
        final ArtNetPacket packet = ArtNet.decode(PacketFixtures.artPoll());
        assertTrue(packet instanceof ArtPoll);
        assertEquals(ArtNetOpCode.OP_POLL, packet.getOpCode());
    }

    @Test
    public void unknownOpCodeKeepsRawValue() {
        final ArtNetPacket packet = ArtNet.decode(PacketFixtures.artOther(0x1234));
        assertTrue(packet instanceof ArtOther);
        assertEquals(0x1234, ((ArtOther) packet).getRawOpCode());
        assertEquals(ArtNetOpCode.UNKNOWN, packet.getOpCode());
    }

    @Test
    public void knownButUninterpretedOpCodeIsOther() {
        final ArtNetPacket packet = ArtNet.decode(PacketFixtures.artOther(0x5200));
        assertTrue(packet instanceof ArtOther);
        assertEquals(ArtNetOpCode.OP_SYNC, packet.getOpCode());
    }

    @Test
    public void decodesDmx() {
        final byte[] slots = {1, 2, 3, (byte) 255};
        final ArtNetPacket packet = ArtNet.decode(PacketFixtures.artDmx(42, 0x0123, slots));
        assertTrue(packet instanceof ArtDmx);
        final ArtDmx dmx = (ArtDmx) packet;
        assertEquals(42, dmx.getSequence());
        assertEquals(0x0123, dmx.getUniverse());
        assertEquals(4, dmx.getLength());
        assertArrayEquals(slots, dmx.getData());
    }

    @Test
    public void dmxUniverseUsesHighByteForNet() {
        final byte[] raw = PacketFixtures.artDmx(0, 0, new byte[2]);
        raw[14] = 0x05;
        raw[15] = 0x01;
        assertEquals(0x0105, ((ArtDmx) ArtNet.decode(raw)).getUniverse());
    }

    @Test
    public void truncatedDmxIsRejected() {
        final byte[] raw = PacketFixtures.artDmx(1, 1, new byte[10]);
        assertNull(ArtNet.decode(raw, raw.length - 1));
        assertNull(ArtNet.decode(raw, 17));
    }

    @Test
    public void dmxPayloadIsCappedAt512Slots() {
        final byte[] raw = PacketFixtures.artDmx(1, 1, new byte[600]);
        final ArtDmx dmx = (ArtDmx) ArtNet.decode(raw);
        assertEquals(600, dmx.getLength());
        assertEquals(512, dmx.getData().length);
    }

    @Test
    public void decodesPollReply() {
        final byte[] raw = PacketFixtures.artPollReply(239, NODE_IP, "Node", "Stage Left Node", 0, 1, 2,
                new int[] {0x80, 0x80}, new int[] {0, 1}, MAC);
        raw[211] = 3;
        raw[212] = 0x08;
        final ArtPollReply reply = (ArtPollReply) ArtNet.decode(raw);
        assertEquals("10.0.0.7", reply.getAddress().getHostAddress());
        assertEquals(6454, reply.getPort());
        assertEquals("Node", reply.getShortName());
        assertEquals("Stage Left Node", reply.getLongName());
        assertEquals(2, reply.getNumPorts());
        assertArrayEquals(MAC, reply.getMacAddress());
        assertEquals(3, reply.getBindIndex());
        assertEquals(0x08, reply.getStatus2());
        assertEquals(Arrays.asList(16, 17), reply.getOutputUniverses());
    }

    @Test
    public void minimalPollReplyDefaultsTrailingFields() {
        final byte[] raw = PacketFixtures.artPollReply(207, NODE_IP, "N", "", 0, 0, 1,
                new int[] {0x80}, new int[] {0}, MAC);
        final ArtPollReply reply = (ArtPollReply) ArtNet.decode(raw);
        assertArrayEquals(new byte[4], reply.getBindIp());
        assertEquals(0, reply.getBindIndex());
        assertEquals(0, reply.getStatus2());
        assertArrayEquals(MAC, reply.getMacAddress());
    }

    @Test
    public void shortPollReplyIsRejected() {
        final byte[] raw = PacketFixtures.artPollReply(207, NODE_IP, "N", "", 0, 0, 1,
                new int[] {0x80}, new int[] {0}, MAC);
        assertNull(ArtNet.decode(raw, 206));
    }

    @Test
    public void outputUniversesSkipInputPortsAndExtraPorts() {
        final byte[] raw = PacketFixtures.artPollReply(239, NODE_IP, "N", "", 1, 2, 3,
                new int[] {0x80, 0x40, 0xc0, 0x80}, new int[] {3, 4, 5, 6}, MAC);
        final ArtPollReply reply = (ArtPollReply) ArtNet.decode(raw);
        assertEquals(Arrays.asList(0x0123, 0x0125), reply.getOutputUniverses());
    }

    @Test
    public void calculatesUniverse() {
        assertEquals(0x7fff, ArtNet.calculateUniverse(0xff, 0xff, 0xff));
        assertEquals(0x0123, ArtNet.calculateUniverse(1, 2, 3));
    }

    @Test
    public void encodesPoll() {
        final byte[] expected = {'A', 'r', 't', '-', 'N', 'e', 't', 0, 0x00, 0x20, 0x00, 0x0e, 0x02, 0x10};
        assertArrayEquals(expected, ArtNet.encodePoll());
        assertTrue(ArtNet.decode(ArtNet.encodePoll()) instanceof ArtPoll);
    }
}
