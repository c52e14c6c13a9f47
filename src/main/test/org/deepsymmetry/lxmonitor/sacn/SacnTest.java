package org.deepsymmetry.lxmonitor.sacn;

import org.deepsymmetry.lxmonitor.PacketFixtures;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class SacnTest {

    private static final byte[] CID = PacketFixtures.countingCid();

    @Test
    public void rejectsShortOrForeignPackets() {
        assertNull(Sacn.decode(new byte[37]));
        final byte[] raw = PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0, new byte[4]);
        raw[4] = 'X';
        assertNull(Sacn.decode(raw));
    }

    @Test
    public void rejectsBadPreamble() {
        final byte[] raw = PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0, new byte[4]);
        raw[1] = 0x11;
        assertNull(Sacn.decode(raw));
    }

    @Test
    public void decodesDmx() {
        final byte[] slots = {10, 20, 30};
        final SacnPacket packet = Sacn.decode(PacketFixtures.sacnDmx(CID, "Main Console", 150, 77, 5, 0, slots));
        assertTrue(packet instanceof SacnDmx);
        final SacnDmx dmx = (SacnDmx) packet;
        assertArrayEquals(slots, dmx.getData());
        assertEquals(0, dmx.getStartCode());
        final SacnSource source = dmx.getSource();
        assertEquals("Main Console", source.getSourceName());
        assertEquals(150, source.getPriority());
        assertEquals(77, source.getSequence());
        assertEquals(5, source.getUniverse());
        assertArrayEquals(CID, source.getCid());
    }

    @Test
    public void nonZeroStartCodeIsUnknown() {
        final SacnPacket packet = Sacn.decode(PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0xdd, new byte[8]));
        assertTrue(packet instanceof SacnUnknown);
    }

    @Test
    public void payloadIsLimitedByPropertyCountAndBuffer() {
        final byte[] raw = PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0, new byte[20]);
        raw[124] = 5;  // Property count of 5 means four slots follow the start code.
        assertEquals(4, ((SacnDmx) Sacn.decode(raw)).getData().length);

        raw[123] = 0x02;  // Now claims more slots than arrived.
        raw[124] = 0x01;
        assertEquals(10, ((SacnDmx) Sacn.decode(raw, 136)).getData().length);
    }

    @Test
    public void zeroPropertyCountGivesEmptyFrame() {
        final byte[] raw = PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0, new byte[4]);
        raw[123] = 0;
        raw[124] = 0;
        assertEquals(0, ((SacnDmx) Sacn.decode(raw)).getData().length);
    }

    @Test
    public void truncatedDataPacketsAreRejected() {
        final byte[] raw = PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0, new byte[4]);
        assertNull(Sacn.decode(raw, 114));
        assertNull(Sacn.decode(raw, 125));
    }

    @Test
    public void decodesSync() {
        final SacnPacket packet = Sacn.decode(PacketFixtures.sacnSync(CID, 7000));
        assertTrue(packet instanceof SacnSync);
        assertEquals(7000, ((SacnSync) packet).getSyncAddress());
    }

    @Test
    public void decodesDiscoverySkippingZeros() {
        final SacnPacket packet = Sacn.decode(PacketFixtures.sacnDiscovery(CID, "Console", 0, 1, 1, 0, 2, 300));
        assertTrue(packet instanceof SacnDiscovery);
        final SacnDiscovery discovery = (SacnDiscovery) packet;
        assertEquals(0, discovery.getPage());
        assertEquals(1, discovery.getLastPage());
        assertEquals("Console", discovery.getSourceName());
        assertEquals(Arrays.asList(1, 2, 300), discovery.getUniverses());
        assertEquals("00010203-0405-0607-0809-0a0b0c0d0e0f", discovery.getCidString());
    }

    @Test
    public void extendedPacketOtherThanDiscoveryIsUnknown() {
        final byte[] raw = PacketFixtures.sacnDiscovery(CID, "Console", 0, 0, 1);
        raw[43] = 0x01;
        assertTrue(Sacn.decode(raw) instanceof SacnUnknown);
        assertNull(Sacn.decode(raw, 119));
    }

    @Test
    public void unknownRootVectorIsUnknown() {
        final byte[] raw = PacketFixtures.sacnDmx(CID, "Console", 100, 1, 1, 0, new byte[4]);
        raw[21] = 0x09;
        assertTrue(Sacn.decode(raw) instanceof SacnUnknown);
    }

    @Test
    public void computesMulticastAddress() {
        assertEquals("239.255.0.1", Sacn.multicastAddress(1).getHostAddress());
        assertEquals("239.255.1.44", Sacn.multicastAddress(300).getHostAddress());
        assertEquals("239.255.249.255", Sacn.multicastAddress(63999).getHostAddress());
    }

    @Test
    public void formatsCid() {
        assertEquals("00010203-0405-0607-0809-0a0b0c0d0e0f", Sacn.cidToString(CID));
        assertTrue(Sacn.isZeroCid(new byte[16]));
        assertFalse(Sacn.isZeroCid(CID));
    }
}
