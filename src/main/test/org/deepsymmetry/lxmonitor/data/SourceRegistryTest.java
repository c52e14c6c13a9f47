package org.deepsymmetry.lxmonitor.data;

import org.deepsymmetry.lxmonitor.PacketFixtures;
import org.deepsymmetry.lxmonitor.artnet.ArtNet;
import org.deepsymmetry.lxmonitor.artnet.ArtPollReply;
import org.deepsymmetry.lxmonitor.sacn.Sacn;
import org.deepsymmetry.lxmonitor.sacn.SacnDiscovery;
import org.deepsymmetry.lxmonitor.sacn.SacnDmx;
import org.deepsymmetry.lxmonitor.sacn.SacnSource;
import org.junit.Before;
import org.junit.Test;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class SourceRegistryTest {

    private ManualTimeSource clock;
    private SourceRegistry registry;
    private InetAddress nodeA;
    private InetAddress nodeB;

    @Before
    public void setUp() throws Exception {
        clock = new ManualTimeSource();
        registry = new SourceRegistry(clock);
        nodeA = InetAddress.getByName("10.0.0.7");
        nodeB = InetAddress.getByName("10.0.0.8");
    }

    private static SacnSource sacnSource(int sequence, int universe) {
        final byte[] raw = PacketFixtures.sacnDmx(PacketFixtures.countingCid(), "Console", 120, sequence, universe, 0,
                new byte[4]);
        return ((SacnDmx) Sacn.decode(raw)).getSource();
    }

    @Test
    public void artNetTrafficCreatesSource() {
        final NetworkSource source = registry.updateArtNetTraffic(nodeA, 3, SourceDirection.SENDING, 1);
        assertEquals("artnet-10.0.0.7", source.getId());
        assertEquals("ArtNet @ 10.0.0.7", source.getName());
        assertEquals(Protocol.ARTNET, source.getProtocol());
        assertEquals(SourceStatus.ACTIVE, source.getStatus());
        assertEquals(SourceDirection.SENDING, source.getDirection());
        assertEquals(1, source.getPacketCount());
        assertEquals(clock.currentTimeMillis(), source.getFirstSeen());
        assertEquals(Collections.singletonList(3), source.getUniverses());
    }

    @Test
    public void statusFollowsSilence() {
        registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, 0);
        clock.advanceMillis(4000);
        registry.sweep();
        assertEquals(SourceStatus.IDLE, registry.getSource("artnet-10.0.0.7").getStatus());

        clock.advanceMillis(7000);
        registry.sweep();
        assertEquals(SourceStatus.STALE, registry.getSource("artnet-10.0.0.7").getStatus());

        clock.advanceMillis(50000);
        assertEquals(1, registry.sweep());
        assertNull(registry.getSource("artnet-10.0.0.7"));
        assertTrue(registry.getSources().isEmpty());
    }

    @Test
    public void packetRevivesStaleSource() {
        registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, 0);
        clock.advanceMillis(20000);
        registry.sweep();
        assertEquals(SourceStatus.STALE, registry.getSource("artnet-10.0.0.7").getStatus());
        final long firstSeen = registry.getSource("artnet-10.0.0.7").getFirstSeen();

        final NetworkSource revived = registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, 1);
        assertEquals(SourceStatus.ACTIVE, revived.getStatus());
        assertEquals(firstSeen, revived.getFirstSeen());
        assertEquals(firstSeen + 20000, revived.getLastSeen());
    }

    @Test
    public void directionOnlyEscalates() {
        registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, 0);
        NetworkSource source = registry.updateArtNetTraffic(nodeA, 1, SourceDirection.RECEIVING, null);
        assertEquals(SourceDirection.BOTH, source.getDirection());
        source = registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, 1);
        assertEquals(SourceDirection.BOTH, source.getDirection());
    }

    @Test
    public void universesAreSortedAndUnique() {
        registry.updateArtNetTraffic(nodeA, 9, SourceDirection.SENDING, 0);
        registry.updateArtNetTraffic(nodeA, 2, SourceDirection.SENDING, 1);
        final NetworkSource source = registry.updateArtNetTraffic(nodeA, 9, SourceDirection.SENDING, 2);
        assertEquals(Arrays.asList(2, 9), source.getUniverses());
    }

    @Test
    public void flagsDuplicateUniverses() throws Exception {
        registry.updateArtNetTraffic(nodeA, 7, SourceDirection.SENDING, 0);
        registry.updateSacnSource(nodeB, sacnSource(0, 7), SourceDirection.SENDING);
        registry.updateArtNetTraffic(InetAddress.getByName("10.0.0.9"), 9, SourceDirection.SENDING, 0);
        registry.sweep();

        assertEquals(Collections.singletonList(7), registry.getSource("artnet-10.0.0.7").getDuplicateUniverses());
        assertEquals(Collections.singletonList(7),
                registry.getSource("sacn-00010203-0405-0607-0809-0a0b0c0d0e0f").getDuplicateUniverses());
        assertTrue(registry.getSource("artnet-10.0.0.9").getDuplicateUniverses().isEmpty());
        assertEquals(2, registry.getSourceIdsForUniverse(7).size());
        assertTrue(registry.getSourceIdsForUniverse(42).isEmpty());
    }

    @Test
    public void duplicatesClearWhenConflictEnds() {
        registry.updateArtNetTraffic(nodeA, 7, SourceDirection.SENDING, 0);
        clock.advanceMillis(30000);
        registry.updateArtNetTraffic(nodeB, 7, SourceDirection.SENDING, 0);
        registry.sweep();
        assertEquals(Collections.singletonList(7), registry.getSource("artnet-10.0.0.8").getDuplicateUniverses());

        clock.advanceMillis(31000);
        registry.sweep();
        assertNull(registry.getSource("artnet-10.0.0.7"));
        assertTrue(registry.getSource("artnet-10.0.0.8").getDuplicateUniverses().isEmpty());
    }

    @Test
    public void tracksSacnLoss() {
        for (int sequence : new int[] {0, 1, 2, 5}) {
            registry.updateSacnSource(nodeB, sacnSource(sequence, 1), SourceDirection.SENDING);
            clock.advanceMillis(25);
        }
        final NetworkSource source = registry.getSource("sacn-00010203-0405-0607-0809-0a0b0c0d0e0f");
        assertEquals(20.0, source.getPacketLossPercent(), 0.001);
        assertEquals("Console", source.getName());
        assertEquals(Integer.valueOf(120), source.getPriority());
        assertEquals("00010203-0405-0607-0809-0a0b0c0d0e0f", source.getCid());
    }

    @Test
    public void warnsAboutFrameRate() {
        NetworkSource source = null;
        for (int i = 0; i < 10; i++) {
            source = registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, i);
            clock.advanceMillis(100);
        }
        assertEquals(FpsWarning.LOW, source.getFpsWarning());

        for (int i = 0; i < 50; i++) {
            source = registry.updateArtNetTraffic(nodeB, 1, SourceDirection.SENDING, i);
            clock.advanceMillis(10);
        }
        assertEquals(FpsWarning.HIGH, source.getFpsWarning());
        assertEquals("high", source.getFpsWarning().label);
    }

    @Test
    public void pollReplyNamesNode() {
        final byte[] raw = PacketFixtures.artPollReply(239, new byte[] {10, 0, 0, 7}, "Node", "Stage Left Node", 0, 0,
                1, new int[] {0x80}, new int[] {4}, new byte[] {0, 0x1a, 0x2b, 0x3c, 0x4d, 0x5e});
        final ArtPollReply reply = (ArtPollReply) ArtNet.decode(raw);
        final NetworkSource source = registry.updateArtNetNode(reply.getAddress(), reply, SourceDirection.UNKNOWN);
        assertEquals("artnet-10.0.0.7", source.getId());
        assertEquals("Stage Left Node", source.getName());
        assertEquals("Node", source.getShortName());
        assertEquals("00:1A:2B:3C:4D:5E", source.getMacAddress());
        assertEquals(Collections.singletonList(4), source.getUniverses());
        assertEquals(SourceDirection.UNKNOWN, source.getDirection());
    }

    @Test
    public void discoveryAddsUniversesWithDefaultPriority() {
        final byte[] raw = PacketFixtures.sacnDiscovery(PacketFixtures.countingCid(), "", 0, 0, 4, 2);
        final NetworkSource source = registry.updateSacnDiscovery(nodeB, (SacnDiscovery) Sacn.decode(raw));
        assertEquals("sacn-00010203-0405-0607-0809-0a0b0c0d0e0f", source.getId());
        assertEquals("sACN @ 10.0.0.8", source.getName());
        assertEquals(Integer.valueOf(SourceRegistry.DEFAULT_SACN_PRIORITY), source.getPriority());
        assertEquals(Arrays.asList(2, 4), source.getUniverses());
        assertEquals(0.0, source.getFps(), 0.0);
    }

    @Test
    public void receiversAreKeyedByAddress() {
        final NetworkSource source = registry.updateSacnReceiver(nodeA, 12);
        assertEquals("sacn-10.0.0.7", source.getId());
        assertEquals("00000000-0000-0000-0000-000000000000", source.getCid());
        assertEquals(SourceDirection.RECEIVING, source.getDirection());
    }

    @Test
    public void flushForgetsEverything() {
        registry.updateArtNetTraffic(nodeA, 1, SourceDirection.SENDING, 0);
        registry.sweep();
        registry.flush();
        assertTrue(registry.getSources().isEmpty());
        assertTrue(registry.getSourceIdsForUniverse(1).isEmpty());
    }
}
