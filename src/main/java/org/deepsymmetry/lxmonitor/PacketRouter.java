package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.artnet.ArtDmx;
import org.deepsymmetry.lxmonitor.artnet.ArtNet;
import org.deepsymmetry.lxmonitor.artnet.ArtNetPacket;
import org.deepsymmetry.lxmonitor.artnet.ArtOther;
import org.deepsymmetry.lxmonitor.artnet.ArtPoll;
import org.deepsymmetry.lxmonitor.artnet.ArtPollReply;
import org.deepsymmetry.lxmonitor.capture.PacketCapture;
import org.deepsymmetry.lxmonitor.capture.UdpDatagram;
import org.deepsymmetry.lxmonitor.data.DmxStore;
import org.deepsymmetry.lxmonitor.data.Protocol;
import org.deepsymmetry.lxmonitor.data.SourceDirection;
import org.deepsymmetry.lxmonitor.data.SourceRegistry;
import org.deepsymmetry.lxmonitor.data.TimeSource;
import org.deepsymmetry.lxmonitor.sacn.Sacn;
import org.deepsymmetry.lxmonitor.sacn.SacnDiscovery;
import org.deepsymmetry.lxmonitor.sacn.SacnDmx;
import org.deepsymmetry.lxmonitor.sacn.SacnPacket;
import org.deepsymmetry.lxmonitor.sacn.SacnSync;
import org.deepsymmetry.lxmonitor.sacn.SacnUnknown;

import java.net.InetAddress;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Applies decoded packets to the source registry and frame store, and announces the resulting changes. Shared by
 * the socket receivers, which only know who sent a packet, and packet capture, which also knows where it was going
 * and can therefore discover devices that only receive. Packets are only applied while the router is
 * open, which is while the monitor is running.
 */
@API(status = API.Status.STABLE)
public class PacketRouter implements PacketCapture.DatagramHandler {

    private final SourceRegistry registry;
    private final DmxStore store;
    private final EventDispatcher dispatcher;
    private final TimeSource timeSource;

    /**
     * Held for reading while a packet is applied, and for writing while opening or closing.
     */
    private final ReadWriteLock gate = new ReentrantReadWriteLock();

    private boolean open = false;

    PacketRouter(SourceRegistry registry, DmxStore store, EventDispatcher dispatcher, TimeSource timeSource) {
        this.registry = registry;
        this.store = store;
        this.dispatcher = dispatcher;
        this.timeSource = timeSource;
    }

    /**
     * Start applying packets.
     */
    void open() {
        gate.writeLock().lock();
        try {
            open = true;
        } finally {
            gate.writeLock().unlock();
        }
    }

    /**
     * Stop applying packets. Once this returns, no packet is still being applied, and later ones are dropped, so
     * the registry and store can be flushed without anything reappearing.
     */
    void close() {
        gate.writeLock().lock();
        try {
            open = false;
        } finally {
            gate.writeLock().unlock();
        }
    }

    /**
     * Check whether traffic sent to an address tells us about a single receiving device.
     */
    private static boolean isUnicast(InetAddress destination) {
        return destination != null && !Util.isGroupAddress(destination);
    }

    /**
     * Process an Art-Net packet.
     *
     * @param packet the decoded packet
     * @param sender the address it came from
     * @param destination the address it was sent to, if it was captured, or {@code null} if it arrived on a socket
     */
    @API(status = API.Status.STABLE)
    public void routeArtNet(final ArtNetPacket packet, final InetAddress sender, final InetAddress destination) {
        gate.readLock().lock();
        try {
            if (open) {
                applyArtNet(packet, sender, destination);
            }
        } finally {
            gate.readLock().unlock();
        }
    }

    private void applyArtNet(final ArtNetPacket packet, final InetAddress sender, final InetAddress destination) {
        packet.accept(new ArtNetPacket.Visitor<Void>() {
            @Override
            public Void visitPoll(ArtPoll poll) {
                return null;  // We only listen; other controllers answer polls.
            }

            @Override
            public Void visitPollReply(ArtPollReply reply) {
                InetAddress node = reply.getAddress();
                if (node.isAnyLocalAddress()) {
                    node = sender;
                }
                final SourceDirection direction = (destination == null) ? SourceDirection.UNKNOWN :
                        SourceDirection.RECEIVING;
                registry.updateArtNetNode(node, reply, direction);
                dispatcher.sourcesChanged();
                return null;
            }

            @Override
            public Void visitDmx(ArtDmx dmx) {
                registry.updateArtNetTraffic(sender, dmx.getUniverse(), SourceDirection.SENDING, dmx.getSequence());
                if (isUnicast(destination)) {
                    registry.updateArtNetTraffic(destination, dmx.getUniverse(), SourceDirection.RECEIVING, null);
                }
                publishFrame(dmx.getUniverse(), sender, Protocol.ARTNET, dmx.getData());
                return null;
            }

            @Override
            public Void visitOther(ArtOther other) {
                return null;
            }
        });
    }

    /**
     * Process an sACN packet.
     *
     * @param packet the decoded packet
     * @param sender the address it came from
     * @param destination the address it was sent to, if it was captured, or {@code null} if it arrived on a socket
     */
    @API(status = API.Status.STABLE)
    public void routeSacn(final SacnPacket packet, final InetAddress sender, final InetAddress destination) {
        gate.readLock().lock();
        try {
            if (open) {
                applySacn(packet, sender, destination);
            }
        } finally {
            gate.readLock().unlock();
        }
    }

    private void applySacn(final SacnPacket packet, final InetAddress sender, final InetAddress destination) {
        packet.accept(new SacnPacket.Visitor<Void>() {
            @Override
            public Void visitDmx(SacnDmx dmx) {
                final int universe = dmx.getSource().getUniverse();
                registry.updateSacnSource(sender, dmx.getSource(), SourceDirection.SENDING);
                if (isUnicast(destination)) {
                    registry.updateSacnReceiver(destination, universe);
                }
                publishFrame(universe, sender, Protocol.SACN, dmx.getData());
                return null;
            }

            @Override
            public Void visitSync(SacnSync sync) {
                return null;
            }

            @Override
            public Void visitDiscovery(SacnDiscovery discovery) {
                registry.updateSacnDiscovery(sender, discovery);
                dispatcher.sourcesChanged();
                return null;
            }

            @Override
            public Void visitUnknown(SacnUnknown unknown) {
                return null;
            }
        });
    }

    private void publishFrame(int universe, InetAddress sender, Protocol protocol, byte[] data) {
        store.update(universe, data);
        dispatcher.frameUpdated(new FrameUpdate(universe, sender, protocol, timeSource.currentTimeMillis(), data));
    }

    /**
     * Process a datagram found by packet capture, choosing the decoder by port. Anything to or from the Art-Net
     * port is treated as Art-Net, and everything else the capture filter let through as sACN.
     *
     * @param datagram the captured datagram
     */
    @Override
    public void datagramCaptured(UdpDatagram datagram) {
        final byte[] payload = datagram.getPayload();
        if (datagram.getSourcePort() == ArtNet.PORT || datagram.getDestinationPort() == ArtNet.PORT) {
            final ArtNetPacket packet = ArtNet.decode(payload);
            if (packet != null) {
                routeArtNet(packet, datagram.getSourceAddress(), datagram.getDestinationAddress());
            }
        } else {
            final SacnPacket packet = Sacn.decode(payload);
            if (packet != null) {
                routeSacn(packet, datagram.getSourceAddress(), datagram.getDestinationAddress());
            }
        }
    }
}
