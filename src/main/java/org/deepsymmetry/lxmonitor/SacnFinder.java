package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.sacn.Sacn;
import org.deepsymmetry.lxmonitor.sacn.SacnPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Listens for sACN traffic on port 5568. sACN data is multicast to a group per universe, so we must join the
 * group of every universe we want to hear; a configurable range is joined at startup, and more can be joined
 * with {@link #joinUniverse(int)}. Every packet received is handed to the {@link PacketRouter}.
 */
@API(status = API.Status.STABLE)
public class SacnFinder extends LifecycleParticipant {

    private static final Logger logger = LoggerFactory.getLogger(SacnFinder.class);

    private static final int BUFFER_SIZE = 1500;

    private final MonitorConfig config;
    private final PacketRouter router;

    /**
     * The socket used to receive sACN packets while we are active.
     */
    private final AtomicReference<MulticastSocket> socket = new AtomicReference<>(null);

    /**
     * The interface on which multicast groups are joined, or {@code null} to let the system choose.
     */
    private NetworkInterface multicastInterface;

    /**
     * The universes whose multicast groups we are members of.
     */
    private final Set<Integer> joinedUniverses = new ConcurrentSkipListSet<>();

    SacnFinder(MonitorConfig config, PacketRouter router) {
        this.config = config;
        this.router = router;
    }

    /**
     * Check whether we are presently listening for sACN packets.
     *
     * @return {@code true} if our socket is open
     */
    @API(status = API.Status.STABLE)
    public boolean isRunning() {
        return socket.get() != null;
    }

    /**
     * Start listening for sACN packets, joining the multicast groups of the configured universe range.
     * If already active, has no effect. Failing to join an individual group is logged, but does not stop us.
     *
     * @throws SocketException if the socket cannot be bound to the sACN port
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() throws SocketException {
        if (!isRunning()) {
            final MulticastSocket newSocket;
            try {
                newSocket = new MulticastSocket(null);
            } catch (IOException e) {
                final SocketException failure = new SocketException("Unable to create sACN socket: " + e.getMessage());
                failure.initCause(e);
                recordFailure(failure);
                throw failure;
            }
            try {
                newSocket.setReuseAddress(true);
                newSocket.bind(new InetSocketAddress(config.getBindAddress(), config.getSacnPort()));
                multicastInterface = config.getBindAddress().isAnyLocalAddress() ? null :
                        NetworkInterface.getByInetAddress(config.getBindAddress());
            } catch (SocketException e) {
                newSocket.close();
                recordFailure(e);
                throw e;
            }
            socket.set(newSocket);
            joinedUniverses.clear();

            int joined = 0;
            for (int universe = config.getFirstUniverse(); universe <= config.getLastUniverse(); universe++) {
                try {
                    join(newSocket, universe);
                    joined++;
                } catch (IOException e) {
                    logger.warn("Unable to join sACN multicast group for universe " + universe, e);
                }
            }
            logger.info("Listening for sACN on {}:{}, joined {} multicast groups for universes {} to {}; " +
                            "other universes are only heard once joined explicitly",
                    config.getBindAddress().getHostAddress(), config.getSacnPort(), joined,
                    config.getFirstUniverse(), config.getLastUniverse());

            final byte[] buffer = new byte[BUFFER_SIZE];
            final DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
            Thread receiver = new Thread(null, () -> {
                boolean received;
                while (socket.get() == newSocket) {
                    try {
                        newSocket.receive(packet);
                        received = true;
                    } catch (IOException e) {
                        // A socket closed by stop() has already been detached, so this is a real failure.
                        if (socket.get() == newSocket) {
                            logger.warn("Problem reading from sACN socket, stopping", e);
                            stop(e);
                        }
                        received = false;
                    }
                    try {
                        if (received) {
                            final SacnPacket decoded = Sacn.decode(packet.getData(), packet.getLength());
                            if (decoded != null) {
                                router.routeSacn(decoded, packet.getAddress(), null);
                            }
                        }
                    } catch (Throwable t) {
                        logger.warn("Problem processing sACN packet", t);
                    }
                }
            }, "lx-monitor SacnFinder receiver");
            receiver.setDaemon(true);
            receiver.start();

            deliverStarted(logger);
        }
    }

    private void join(MulticastSocket target, int universe) throws IOException {
        target.joinGroup(new InetSocketAddress(Sacn.multicastAddress(universe), 0), multicastInterface);
        joinedUniverses.add(universe);
    }

    /**
     * Join the multicast group of a universe outside the range joined at startup, so its traffic can be heard.
     *
     * @param universe the universe to listen to, from 1 to 63999
     *
     * @return {@code true} if the group was joined, {@code false} if we were already a member
     *
     * @throws IOException if the group cannot be joined
     * @throws IllegalArgumentException if the universe number is not valid for sACN
     * @throws IllegalStateException if we are not running
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean joinUniverse(int universe) throws IOException {
        if (universe < 1 || universe > MonitorConfig.MAXIMUM_SACN_UNIVERSE) {
            throw new IllegalArgumentException("sACN universes must be between 1 and " +
                    MonitorConfig.MAXIMUM_SACN_UNIVERSE);
        }
        ensureRunning();
        if (joinedUniverses.contains(universe)) {
            return false;
        }
        join(socket.get(), universe);
        logger.info("Joined sACN multicast group for universe {}", universe);
        return true;
    }

    /**
     * Get the universes whose multicast groups we have joined.
     *
     * @return the universe numbers, in ascending order
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getJoinedUniverses() {
        return Collections.unmodifiableList(new ArrayList<>(joinedUniverses));
    }

    /**
     * Stop listening for sACN packets. Closing the socket leaves all the multicast groups.
     */
    @API(status = API.Status.STABLE)
    public void stop() {
        stop(null);
    }

    private synchronized void stop(Throwable cause) {
        final MulticastSocket oldSocket = socket.getAndSet(null);
        if (oldSocket != null) {
            oldSocket.close();
            joinedUniverses.clear();
            deliverStopped(logger, cause);
        }
    }

    @Override
    public String toString() {
        return "SacnFinder[running:" + isRunning() + ", port:" + config.getSacnPort() + ", joined:" +
                joinedUniverses.size() + "]";
    }
}
