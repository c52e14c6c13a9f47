package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.artnet.ArtNet;
import org.deepsymmetry.lxmonitor.artnet.ArtNetPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Listens for Art-Net traffic on port 6454, and periodically broadcasts an ArtPoll so that nodes on the network
 * announce themselves. Every packet received is handed to the {@link PacketRouter}.
 */
@API(status = API.Status.STABLE)
public class ArtNetFinder extends LifecycleParticipant {

    private static final Logger logger = LoggerFactory.getLogger(ArtNetFinder.class);

    /**
     * The largest datagram we expect to receive.
     */
    private static final int BUFFER_SIZE = 1500;

    private final MonitorConfig config;
    private final PacketRouter router;

    /**
     * The socket used to receive Art-Net packets and send polls while we are active.
     */
    private final AtomicReference<DatagramSocket> socket = new AtomicReference<>(null);

    /**
     * The thread broadcasting periodic polls, interrupted to wake it when we stop.
     */
    private final AtomicReference<Thread> poller = new AtomicReference<>(null);

    ArtNetFinder(MonitorConfig config, PacketRouter router) {
        this.config = config;
        this.router = router;
    }

    /**
     * Check whether we are presently listening for Art-Net packets.
     *
     * @return {@code true} if our socket is open
     */
    @API(status = API.Status.STABLE)
    public boolean isRunning() {
        return socket.get() != null;
    }

    /**
     * Start listening for Art-Net packets, and begin polling for nodes. If already active, has no effect.
     *
     * @throws SocketException if the socket cannot be bound to the Art-Net port
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() throws SocketException {
        if (!isRunning()) {
            final DatagramSocket newSocket = new DatagramSocket(null);
            try {
                newSocket.setReuseAddress(true);
                newSocket.setBroadcast(true);
                newSocket.bind(new InetSocketAddress(config.getBindAddress(), config.getArtNetPort()));
            } catch (SocketException e) {
                newSocket.close();
                recordFailure(e);
                throw e;
            }
            socket.set(newSocket);
            logger.info("Listening for Art-Net on {}:{}", config.getBindAddress().getHostAddress(),
                    config.getArtNetPort());

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
                            logger.warn("Problem reading from Art-Net socket, stopping", e);
                            stop(e);
                        }
                        received = false;
                    }
                    try {
                        if (received) {
                            final ArtNetPacket decoded = ArtNet.decode(packet.getData(), packet.getLength());
                            if (decoded != null) {
                                router.routeArtNet(decoded, packet.getAddress(), null);
                            }
                        }
                    } catch (Throwable t) {
                        logger.warn("Problem processing Art-Net packet", t);
                    }
                }
            }, "lx-monitor ArtNetFinder receiver");
            receiver.setDaemon(true);
            receiver.start();

            Thread pollThread = new Thread(null, () -> {
                while (poller.get() == Thread.currentThread()) {
                    try {
                        sendPoll();
                    } catch (Throwable t) {
                        if (isRunning()) {
                            logger.warn("Unable to broadcast ArtPoll", t);
                        }
                    }
                    try {
                        Thread.sleep(config.getPollInterval());
                    } catch (InterruptedException e) {
                        logger.debug("ArtPoll thread woken, checking whether to stop");
                    }
                }
            }, "lx-monitor ArtNetFinder poller");
            pollThread.setDaemon(true);
            poller.set(pollThread);
            pollThread.start();

            deliverStarted(logger);
        }
    }

    /**
     * Broadcast an ArtPoll now, rather than waiting for the next periodic one, so that nodes announce themselves.
     *
     * @throws IOException if the poll cannot be sent
     * @throws IllegalStateException if we are not running
     */
    @API(status = API.Status.STABLE)
    public void sendPoll() throws IOException {
        ensureRunning();
        final DatagramSocket currentSocket = socket.get();
        if (currentSocket == null) {
            throw new IOException("Art-Net socket closed while sending ArtPoll");
        }
        final byte[] poll = ArtNet.encodePoll();
        currentSocket.send(new DatagramPacket(poll, poll.length, config.getBroadcastAddress(), config.getArtNetPort()));
        logger.debug("Sent ArtPoll to {}", config.getBroadcastAddress().getHostAddress());
    }

    /**
     * Stop listening for Art-Net packets and polling for nodes.
     */
    @API(status = API.Status.STABLE)
    public void stop() {
        stop(null);
    }

    /**
     * Close our socket and stop polling, announcing why.
     *
     * @param cause the failure forcing us to stop, or {@code null} if we were asked to
     */
    private synchronized void stop(Throwable cause) {
        final DatagramSocket oldSocket = socket.getAndSet(null);
        if (oldSocket != null) {
            oldSocket.close();
            final Thread pollThread = poller.getAndSet(null);
            if (pollThread != null) {
                pollThread.interrupt();
            }
            deliverStopped(logger, cause);
        }
    }

    @Override
    public String toString() {
        return "ArtNetFinder[running:" + isRunning() + ", port:" + config.getArtNetPort() + "]";
    }
}
