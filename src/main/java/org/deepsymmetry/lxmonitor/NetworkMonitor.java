package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.capture.CaptureInterface;
import org.deepsymmetry.lxmonitor.capture.PacketCapture;
import org.deepsymmetry.lxmonitor.capture.PacketCaptures;
import org.deepsymmetry.lxmonitor.data.DmxStore;
import org.deepsymmetry.lxmonitor.data.NetworkSource;
import org.deepsymmetry.lxmonitor.data.SourceRegistry;
import org.deepsymmetry.lxmonitor.data.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <p>Watches an Art-Net and sACN lighting network. Once started, it listens for traffic of both protocols, keeps
 * track of every source it hears from along with diagnostics about their frame rates, packet loss and timing, and
 * remembers the latest DMX frame of each universe. About once a second it brings the diagnostics up to date,
 * forgets sources which have gone silent, and flags universes being sent by more than one source.</p>
 *
 * <p>Where a packet capture driver is installed, promiscuous capture can be enabled to see traffic addressed to
 * other hosts, which reveals devices that only receive data.</p>
 *
 * <p>Interested parties can register a {@link MonitorListener} to hear about changes as they happen.</p>
 */
@API(status = API.Status.STABLE)
public class NetworkMonitor extends LifecycleParticipant {

    private static final Logger logger = LoggerFactory.getLogger(NetworkMonitor.class);

    private final MonitorConfig config;
    private final SourceRegistry registry;
    private final DmxStore store = new DmxStore();
    private final EventDispatcher dispatcher;
    private final PacketRouter router;
    private final ArtNetFinder artNetFinder;
    private final SacnFinder sacnFinder;
    private final PacketCapture capture;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * The thread performing the periodic registry sweep while we are running.
     */
    private final AtomicReference<Thread> maintenance = new AtomicReference<>(null);

    /**
     * Notices when one of our finders shuts down on its own because its socket failed. The failure then shows up
     * in {@link #getStatus()}, and listeners are told so they can refresh what they show.
     */
    private final LifecycleListener finderListener = new LifecycleListener() {
        @Override
        public void started(LifecycleParticipant sender) {
            logger.debug("{} started", sender);
        }

        @Override
        public void stopped(LifecycleParticipant sender, Throwable cause) {
            if (cause != null && isRunning()) {
                logger.warn("{} failed while monitoring, its protocol will no longer be heard: {}", sender,
                        describeFailure(cause));
                dispatcher.sourcesChanged();
            }
        }
    };

    /**
     * Create a monitor using the configuration found by {@link MonitorConfig#load()}.
     */
    @API(status = API.Status.STABLE)
    public NetworkMonitor() {
        this(MonitorConfig.load());
    }

    /**
     * Create a monitor with the specified configuration, using packet capture if a driver is available.
     *
     * @param config the settings to listen with
     */
    @API(status = API.Status.STABLE)
    public NetworkMonitor(MonitorConfig config) {
        this(config, TimeSource.SYSTEM,
                PacketCaptures.select(config.getCaptureSnapLength(), config.getCaptureReadTimeout()));
    }

    /**
     * Create a monitor with explicit collaborators.
     *
     * @param config the settings to listen with
     * @param timeSource the clocks used to age sources and time-stamp frames
     * @param capture the packet capture implementation to use
     */
    @API(status = API.Status.STABLE)
    public NetworkMonitor(MonitorConfig config, TimeSource timeSource, PacketCapture capture) {
        this.config = config;
        this.capture = capture;
        registry = new SourceRegistry(timeSource);
        dispatcher = new EventDispatcher(config.getEventQueueCapacity());
        router = new PacketRouter(registry, store, dispatcher, timeSource);
        artNetFinder = new ArtNetFinder(config, router);
        sacnFinder = new SacnFinder(config, router);
        artNetFinder.addLifecycleListener(finderListener);
        sacnFinder.addLifecycleListener(finderListener);
    }

    @Override
    @API(status = API.Status.STABLE)
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Start listening to the network. If either protocol's socket cannot be opened, that is logged and monitoring
     * proceeds with the other one. If already running, has no effect.
     *
     * @throws SocketException if neither protocol's socket could be opened
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() throws SocketException {
        if (isRunning()) {
            return;
        }
        logger.info("Starting network monitor with {}", config);
        router.open();
        SocketException failure = null;
        try {
            artNetFinder.start();
        } catch (SocketException e) {
            logger.warn("Unable to listen for Art-Net, continuing without it", e);
            failure = e;
        }
        try {
            sacnFinder.start();
        } catch (SocketException e) {
            logger.warn("Unable to listen for sACN, continuing without it", e);
            if (failure != null) {
                router.close();
                failure.addSuppressed(e);
                recordFailure(failure);
                throw failure;
            }
        }

        running.set(true);
        final Thread sweeper = new Thread(null, () -> {
            while (maintenance.get() == Thread.currentThread()) {
                try {
                    Thread.sleep(config.getMaintenanceInterval());
                } catch (InterruptedException e) {
                    continue;  // Woken by stop(), loop condition decides.
                }
                try {
                    registry.sweep();
                    dispatcher.sourcesChanged();
                } catch (Throwable t) {
                    logger.warn("Problem performing registry maintenance", t);
                }
            }
        }, "lx-monitor NetworkMonitor maintenance");
        sweeper.setDaemon(true);
        maintenance.set(sweeper);
        sweeper.start();
        deliverStarted(logger);
    }

    /**
     * Stop listening to the network, stop any packet capture, and forget all sources and frames. Packets still
     * arriving while we shut down are discarded, so nothing reappears once this returns.
     */
    @API(status = API.Status.STABLE)
    public synchronized void stop() {
        if (isRunning()) {
            running.set(false);
            router.close();
            capture.stop();
            artNetFinder.stop();
            sacnFinder.stop();
            final Thread sweeper = maintenance.getAndSet(null);
            if (sweeper != null) {
                sweeper.interrupt();
            }
            registry.flush();
            store.clear();
            dispatcher.sourcesChanged();
            deliverStopped(logger, null);
            logger.info("Network monitor stopped");
        }
    }

    /**
     * Get snapshots of every source currently known.
     *
     * @return the sources, ordered by identifier
     *
     * @throws IllegalStateException if we are not running
     */
    @API(status = API.Status.STABLE)
    public List<NetworkSource> getSources() {
        ensureRunning();
        return registry.getSources();
    }

    /**
     * Get the latest frame of DMX data received for a universe.
     *
     * @param universe the universe of interest
     *
     * @return a copy of the slot values, or {@code null} if nothing has been received for that universe
     *
     * @throws IllegalStateException if we are not running
     */
    @API(status = API.Status.STABLE)
    public byte[] getFrame(int universe) {
        ensureRunning();
        return store.get(universe);
    }

    /**
     * Get the latest frame of every universe seen.
     *
     * @return copies of the frames, keyed by universe
     *
     * @throws IllegalStateException if we are not running
     */
    @API(status = API.Status.STABLE)
    public Map<Integer, byte[]> getAllFrames() {
        ensureRunning();
        return store.getAll();
    }

    /**
     * Describe which protocols are being listened to, why any of them is not, and the state of packet capture.
     * Can be called at any time.
     *
     * @return the current status
     */
    @API(status = API.Status.STABLE)
    public MonitorStatus getStatus() {
        return new MonitorStatus(artNetFinder.isRunning(), describeFailure(artNetFinder.getFailure()),
                sacnFinder.isRunning(), describeFailure(sacnFinder.getFailure()), sacnFinder.getJoinedUniverses(),
                capture.getStatus());
    }

    /**
     * Turn a socket failure into the text reported in our status.
     *
     * @param failure what went wrong, may be {@code null}
     *
     * @return the message, or the exception class when it has none, or {@code null} if there was no failure
     */
    static String describeFailure(Throwable failure) {
        if (failure == null) {
            return null;
        }
        return (failure.getMessage() == null) ? failure.getClass().getSimpleName() : failure.getMessage();
    }

    /**
     * List the interfaces on which packet capture could be enabled.
     *
     * @return the interfaces, empty if no capture driver is installed
     */
    @API(status = API.Status.STABLE)
    public List<CaptureInterface> getCaptureInterfaces() {
        return capture.getInterfaces();
    }

    /**
     * Begin promiscuous capture of lighting traffic on a network interface.
     *
     * @param interfaceName the interface to capture on, or {@code null} to use the first one available
     *
     * @throws IllegalStateException if we are not running, no capture driver is installed, or capture is already
     *                               running
     * @throws IllegalArgumentException if there is no interface with the given name
     */
    @API(status = API.Status.STABLE)
    public synchronized void enableCapture(String interfaceName) {
        ensureRunning();
        capture.start(interfaceName, router);
    }

    /**
     * Stop promiscuous capture, if it is running.
     */
    @API(status = API.Status.STABLE)
    public synchronized void disableCapture() {
        capture.stop();
    }

    /**
     * Broadcast an ArtPoll right away, so Art-Net nodes report themselves without waiting for the periodic poll.
     *
     * @throws IOException if the poll cannot be sent
     * @throws IllegalStateException if we are not running, or not listening for Art-Net
     */
    @API(status = API.Status.STABLE)
    public void sendPoll() throws IOException {
        ensureRunning();
        artNetFinder.sendPoll();
    }

    /**
     * Join the sACN multicast group of a universe beyond the range joined at startup.
     *
     * @param universe the universe to hear
     *
     * @return {@code true} if the group was newly joined
     *
     * @throws IOException if the group cannot be joined
     * @throws IllegalStateException if we are not running, or not listening for sACN
     */
    @API(status = API.Status.STABLE)
    public boolean joinUniverse(int universe) throws IOException {
        ensureRunning();
        return sacnFinder.joinUniverse(universe);
    }

    /**
     * Start reporting changes to a listener. Adding a listener twice has no effect.
     *
     * @param listener the listener to notify
     */
    @API(status = API.Status.STABLE)
    public void addMonitorListener(MonitorListener listener) {
        dispatcher.addListener(listener);
    }

    /**
     * Stop reporting changes to a listener.
     *
     * @param listener the listener to forget
     */
    @API(status = API.Status.STABLE)
    public void removeMonitorListener(MonitorListener listener) {
        dispatcher.removeListener(listener);
    }

    /**
     * Get the listeners currently registered.
     *
     * @return a snapshot of the listeners
     */
    @API(status = API.Status.STABLE)
    public List<MonitorListener> getMonitorListeners() {
        return Collections.unmodifiableList(dispatcher.getListeners());
    }

    @API(status = API.Status.STABLE)
    public ArtNetFinder getArtNetFinder() {
        return artNetFinder;
    }

    @API(status = API.Status.STABLE)
    public SacnFinder getSacnFinder() {
        return sacnFinder;
    }

    @API(status = API.Status.STABLE)
    public MonitorConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "NetworkMonitor[running:" + isRunning() + ", artNet:" + artNetFinder + ", sACN:" + sacnFinder + "]";
    }
}
