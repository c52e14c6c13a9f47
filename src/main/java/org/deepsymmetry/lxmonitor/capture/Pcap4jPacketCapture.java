package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;
import org.pcap4j.core.BpfProgram;
import org.pcap4j.core.PcapHandle;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface;
import org.pcap4j.core.PcapNetworkInterface.PromiscuousMode;
import org.pcap4j.core.Pcaps;
import org.pcap4j.packet.namednumber.DataLinkType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Captures lighting traffic through libpcap (or Npcap on Windows), by way of pcap4j.
 */
@API(status = API.Status.STABLE)
public class Pcap4jPacketCapture implements PacketCapture {

    private static final Logger logger = LoggerFactory.getLogger(Pcap4jPacketCapture.class);

    private final int snapLength;
    private final int readTimeout;

    /**
     * Set while the capture thread should keep running.
     */
    private final AtomicBoolean active = new AtomicBoolean(false);

    /**
     * The thread reading frames, while there is one.
     */
    private final AtomicReference<Thread> worker = new AtomicReference<>(null);

    private final AtomicLong packetsCaptured = new AtomicLong(0);
    private final AtomicReference<String> lastError = new AtomicReference<>(null);
    private volatile String interfaceName;

    /**
     * Create a capture which will open interfaces with the given settings.
     *
     * @param snapLength the most bytes of each frame to capture
     * @param readTimeout how many milliseconds a read may wait for a frame, which bounds how long it takes to
     *                    notice that capture has been stopped
     */
    @API(status = API.Status.STABLE)
    public Pcap4jPacketCapture(int snapLength, int readTimeout) {
        this.snapLength = snapLength;
        this.readTimeout = readTimeout;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<CaptureInterface> getInterfaces() {
        final List<CaptureInterface> result = new ArrayList<>();
        try {
            for (PcapNetworkInterface device : Pcaps.findAllDevs()) {
                result.add(new CaptureInterface(device.getName(), device.getDescription()));
            }
        } catch (PcapNativeException e) {
            logger.warn("Unable to list capture interfaces", e);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Find the device to open.
     */
    private PcapNetworkInterface findDevice(String name) {
        try {
            if (name == null) {
                final List<PcapNetworkInterface> devices = Pcaps.findAllDevs();
                if (devices.isEmpty()) {
                    throw new IllegalArgumentException("No capture interfaces are available");
                }
                return devices.get(0);
            }
            final PcapNetworkInterface device = Pcaps.getDevByName(name);
            if (device == null) {
                throw new IllegalArgumentException("No capture interface named " + name);
            }
            return device;
        } catch (PcapNativeException e) {
            throw new IllegalStateException("Unable to look up capture interfaces", e);
        }
    }

    @Override
    public synchronized void start(String requestedInterface, final DatagramHandler handler) {
        if (isRunning()) {
            throw new IllegalStateException("Packet capture is already running on " + interfaceName);
        }
        final PcapNetworkInterface device = findDevice(requestedInterface);

        interfaceName = device.getName();
        packetsCaptured.set(0);
        lastError.set(null);
        active.set(true);

        final Thread thread = new Thread(null, () -> {
            try {
                capture(device, handler);
            } finally {
                active.set(false);
                worker.compareAndSet(Thread.currentThread(), null);
            }
        }, "lx-monitor packet capture");
        thread.setDaemon(true);
        worker.set(thread);
        thread.start();
    }

    /**
     * The body of the capture thread: open the interface, then hand every UDP datagram found to the handler until
     * told to stop.
     */
    private void capture(PcapNetworkInterface device, DatagramHandler handler) {
        final PcapHandle handle;
        try {
            handle = device.openLive(snapLength, PromiscuousMode.PROMISCUOUS, readTimeout);
        } catch (Throwable t) {
            fail("Unable to open " + device.getName() + " for capture: " + t.getMessage(), t);
            return;
        }
        try {
            handle.setFilter(FILTER, BpfProgram.BpfCompileMode.OPTIMIZE);
            if (!DataLinkType.EN10MB.equals(handle.getDlt())) {
                fail("Unsupported link type on " + device.getName() + ": " + handle.getDlt(), null);
                return;
            }
            logger.info("Capturing lighting traffic on {} (snaplen={}, timeout={}ms)", device.getName(),
                    snapLength, readTimeout);
            while (active.get()) {
                final byte[] frame = handle.getNextRawPacket();
                if (frame == null) {
                    continue;  // Read timed out, go check whether we should stop.
                }
                packetsCaptured.incrementAndGet();
                final UdpDatagram datagram = FrameParser.parse(frame);
                if (datagram != null) {
                    try {
                        handler.datagramCaptured(datagram);
                    } catch (Throwable t) {
                        logger.warn("Problem processing captured datagram " + datagram, t);
                    }
                }
            }
            logger.info("Stopped capturing on {} after {} frames", device.getName(), packetsCaptured.get());
        } catch (Throwable t) {
            fail("Capture on " + device.getName() + " failed: " + t.getMessage(), t);
        } finally {
            handle.close();
        }
    }

    private void fail(String message, Throwable cause) {
        lastError.set(message);
        logger.warn(message, cause);
    }

    @Override
    public void stop() {
        final Thread thread;
        synchronized (this) {
            active.set(false);
            thread = worker.get();
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(readTimeout * 2L + 100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return worker.get() != null;
    }

    @Override
    public CaptureStatus getStatus() {
        return new CaptureStatus(true, isRunning(), interfaceName, packetsCaptured.get(), lastError.get());
    }
}
