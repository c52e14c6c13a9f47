package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;

import java.util.List;

/**
 * Watches an interface in promiscuous mode for Art-Net and sACN traffic, including traffic addressed to other
 * hosts, which ordinary sockets never see. Whether this is possible depends on a capture driver being installed,
 * so an implementation is chosen at startup by {@link PacketCaptures#select(int, int)}.
 */
@API(status = API.Status.STABLE)
public interface PacketCapture {

    /**
     * The filter restricting capture to the two lighting protocols.
     */
    String FILTER = "udp port 6454 or udp port 5568";

    /**
     * Receives the datagrams found by capture. Called on the capture thread, so it must not block for long.
     */
    interface DatagramHandler {

        /**
         * Process a captured datagram.
         *
         * @param datagram the datagram found in a captured frame
         */
        void datagramCaptured(UdpDatagram datagram);
    }

    /**
     * Check whether capture can be used at all.
     *
     * @return {@code true} if a capture driver is present
     */
    boolean isAvailable();

    /**
     * List the interfaces on which capture could be started.
     *
     * @return the interfaces, empty if capture is unavailable or none can be opened
     */
    List<CaptureInterface> getInterfaces();

    /**
     * Begin capturing on a dedicated thread. Problems opening the interface once the thread is running are
     * reported through {@link #getStatus()} rather than thrown.
     *
     * @param interfaceName the interface to open, or {@code null} to use the first one available
     * @param handler the recipient of every datagram found
     *
     * @throws IllegalStateException if capture is unavailable or already running
     * @throws IllegalArgumentException if there is no interface with the given name
     */
    void start(String interfaceName, DatagramHandler handler);

    /**
     * Stop capturing, if capture is running. Returns once the capture thread has noticed, or after a short wait.
     */
    void stop();

    /**
     * Check whether the capture thread is running.
     *
     * @return {@code true} if frames are being captured
     */
    boolean isRunning();

    /**
     * Describe the current state of capture.
     *
     * @return a snapshot of the status
     */
    CaptureStatus getStatus();
}
