package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;
import org.pcap4j.core.Pcaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the packet capture implementation to use, depending on whether a capture driver can be loaded.
 */
@API(status = API.Status.STABLE)
public final class PacketCaptures {

    private static final Logger logger = LoggerFactory.getLogger(PacketCaptures.class);

    /**
     * Probe for the native capture library, and return a capture that uses it if it is present, or one that
     * reports capture as unavailable if it is not.
     *
     * @param snapLength the most bytes of each frame to capture
     * @param readTimeout how many milliseconds a capture read may wait for a frame
     *
     * @return the capture implementation to use
     */
    @API(status = API.Status.STABLE)
    public static PacketCapture select(int snapLength, int readTimeout) {
        try {
            Pcaps.findAllDevs();
            logger.info("Packet capture driver found: {}", Pcaps.libVersion());
            return new Pcap4jPacketCapture(snapLength, readTimeout);
        } catch (Throwable t) {
            // Missing native libraries show up as linkage errors rather than exceptions.
            logger.info("Packet capture unavailable: {}", t.toString());
            return new UnavailablePacketCapture("No packet capture driver could be loaded (" + t + ")");
        }
    }

    private PacketCaptures() {
        // Prevent instantiation.
    }
}
