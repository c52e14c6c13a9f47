package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.List;

/**
 * Stands in for packet capture when no capture driver is installed. Reports itself unavailable and refuses to
 * start.
 */
@API(status = API.Status.STABLE)
public class UnavailablePacketCapture implements PacketCapture {

    private final String reason;

    /**
     * Create an instance explaining why capture cannot be used.
     *
     * @param reason the explanation, reported as the last error
     */
    @API(status = API.Status.STABLE)
    public UnavailablePacketCapture(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public List<CaptureInterface> getInterfaces() {
        return Collections.emptyList();
    }

    @Override
    public void start(String interfaceName, DatagramHandler handler) {
        throw new IllegalStateException("Packet capture is not available: " + reason);
    }

    @Override
    public void stop() {
        // Never started.
    }

    @Override
    public boolean isRunning() {
        return false;
    }

    @Override
    public CaptureStatus getStatus() {
        return new CaptureStatus(false, false, null, 0, reason);
    }
}
