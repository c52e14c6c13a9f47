package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;

/**
 * A snapshot of the state of packet capture.
 */
@API(status = API.Status.STABLE)
public final class CaptureStatus {

    private final boolean available;
    private final boolean enabled;
    private final String interfaceName;
    private final long packetsCaptured;
    private final String lastError;

    @API(status = API.Status.STABLE)
    public CaptureStatus(boolean available, boolean enabled, String interfaceName, long packetsCaptured,
                         String lastError) {
        this.available = available;
        this.enabled = enabled;
        this.interfaceName = interfaceName;
        this.packetsCaptured = packetsCaptured;
        this.lastError = lastError;
    }

    /**
     * Check whether a capture driver is installed, so that capture can be enabled at all.
     *
     * @return {@code true} if capture is possible
     */
    @API(status = API.Status.STABLE)
    public boolean isAvailable() {
        return available;
    }

    @API(status = API.Status.STABLE)
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Get the interface on which capture is running, or last ran.
     *
     * @return the interface name, or {@code null} if capture has never been started
     */
    @API(status = API.Status.STABLE)
    public String getInterfaceName() {
        return interfaceName;
    }

    /**
     * Get the number of frames captured since capture was last started.
     *
     * @return the frame count
     */
    @API(status = API.Status.STABLE)
    public long getPacketsCaptured() {
        return packetsCaptured;
    }

    /**
     * Get a description of the most recent problem, if any, which stopped capture or prevented it from starting.
     *
     * @return the error message, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public String getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "CaptureStatus[available:" + available + ", enabled:" + enabled + ", interface:" + interfaceName +
                ", packets:" + packetsCaptured + ", lastError:" + lastError + "]";
    }
}
