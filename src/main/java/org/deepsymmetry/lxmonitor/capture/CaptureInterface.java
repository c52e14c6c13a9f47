package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;

/**
 * A network interface on which packets can be captured.
 */
@API(status = API.Status.STABLE)
public final class CaptureInterface {

    private final String name;
    private final String description;

    @API(status = API.Status.STABLE)
    public CaptureInterface(String name, String description) {
        this.name = name;
        this.description = description;
    }

    /**
     * Get the name by which the capture driver knows the interface, which is what must be passed to
     * {@link PacketCapture#start(String, PacketCapture.DatagramHandler)}.
     *
     * @return the interface name
     */
    @API(status = API.Status.STABLE)
    public String getName() {
        return name;
    }

    /**
     * Get the human-readable description of the interface, if the driver provides one.
     *
     * @return the description, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "CaptureInterface[name:" + name + ", description:" + description + "]";
    }
}
