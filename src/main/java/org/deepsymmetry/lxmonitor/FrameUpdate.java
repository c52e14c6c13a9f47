package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.data.Protocol;

import java.net.InetAddress;

/**
 * Reports the arrival of a frame of DMX data for a universe.
 */
@API(status = API.Status.STABLE)
public final class FrameUpdate {

    private final int universe;
    private final InetAddress sourceAddress;
    private final Protocol protocol;
    private final long timestamp;
    private final byte[] data;

    FrameUpdate(int universe, InetAddress sourceAddress, Protocol protocol, long timestamp, byte[] data) {
        this.universe = universe;
        this.sourceAddress = sourceAddress;
        this.protocol = protocol;
        this.timestamp = timestamp;
        this.data = data.clone();
    }

    @API(status = API.Status.STABLE)
    public int getUniverse() {
        return universe;
    }

    /**
     * Get the address of the device which sent the frame.
     *
     * @return the sender's address
     */
    @API(status = API.Status.STABLE)
    public InetAddress getSourceAddress() {
        return sourceAddress;
    }

    @API(status = API.Status.STABLE)
    public Protocol getProtocol() {
        return protocol;
    }

    /**
     * Get the time at which the frame was processed.
     *
     * @return milliseconds since the epoch
     */
    @API(status = API.Status.STABLE)
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Get the slot values of the frame.
     *
     * @return a copy of the data, up to 512 bytes
     */
    @API(status = API.Status.STABLE)
    public byte[] getData() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "FrameUpdate[universe:" + universe + ", source:" + sourceAddress.getHostAddress() + ", protocol:" +
                protocol + ", timestamp:" + timestamp + ", slots:" + data.length + "]";
    }
}
