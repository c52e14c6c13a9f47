package org.deepsymmetry.lxmonitor.capture;

import org.apiguardian.api.API;

import java.net.InetAddress;

/**
 * A UDP datagram recovered from a captured link-layer frame. Unlike one received on a socket, it tells us where
 * the datagram was going as well as where it came from.
 */
@API(status = API.Status.STABLE)
public final class UdpDatagram {

    private final InetAddress sourceAddress;
    private final InetAddress destinationAddress;
    private final int sourcePort;
    private final int destinationPort;
    private final byte[] payload;

    UdpDatagram(InetAddress sourceAddress, InetAddress destinationAddress, int sourcePort, int destinationPort,
                byte[] payload) {
        this.sourceAddress = sourceAddress;
        this.destinationAddress = destinationAddress;
        this.sourcePort = sourcePort;
        this.destinationPort = destinationPort;
        this.payload = payload;
    }

    @API(status = API.Status.STABLE)
    public InetAddress getSourceAddress() {
        return sourceAddress;
    }

    @API(status = API.Status.STABLE)
    public InetAddress getDestinationAddress() {
        return destinationAddress;
    }

    @API(status = API.Status.STABLE)
    public int getSourcePort() {
        return sourcePort;
    }

    @API(status = API.Status.STABLE)
    public int getDestinationPort() {
        return destinationPort;
    }

    /**
     * Get the bytes the datagram carried.
     *
     * @return the payload itself, not a copy; callers must not modify it
     */
    @API(status = API.Status.STABLE)
    public byte[] getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "UdpDatagram[" + sourceAddress.getHostAddress() + ":" + sourcePort + " -> " +
                destinationAddress.getHostAddress() + ":" + destinationPort + ", " + payload.length + " bytes]";
    }
}
