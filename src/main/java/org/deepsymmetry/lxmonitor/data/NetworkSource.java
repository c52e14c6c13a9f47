package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable snapshot of what is known about one device seen on the lighting network. Snapshots are taken
 * from the {@link SourceRegistry}; to see newer information, ask the registry again.
 */
@API(status = API.Status.STABLE)
public final class NetworkSource {

    private final String id;
    private final InetAddress address;
    private final String name;
    private final Protocol protocol;
    private final List<Integer> universes;
    private final SourceStatus status;
    private final SourceDirection direction;
    private final double fps;
    private final long packetCount;
    private final long firstSeen;
    private final long lastSeen;
    private final double packetLossPercent;
    private final FpsWarning fpsWarning;
    private final List<Integer> duplicateUniverses;
    private final double latencyJitterMillis;
    private final String shortName;
    private final String longName;
    private final String macAddress;
    private final String cid;
    private final Integer priority;

    NetworkSource(SourceRegistry.Entry entry) {
        id = entry.id;
        address = entry.address;
        name = entry.name;
        protocol = entry.protocol;
        universes = Collections.unmodifiableList(new ArrayList<>(entry.universes));
        status = entry.status;
        direction = entry.direction;
        fps = entry.fps;
        packetCount = entry.packetCount;
        firstSeen = entry.firstSeen;
        lastSeen = entry.lastSeen;
        packetLossPercent = entry.packetLossPercent;
        fpsWarning = entry.fpsWarning;
        duplicateUniverses = Collections.unmodifiableList(new ArrayList<>(entry.duplicateUniverses));
        latencyJitterMillis = entry.latencyJitterMillis;
        shortName = entry.shortName;
        longName = entry.longName;
        macAddress = entry.macAddress;
        cid = entry.cid;
        priority = entry.priority;
    }

    /**
     * Get the key identifying this source: {@code artnet-} followed by its address for Art-Net nodes,
     * {@code sacn-} followed by its component identifier for sACN sources, or by its address for sACN
     * receivers which were only seen through packet capture.
     *
     * @return the unique identifier
     */
    @API(status = API.Status.STABLE)
    public String getId() {
        return id;
    }

    @API(status = API.Status.STABLE)
    public InetAddress getAddress() {
        return address;
    }

    /**
     * Get the name to show for this source: the name it gave itself if it did, otherwise the protocol and address.
     *
     * @return the display name
     */
    @API(status = API.Status.STABLE)
    public String getName() {
        return name;
    }

    @API(status = API.Status.STABLE)
    public Protocol getProtocol() {
        return protocol;
    }

    /**
     * Get the universes this source has been seen sending, receiving, or announcing.
     *
     * @return the universe numbers in ascending order, without repeats
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getUniverses() {
        return universes;
    }

    @API(status = API.Status.STABLE)
    public SourceStatus getStatus() {
        return status;
    }

    @API(status = API.Status.STABLE)
    public SourceDirection getDirection() {
        return direction;
    }

    /**
     * Get the number of packets received from this source during the last second, as of the last update or sweep.
     *
     * @return the frame rate
     */
    @API(status = API.Status.STABLE)
    public double getFps() {
        return fps;
    }

    @API(status = API.Status.STABLE)
    public long getPacketCount() {
        return packetCount;
    }

    /**
     * Get the time the source was first seen.
     *
     * @return milliseconds since the epoch
     */
    @API(status = API.Status.STABLE)
    public long getFirstSeen() {
        return firstSeen;
    }

    /**
     * Get the time of the most recent packet from the source.
     *
     * @return milliseconds since the epoch
     */
    @API(status = API.Status.STABLE)
    public long getLastSeen() {
        return lastSeen;
    }

    @API(status = API.Status.STABLE)
    public double getPacketLossPercent() {
        return packetLossPercent;
    }

    @API(status = API.Status.STABLE)
    public FpsWarning getFpsWarning() {
        return fpsWarning;
    }

    /**
     * Get the universes this source shares with at least one other source, as of the last maintenance sweep.
     * Two sources sending the same universe will fight over the receivers' levels.
     *
     * @return the conflicting universe numbers, in ascending order
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getDuplicateUniverses() {
        return duplicateUniverses;
    }

    /**
     * Get the standard deviation of the intervals between recent packets.
     *
     * @return the jitter in milliseconds
     */
    @API(status = API.Status.STABLE)
    public double getLatencyJitterMillis() {
        return latencyJitterMillis;
    }

    /**
     * Get the short name reported in an Art-Net poll reply.
     *
     * @return the name, or {@code null} for sACN sources and nodes which have not answered a poll
     */
    @API(status = API.Status.STABLE)
    public String getShortName() {
        return shortName;
    }

    @API(status = API.Status.STABLE)
    public String getLongName() {
        return longName;
    }

    /**
     * Get the hardware address reported in an Art-Net poll reply.
     *
     * @return the colon-separated address, or {@code null} if none is known
     */
    @API(status = API.Status.STABLE)
    public String getMacAddress() {
        return macAddress;
    }

    /**
     * Get the component identifier of an sACN source.
     *
     * @return the dashed hexadecimal identifier, all zeros for receivers seen only through capture, or
     *         {@code null} for Art-Net sources
     */
    @API(status = API.Status.STABLE)
    public String getCid() {
        return cid;
    }

    /**
     * Get the sACN priority most recently sent by this source.
     *
     * @return the priority, or {@code null} if none is known
     */
    @API(status = API.Status.STABLE)
    public Integer getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return "NetworkSource[id:" + id + ", name:" + name + ", address:" + address.getHostAddress() +
                ", universes:" + universes + ", status:" + status + ", direction:" + direction + ", fps:" + fps +
                ", packets:" + packetCount + ", loss:" + packetLossPercent + ", jitter:" + latencyJitterMillis +
                ", duplicates:" + duplicateUniverses + "]";
    }
}
