package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.Util;
import org.deepsymmetry.lxmonitor.artnet.ArtPollReply;
import org.deepsymmetry.lxmonitor.sacn.Sacn;
import org.deepsymmetry.lxmonitor.sacn.SacnDiscovery;
import org.deepsymmetry.lxmonitor.sacn.SacnSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps track of every Art-Net and sACN source seen on the network, along with the statistics used to diagnose
 * problems with each one. Updated by every packet that can be attributed to a source, and by a maintenance sweep
 * that should be run about once a second to age out silent sources and find universes being sent by more than
 * one source.
 *
 * <p>Safe to use from any number of threads: many may read at once, and writers take turns.</p>
 */
@API(status = API.Status.STABLE)
public class SourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

    /**
     * The priority assumed for sACN sources we have only heard of through universe discovery.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_SACN_PRIORITY = 100;

    /**
     * The identifier sACN receivers are given when we only know of them by the traffic sent to them.
     */
    private static final byte[] ZERO_CID = new byte[16];

    /**
     * Everything we track about a single source. Only touched while holding the write lock, or the read lock when
     * taking snapshots.
     */
    static class Entry {
        final String id;
        final Protocol protocol;
        final FpsCounter fpsCounter = new FpsCounter();
        final SequenceTracker sequenceTracker = new SequenceTracker();
        final LatencyTracker latencyTracker = new LatencyTracker();
        final TreeSet<Integer> universes = new TreeSet<>();
        final List<Integer> duplicateUniverses = new ArrayList<>();

        InetAddress address;
        String name;
        SourceStatus status = SourceStatus.ACTIVE;
        SourceDirection direction = SourceDirection.UNKNOWN;
        double fps;
        long packetCount;
        long firstSeen;
        long lastSeen;
        long lastPacketNanos;
        double packetLossPercent;
        FpsWarning fpsWarning = FpsWarning.NONE;
        double latencyJitterMillis;
        String shortName;
        String longName;
        String macAddress;
        String cid;
        Integer priority;

        Entry(String id, Protocol protocol, InetAddress address, String name, long wallClock, long now) {
            this.id = id;
            this.protocol = protocol;
            this.address = address;
            this.name = name;
            firstSeen = wallClock;
            lastSeen = wallClock;
            lastPacketNanos = now;
        }
    }

    private final TimeSource timeSource;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * The sources we know about, keyed by identifier.
     */
    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * Which sources claim each universe, as of the last sweep.
     */
    private Map<Integer, List<String>> universeIndex = Collections.emptyMap();

    /**
     * Create a registry that uses the system clocks.
     */
    @API(status = API.Status.STABLE)
    public SourceRegistry() {
        this(TimeSource.SYSTEM);
    }

    /**
     * Create a registry that takes its time from the supplied source.
     *
     * @param timeSource the clocks to consult
     */
    @API(status = API.Status.STABLE)
    public SourceRegistry(TimeSource timeSource) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource must not be null");
        }
        this.timeSource = timeSource;
    }

    /**
     * Build the display name for an Art-Net node.
     */
    private static String artNetName(InetAddress address, String shortName, String longName) {
        if (longName != null && !longName.isEmpty()) {
            return longName;
        }
        if (shortName != null && !shortName.isEmpty()) {
            return shortName;
        }
        return "ArtNet @ " + address.getHostAddress();
    }

    private static String sacnName(InetAddress address, String sourceName) {
        if (sourceName != null && !sourceName.isEmpty()) {
            return sourceName;
        }
        return "sACN @ " + address.getHostAddress();
    }

    /**
     * Find the entry with the given identifier, creating it if this is the first we have heard of it.
     * Must be called while holding the write lock.
     */
    private Entry findOrCreate(String id, Protocol protocol, InetAddress address, String name, long now) {
        Entry entry = entries.get(id);
        if (entry == null) {
            entry = new Entry(id, protocol, address, name, timeSource.currentTimeMillis(), now);
            entries.put(id, entry);
            logger.info("Found new {} source {} ({}) at {}", protocol.displayName, id, name, address.getHostAddress());
        }
        return entry;
    }

    /**
     * Record the arrival of a packet for an entry, and bring its statistics up to date.
     * Must be called while holding the write lock.
     *
     * @param sequence the sequence number the packet carried, or {@code null} if it is not one whose loss we track
     * @param timed whether the packet is part of a regular stream which should count towards rate and jitter
     */
    private void touch(Entry entry, InetAddress address, SourceDirection direction, Integer sequence, boolean timed,
                       long now) {
        entry.address = address;
        entry.lastPacketNanos = now;
        entry.lastSeen = timeSource.currentTimeMillis();
        entry.packetCount++;
        entry.direction = entry.direction.escalate(direction);
        if (timed) {
            entry.fpsCounter.record(now);
            entry.latencyTracker.record(now);
        }
        if (sequence != null) {
            entry.sequenceTracker.record(sequence, now);
        }
        refresh(entry, now);
    }

    /**
     * Recompute the derived fields of an entry from its trackers and the time since its last packet.
     */
    private void refresh(Entry entry, long now) {
        entry.status = SourceStatus.forElapsed(TimeUnit.NANOSECONDS.toMillis(now - entry.lastPacketNanos));
        entry.fps = entry.fpsCounter.fps(now);
        entry.fpsWarning = FpsWarning.forRate(entry.fps);
        entry.packetLossPercent = entry.sequenceTracker.lossPercent();
        entry.latencyJitterMillis = entry.latencyTracker.jitterMillis();
    }

    /**
     * Record an Art-Net poll reply, which tells us the names, hardware address and output universes of a node.
     *
     * @param address the address of the node, as reported in the reply
     * @param reply the decoded reply
     * @param direction what the reply tells us about the flow of data to or from the node
     *
     * @return a snapshot of the updated source
     */
    @API(status = API.Status.STABLE)
    public NetworkSource updateArtNetNode(InetAddress address, ArtPollReply reply, SourceDirection direction) {
        final long now = timeSource.nanoTime();
        final String name = artNetName(address, reply.getShortName(), reply.getLongName());
        lock.writeLock().lock();
        try {
            final Entry entry = findOrCreate("artnet-" + address.getHostAddress(), Protocol.ARTNET, address, name, now);
            entry.name = name;
            entry.shortName = reply.getShortName();
            entry.longName = reply.getLongName();
            entry.macAddress = Util.formatMacAddress(reply.getMacAddress());
            entry.universes.addAll(reply.getOutputUniverses());
            touch(entry, address, direction, null, false, now);
            return new NetworkSource(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Record Art-Net DMX traffic sent by, or addressed to, a node.
     *
     * @param address the address of the node
     * @param universe the universe the traffic carried
     * @param direction whether the node was sending or receiving
     * @param sequence the sequence number of the packet, if loss should be tracked for this node, or {@code null}
     *
     * @return a snapshot of the updated source
     */
    @API(status = API.Status.STABLE)
    public NetworkSource updateArtNetTraffic(InetAddress address, int universe, SourceDirection direction,
                                             Integer sequence) {
        final long now = timeSource.nanoTime();
        lock.writeLock().lock();
        try {
            final Entry entry = findOrCreate("artnet-" + address.getHostAddress(), Protocol.ARTNET, address,
                    artNetName(address, null, null), now);
            entry.universes.add(universe);
            touch(entry, address, direction, sequence, true, now);
            return new NetworkSource(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Record an sACN data packet from a source.
     *
     * @param address the address the packet came from
     * @param source the framing layer details of the packet
     * @param direction whether we know the source to be sending
     *
     * @return a snapshot of the updated source
     */
    @API(status = API.Status.STABLE)
    public NetworkSource updateSacnSource(InetAddress address, SacnSource source, SourceDirection direction) {
        final long now = timeSource.nanoTime();
        final String name = sacnName(address, source.getSourceName());
        lock.writeLock().lock();
        try {
            final Entry entry = findOrCreate("sacn-" + source.getCidString(), Protocol.SACN, address, name, now);
            entry.name = name;
            entry.cid = source.getCidString();
            entry.priority = source.getPriority();
            entry.universes.add(source.getUniverse());
            touch(entry, address, direction, source.getSequence(), true, now);
            return new NetworkSource(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Record a page of sACN universe discovery, adding the universes it lists to the announcing source. Discovery
     * is sent only every ten seconds, so it does not count towards frame rate or jitter.
     *
     * @param address the address the announcement came from
     * @param discovery the decoded announcement
     *
     * @return a snapshot of the updated source
     */
    @API(status = API.Status.STABLE)
    public NetworkSource updateSacnDiscovery(InetAddress address, SacnDiscovery discovery) {
        final long now = timeSource.nanoTime();
        final String name = sacnName(address, discovery.getSourceName());
        lock.writeLock().lock();
        try {
            final Entry entry = findOrCreate("sacn-" + discovery.getCidString(), Protocol.SACN, address, name, now);
            entry.name = name;
            entry.cid = discovery.getCidString();
            if (entry.priority == null) {
                entry.priority = DEFAULT_SACN_PRIORITY;
            }
            entry.universes.addAll(discovery.getUniverses());
            touch(entry, address, SourceDirection.SENDING, null, false, now);
            return new NetworkSource(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Record sACN data that was sent directly to a device, which we can only see through packet capture. Such
     * receivers have no component identifier of their own, so they are tracked by address.
     *
     * @param address the address the data was sent to
     * @param universe the universe that was sent
     *
     * @return a snapshot of the updated source
     */
    @API(status = API.Status.STABLE)
    public NetworkSource updateSacnReceiver(InetAddress address, int universe) {
        final long now = timeSource.nanoTime();
        lock.writeLock().lock();
        try {
            final Entry entry = findOrCreate("sacn-" + address.getHostAddress(), Protocol.SACN, address,
                    sacnName(address, null), now);
            entry.cid = Sacn.cidToString(ZERO_CID);
            entry.universes.add(universe);
            touch(entry, address, SourceDirection.RECEIVING, null, true, now);
            return new NetworkSource(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Perform periodic maintenance: bring every source's status and statistics up to date, forget sources that
     * have been silent for a minute or more, and rebuild the index of which sources claim each universe so that
     * conflicts can be flagged.
     *
     * @return the number of sources that were forgotten
     */
    @API(status = API.Status.STABLE)
    public int sweep() {
        final long now = timeSource.nanoTime();
        int evicted = 0;
        lock.writeLock().lock();
        try {
            final Iterator<Entry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                final Entry entry = iterator.next();
                if (TimeUnit.NANOSECONDS.toMillis(now - entry.lastPacketNanos) >= SourceStatus.EVICT_AFTER) {
                    iterator.remove();
                    evicted++;
                    logger.info("Removing {} source {} ({}), silent for a minute", entry.protocol.displayName,
                            entry.id, entry.name);
                } else {
                    refresh(entry, now);
                }
            }

            final Map<Integer, List<String>> index = new TreeMap<>();
            for (Entry entry : entries.values()) {
                for (Integer universe : entry.universes) {
                    index.computeIfAbsent(universe, u -> new ArrayList<>()).add(entry.id);
                }
            }
            for (Entry entry : entries.values()) {
                entry.duplicateUniverses.clear();
                for (Integer universe : entry.universes) {
                    if (index.get(universe).size() > 1) {
                        entry.duplicateUniverses.add(universe);
                    }
                }
            }
            universeIndex = index;
        } finally {
            lock.writeLock().unlock();
        }
        return evicted;
    }

    /**
     * Get snapshots of every source currently known.
     *
     * @return the sources, ordered by identifier
     */
    @API(status = API.Status.STABLE)
    public List<NetworkSource> getSources() {
        final List<NetworkSource> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Entry entry : entries.values()) {
                result.add(new NetworkSource(entry));
            }
        } finally {
            lock.readLock().unlock();
        }
        result.sort((a, b) -> a.getId().compareTo(b.getId()));
        return Collections.unmodifiableList(result);
    }

    /**
     * Look up a single source.
     *
     * @param id the identifier of the source
     *
     * @return a snapshot of the source, or {@code null} if it is not known
     */
    @API(status = API.Status.STABLE)
    public NetworkSource getSource(String id) {
        lock.readLock().lock();
        try {
            final Entry entry = entries.get(id);
            return (entry == null) ? null : new NetworkSource(entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Find the sources which claimed a universe as of the last maintenance sweep.
     *
     * @param universe the universe of interest
     *
     * @return the identifiers of the sources, empty if there are none
     */
    @API(status = API.Status.STABLE)
    public List<String> getSourceIdsForUniverse(int universe) {
        lock.readLock().lock();
        try {
            final List<String> ids = universeIndex.get(universe);
            return (ids == null) ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<>(ids));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Forget every source. Called when monitoring stops.
     */
    @API(status = API.Status.STABLE)
    public void flush() {
        lock.writeLock().lock();
        try {
            entries.clear();
            universeIndex = Collections.emptyMap();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
