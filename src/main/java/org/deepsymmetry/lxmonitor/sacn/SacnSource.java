package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;

/**
 * Identifies the sender of an sACN data packet, along with the framing layer fields that describe how it is
 * sending the universe the packet belongs to.
 */
@API(status = API.Status.STABLE)
public final class SacnSource {

    /**
     * The sixteen byte component identifier of the sender.
     */
    private final byte[] cid;

    /**
     * The user-assigned name of the sender.
     */
    private final String sourceName;

    /**
     * The priority of this data, used by receivers to pick between multiple sources of the same universe.
     */
    private final int priority;

    /**
     * The universe on which synchronization packets for this data are sent, or zero if it is unsynchronized.
     */
    private final int syncAddress;

    /**
     * The packet sequence number.
     */
    private final int sequence;

    /**
     * The option flags (preview data, stream terminated, force synchronization).
     */
    private final int options;

    /**
     * The universe to which the data belongs.
     */
    private final int universe;

    SacnSource(byte[] cid, String sourceName, int priority, int syncAddress, int sequence, int options, int universe) {
        this.cid = cid.clone();
        this.sourceName = sourceName;
        this.priority = priority;
        this.syncAddress = syncAddress;
        this.sequence = sequence;
        this.options = options;
        this.universe = universe;
    }

    /**
     * Get the component identifier of the sender.
     *
     * @return a copy of the sixteen CID bytes
     */
    @API(status = API.Status.STABLE)
    public byte[] getCid() {
        return cid.clone();
    }

    /**
     * Get the component identifier of the sender in the textual form used to identify sources.
     *
     * @return the CID as a dashed, lower-case UUID string
     */
    @API(status = API.Status.STABLE)
    public String getCidString() {
        return Sacn.cidToString(cid);
    }

    @API(status = API.Status.STABLE)
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Get the priority of the data.
     *
     * @return a value which is supposed to lie between 0 and 200
     */
    @API(status = API.Status.STABLE)
    public int getPriority() {
        return priority;
    }

    @API(status = API.Status.STABLE)
    public int getSyncAddress() {
        return syncAddress;
    }

    @API(status = API.Status.STABLE)
    public int getSequence() {
        return sequence;
    }

    @API(status = API.Status.STABLE)
    public int getOptions() {
        return options;
    }

    @API(status = API.Status.STABLE)
    public int getUniverse() {
        return universe;
    }

    @Override
    public String toString() {
        return "SacnSource[cid:" + getCidString() + ", name:" + sourceName + ", priority:" + priority +
                ", universe:" + universe + ", sequence:" + sequence + ", syncAddress:" + syncAddress +
                ", options:" + options + "]";
    }
}
