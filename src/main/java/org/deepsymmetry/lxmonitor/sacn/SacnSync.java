package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;

/**
 * An E1.31 synchronization packet, telling receivers to act on the data they have buffered for a sync universe.
 */
@API(status = API.Status.STABLE)
public final class SacnSync extends SacnPacket {

    private final int syncAddress;

    SacnSync(int syncAddress) {
        this.syncAddress = syncAddress;
    }

    /**
     * Get the universe number on which this synchronization was sent.
     *
     * @return the synchronization address
     */
    @API(status = API.Status.STABLE)
    public int getSyncAddress() {
        return syncAddress;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSync(this);
    }

    @Override
    public String toString() {
        return "SacnSync[syncAddress:" + syncAddress + "]";
    }
}
