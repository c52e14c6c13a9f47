package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.List;

/**
 * A page of an E1.31 universe discovery announcement, listing universes a source is transmitting.
 */
@API(status = API.Status.STABLE)
public final class SacnDiscovery extends SacnPacket {

    private final byte[] cid;
    private final String sourceName;
    private final int page;
    private final int lastPage;
    private final List<Integer> universes;

    SacnDiscovery(byte[] cid, String sourceName, int page, int lastPage, List<Integer> universes) {
        this.cid = cid.clone();
        this.sourceName = sourceName;
        this.page = page;
        this.lastPage = lastPage;
        this.universes = Collections.unmodifiableList(universes);
    }

    /**
     * Get the component identifier of the announcing source.
     *
     * @return a copy of the sixteen CID bytes
     */
    @API(status = API.Status.STABLE)
    public byte[] getCid() {
        return cid.clone();
    }

    @API(status = API.Status.STABLE)
    public String getCidString() {
        return Sacn.cidToString(cid);
    }

    @API(status = API.Status.STABLE)
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Get the page number of this announcement, when a source has too many universes to fit in one packet.
     *
     * @return the zero-based page number
     */
    @API(status = API.Status.STABLE)
    public int getPage() {
        return page;
    }

    @API(status = API.Status.STABLE)
    public int getLastPage() {
        return lastPage;
    }

    /**
     * Get the universes listed on this page.
     *
     * @return the non-zero universe numbers, in the order they appeared
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getUniverses() {
        return universes;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDiscovery(this);
    }

    @Override
    public String toString() {
        return "SacnDiscovery[cid:" + getCidString() + ", name:" + sourceName + ", page:" + page + "/" + lastPage +
                ", universes:" + universes + "]";
    }
}
