package org.deepsymmetry.lxmonitor.sacn;

import org.apiguardian.api.API;

/**
 * <p>The packets which {@link Sacn#decode(byte[], int)} can produce. The set of variants is closed: the only
 * subclasses are {@link SacnDmx}, {@link SacnSync}, {@link SacnDiscovery} and {@link SacnUnknown}. Consume them
 * through a {@link Visitor} so that every kind is accounted for.</p>
 */
@API(status = API.Status.STABLE)
public abstract class SacnPacket {

    /**
     * Handles each kind of sACN packet.
     *
     * @param <T> the type of value produced by visiting a packet
     */
    @API(status = API.Status.STABLE)
    public interface Visitor<T> {

        T visitDmx(SacnDmx dmx);

        T visitSync(SacnSync sync);

        T visitDiscovery(SacnDiscovery discovery);

        T visitUnknown(SacnUnknown unknown);
    }

    /**
     * Only the variants in this package may exist.
     */
    SacnPacket() {
    }

    /**
     * Pass this packet to the visitor method that handles its kind.
     *
     * @param visitor the packet handler
     * @param <T> the type of value produced by the visitor
     *
     * @return whatever the visitor returned
     */
    @API(status = API.Status.STABLE)
    public abstract <T> T accept(Visitor<T> visitor);
}
