package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;

/**
 * <p>The packets which {@link ArtNet#decode(byte[], int)} can produce. The set of variants is closed: the only
 * subclasses are {@link ArtPoll}, {@link ArtPollReply}, {@link ArtDmx} and {@link ArtOther}, and code which
 * consumes packets should do so through a {@link Visitor}, so that the compiler points out every place that needs
 * attention if a new variant is ever added.</p>
 */
@API(status = API.Status.STABLE)
public abstract class ArtNetPacket {

    /**
     * Handles each kind of Art-Net packet.
     *
     * @param <T> the type of value produced by visiting a packet
     */
    @API(status = API.Status.STABLE)
    public interface Visitor<T> {

        T visitPoll(ArtPoll poll);

        T visitPollReply(ArtPollReply reply);

        T visitDmx(ArtDmx dmx);

        T visitOther(ArtOther other);
    }

    /**
     * Only the variants in this package may exist.
     */
    ArtNetPacket() {
    }

    /**
     * Get the operation code which identified this packet.
     *
     * @return the kind of packet
     */
    @API(status = API.Status.STABLE)
    public abstract ArtNetOpCode getOpCode();

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
