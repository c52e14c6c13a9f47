package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

/**
 * The lighting control protocols a source can be seen speaking.
 */
@API(status = API.Status.STABLE)
public enum Protocol {
    ARTNET("Art-Net"),
    SACN("sACN");

    /**
     * The name by which the protocol is usually written.
     */
    public final String displayName;

    Protocol(String displayName) {
        this.displayName = displayName;
    }
}
