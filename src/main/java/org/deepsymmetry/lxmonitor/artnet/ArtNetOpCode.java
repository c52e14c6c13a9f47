package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The Art-Net operation codes we know how to name, along with the values which identify them in the
 * little-endian opcode field at offset 8 of every packet.
 */
@API(status = API.Status.STABLE)
public enum ArtNetOpCode {

    /**
     * Sent by controllers to discover the nodes on the network.
     */
    OP_POLL(0x2000, "ArtPoll"),

    /**
     * Sent by nodes in response to a poll, describing themselves and their ports.
     */
    OP_POLL_REPLY(0x2100, "ArtPollReply"),

    /**
     * Carries a frame of zero start code DMX512 data for one universe.
     */
    OP_DMX(0x5000, "ArtDmx"),

    /**
     * Carries a frame of non-zero start code data.
     */
    OP_NZS(0x5100, "ArtNzs"),

    /**
     * Tells nodes to output the data they have buffered.
     */
    OP_SYNC(0x5200, "ArtSync"),

    OP_ADDRESS(0x6000, "ArtAddress"),

    OP_INPUT(0x7000, "ArtInput"),

    OP_TOD_REQUEST(0x8000, "ArtTodRequest"),

    OP_TOD_DATA(0x8100, "ArtTodData"),

    OP_TOD_CONTROL(0x8200, "ArtTodControl"),

    OP_RDM(0x8300, "ArtRdm"),

    OP_RDM_SUB(0x8400, "ArtRdmSub"),

    OP_IP_PROG(0xf800, "ArtIpProg"),

    OP_IP_PROG_REPLY(0xf900, "ArtIpProgReply"),

    /**
     * Stands for any opcode we do not recognize; the raw value is kept by the {@link ArtOther} packet.
     */
    UNKNOWN(0xffff, "Unknown");

    /**
     * The value that appears in the opcode field which identifies this kind of packet.
     */
    @API(status = API.Status.STABLE)
    public final int protocolValue;

    /**
     * The name by which the Art-Net specification describes this kind of packet.
     */
    @API(status = API.Status.STABLE)
    public final String name;

    ArtNetOpCode(int value, String name) {
        protocolValue = value;
        this.name = name;
    }

    /**
     * Allows a known opcode to be looked up by its protocol value.
     */
    private static final Map<Integer, ArtNetOpCode> OPCODE_MAP;
    static {
        Map<Integer, ArtNetOpCode> scratch = new HashMap<>();
        for (ArtNetOpCode opCode : values()) {
            if (opCode != UNKNOWN) {
                scratch.put(opCode.protocolValue, opCode);
            }
        }
        OPCODE_MAP = Collections.unmodifiableMap(scratch);
    }

    /**
     * Look up the opcode corresponding to a value found in a packet.
     *
     * @param value the sixteen-bit opcode value
     *
     * @return the matching opcode, or {@link #UNKNOWN} if it is not one we know
     */
    @API(status = API.Status.STABLE)
    public static ArtNetOpCode forValue(int value) {
        return OPCODE_MAP.getOrDefault(value, UNKNOWN);
    }
}
