package org.deepsymmetry.lxmonitor.artnet;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.Util;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Describes an Art-Net node, as reported by the node itself in response to an {@link ArtPoll}. Every field comes
 * from a fixed offset in the packet; the bind address, bind index and second status byte were added by later
 * revisions of the protocol, so they are only read when the packet is long enough to contain them, and are zero
 * otherwise.
 */
@API(status = API.Status.STABLE)
public final class ArtPollReply extends ArtNetPacket {

    /**
     * The smallest packet we are willing to interpret as a poll reply.
     */
    @API(status = API.Status.STABLE)
    public static final int MINIMUM_LENGTH = 207;

    /**
     * The most ports a single poll reply can describe.
     */
    @API(status = API.Status.STABLE)
    public static final int MAXIMUM_PORTS = 4;

    /**
     * The bit in a port type which indicates the port can output data from the network onto a DMX line.
     */
    @API(status = API.Status.STABLE)
    public static final int PORT_TYPE_OUTPUT = 0x80;

    private final InetAddress address;
    private final int port;
    private final int versionInfo;
    private final int netSwitch;
    private final int subSwitch;
    private final int oem;
    private final int ubeaVersion;
    private final int status1;
    private final int estaManufacturer;
    private final String shortName;
    private final String longName;
    private final String nodeReport;
    private final int numPorts;
    private final byte[] portTypes = new byte[MAXIMUM_PORTS];
    private final byte[] goodInput = new byte[MAXIMUM_PORTS];
    private final byte[] goodOutput = new byte[MAXIMUM_PORTS];
    private final byte[] swIn = new byte[MAXIMUM_PORTS];
    private final byte[] swOut = new byte[MAXIMUM_PORTS];
    private final int style;
    private final byte[] macAddress = new byte[6];
    private final byte[] bindIp = new byte[4];
    private final int bindIndex;
    private final int status2;

    /**
     * Constructor sets all the immutable interpreted fields based on the packet content.
     *
     * @param data the packet that was received
     * @param length the number of bytes of the packet that are valid, at least {@link #MINIMUM_LENGTH}
     */
    ArtPollReply(byte[] data, int length) {
        if (length < MINIMUM_LENGTH) {
            throw new IllegalArgumentException("ArtPollReply packet must be at least " + MINIMUM_LENGTH + " bytes long");
        }
        address = Util.addressFromBytes(data, 10);
        port = (int) Util.bytesToNumberLittleEndian(data, 14, 2);
        versionInfo = (int) Util.bytesToNumber(data, 16, 2);
        netSwitch = Util.unsign(data[18]);
        subSwitch = Util.unsign(data[19]);
        oem = (int) Util.bytesToNumber(data, 20, 2);
        ubeaVersion = Util.unsign(data[22]);
        status1 = Util.unsign(data[23]);
        estaManufacturer = (int) Util.bytesToNumberLittleEndian(data, 24, 2);
        shortName = Util.extractString(data, 26, 18);
        longName = Util.extractString(data, 44, 64);
        nodeReport = Util.extractString(data, 108, 64);
        numPorts = (int) Util.bytesToNumber(data, 172, 2);
        System.arraycopy(data, 174, portTypes, 0, MAXIMUM_PORTS);
        System.arraycopy(data, 178, goodInput, 0, MAXIMUM_PORTS);
        System.arraycopy(data, 182, goodOutput, 0, MAXIMUM_PORTS);
        System.arraycopy(data, 186, swIn, 0, MAXIMUM_PORTS);
        System.arraycopy(data, 190, swOut, 0, MAXIMUM_PORTS);

        // Trailing fields, present only in packets from newer nodes.
        style = Util.unsign(data[200]);
        System.arraycopy(data, 201, macAddress, 0, 6);
        if (length >= 211) {
            System.arraycopy(data, 207, bindIp, 0, 4);
        }
        bindIndex = (length > 211) ? Util.unsign(data[211]) : 0;
        status2 = (length > 212) ? Util.unsign(data[212]) : 0;
    }

    @Override
    public ArtNetOpCode getOpCode() {
        return ArtNetOpCode.OP_POLL_REPLY;
    }

    /**
     * Get the address the node reports for itself, which is how nodes are identified even when the reply is relayed.
     *
     * @return the node's IPv4 address
     */
    @API(status = API.Status.STABLE)
    public InetAddress getAddress() {
        return address;
    }

    @API(status = API.Status.STABLE)
    public int getPort() {
        return port;
    }

    /**
     * Get the node's firmware revision.
     *
     * @return the version number, high byte first
     */
    @API(status = API.Status.STABLE)
    public int getVersionInfo() {
        return versionInfo;
    }

    /**
     * Get the net switch, bits 14-8 of the port addresses of this node.
     *
     * @return the net switch value
     */
    @API(status = API.Status.STABLE)
    public int getNetSwitch() {
        return netSwitch;
    }

    /**
     * Get the sub-net switch, bits 7-4 of the port addresses of this node.
     *
     * @return the sub-net switch value
     */
    @API(status = API.Status.STABLE)
    public int getSubSwitch() {
        return subSwitch;
    }

    @API(status = API.Status.STABLE)
    public int getOem() {
        return oem;
    }

    @API(status = API.Status.STABLE)
    public int getUbeaVersion() {
        return ubeaVersion;
    }

    @API(status = API.Status.STABLE)
    public int getStatus1() {
        return status1;
    }

    /**
     * Get the ESTA code of the manufacturer of the node.
     *
     * @return the manufacturer code, sent low byte first
     */
    @API(status = API.Status.STABLE)
    public int getEstaManufacturer() {
        return estaManufacturer;
    }

    @API(status = API.Status.STABLE)
    public String getShortName() {
        return shortName;
    }

    @API(status = API.Status.STABLE)
    public String getLongName() {
        return longName;
    }

    /**
     * Get the free-form text the node uses to report its operating status.
     *
     * @return the node report
     */
    @API(status = API.Status.STABLE)
    public String getNodeReport() {
        return nodeReport;
    }

    /**
     * Get the number of ports the node claims to have, which is not limited to the four this reply can describe.
     *
     * @return the port count
     */
    @API(status = API.Status.STABLE)
    public int getNumPorts() {
        return numPorts;
    }

    @API(status = API.Status.STABLE)
    public byte[] getPortTypes() {
        return portTypes.clone();
    }

    @API(status = API.Status.STABLE)
    public byte[] getGoodInput() {
        return goodInput.clone();
    }

    @API(status = API.Status.STABLE)
    public byte[] getGoodOutput() {
        return goodOutput.clone();
    }

    /**
     * Get the low nibbles of the port addresses of the input ports.
     *
     * @return the four input switch values
     */
    @API(status = API.Status.STABLE)
    public byte[] getSwIn() {
        return swIn.clone();
    }

    /**
     * Get the low nibbles of the port addresses of the output ports.
     *
     * @return the four output switch values
     */
    @API(status = API.Status.STABLE)
    public byte[] getSwOut() {
        return swOut.clone();
    }

    @API(status = API.Status.STABLE)
    public int getStyle() {
        return style;
    }

    /**
     * Get the Ethernet address of the node.
     *
     * @return the six bytes of the hardware address, all zero if the node did not send one
     */
    @API(status = API.Status.STABLE)
    public byte[] getMacAddress() {
        return macAddress.clone();
    }

    /**
     * Get the address of the root device when this node is one of several bound together.
     *
     * @return the four bytes of the bind address, all zero if the node did not send one
     */
    @API(status = API.Status.STABLE)
    public byte[] getBindIp() {
        return bindIp.clone();
    }

    @API(status = API.Status.STABLE)
    public int getBindIndex() {
        return bindIndex;
    }

    @API(status = API.Status.STABLE)
    public int getStatus2() {
        return status2;
    }

    /**
     * Figure out which universes this node outputs. Each of the ports described by this reply whose type marks it
     * as an output contributes the port address built from the net switch, sub-net switch, and its output switch.
     *
     * @return the universes (port addresses) of the output ports, in port order
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getOutputUniverses() {
        final List<Integer> result = new ArrayList<>();
        final int ports = Math.min(numPorts, MAXIMUM_PORTS);
        for (int i = 0; i < ports; i++) {
            if ((portTypes[i] & PORT_TYPE_OUTPUT) != 0) {
                result.add(ArtNet.calculateUniverse(netSwitch, subSwitch, Util.unsign(swOut[i])));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitPollReply(this);
    }

    @Override
    public String toString() {
        return "ArtPollReply[address:" + address.getHostAddress() + ", shortName:" + shortName +
                ", longName:" + longName + ", ports:" + numPorts + ", mac:" + Util.formatMacAddress(macAddress) + "]";
    }
}
