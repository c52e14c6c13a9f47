package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;

import java.lang.ref.WeakReference;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Provides utility functions shared by the protocol decoders and the components that watch the network.
 */
@API(status = API.Status.STABLE)
public class Util {

    /**
     * Converts a signed byte to its unsigned int equivalent in the range 0-255.
     *
     * @param b a byte value to be considered an unsigned integer
     *
     * @return the unsigned version of the byte
     */
    public static int unsign(byte b) {
        return b & 0xff;
    }

    /**
     * Reconstructs a number that is represented by more than one byte in a network packet in big-endian order.
     *
     * @param buffer the byte array containing the packet data
     * @param start the index of the first byte containing a numeric value
     * @param length the number of bytes making up the value
     * @return the reconstructed number
     */
    public static long bytesToNumber(byte[] buffer, int start, int length) {
        long result = 0;
        for (int index = start; index < start + length; index++) {
            result = (result << 8) + unsign(buffer[index]);
        }
        return result;
    }

    /**
     * Reconstructs a number that is represented by more than one byte in a network packet in little-endian order.
     * Art-Net sends its opcodes and a few other values this way.
     *
     * @param buffer the byte array containing the packet data
     * @param start the index of the first byte containing a numeric value
     * @param length the number of bytes making up the value
     * @return the reconstructed number
     */
    public static long bytesToNumberLittleEndian(byte[] buffer, int start, int length) {
        long result = 0;
        for (int index = start + length - 1; index >= start; index--) {
            result = (result << 8) + unsign(buffer[index]);
        }
        return result;
    }

    /**
     * Writes a number to the specified byte array field, breaking it into its component bytes in big-endian order.
     * If the number is too large to fit in the specified number of bytes, only the low-order bytes are written.
     *
     * @param number the number to be written to the array
     * @param buffer the buffer to which the number should be written
     * @param start where the high-order byte should be written
     * @param length how many bytes of the number should be written
     */
    public static void numberToBytes(int number, byte[] buffer, int start, int length) {
        for (int index = start + length - 1; index >= start; index--) {
            buffer[index] = (byte)(number & 0xff);
            number = number >> 8;
        }
    }

    /**
     * Writes a number to the specified byte array field in little-endian order.
     *
     * @param number the number to be written to the array
     * @param buffer the buffer to which the number should be written
     * @param start where the low-order byte should be written
     * @param length how many bytes of the number should be written
     */
    public static void numberToBytesLittleEndian(int number, byte[] buffer, int start, int length) {
        for (int index = start; index < start + length; index++) {
            buffer[index] = (byte)(number & 0xff);
            number = number >> 8;
        }
    }

    /**
     * Extracts a string from a fixed-width field of a packet. The string ends at the first zero byte (or at the
     * end of the field if there is none), and is decoded as UTF-8, replacing any malformed sequences rather than
     * failing.
     *
     * @param buffer the byte array containing the packet data
     * @param start the index at which the field begins
     * @param length the width of the field
     *
     * @return the text found in the field
     */
    public static String extractString(byte[] buffer, int start, int length) {
        int end = start;
        while (end < start + length && buffer[end] != 0) {
            end++;
        }
        return new String(buffer, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Builds an IPv4 address from four bytes found in a packet. Since the byte count is fixed, this can never
     * actually fail.
     *
     * @param buffer the byte array containing the packet data
     * @param start the index of the first (most significant) byte of the address
     *
     * @return the address
     */
    public static InetAddress addressFromBytes(byte[] buffer, int start) {
        final byte[] raw = new byte[4];
        System.arraycopy(buffer, start, raw, 0, 4);
        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Four-byte address was rejected", e);
        }
    }

    /**
     * Checks whether traffic sent to an address is meant for more than one device, in which case the address
     * tells us nothing about who is receiving it. We have no netmask to work with for captured traffic, so any IPv4
     * address ending in 255 is treated as a directed broadcast, which is how Art-Net networks use them in practice.
     *
     * @param address the destination address of some traffic
     *
     * @return {@code true} if the address is a multicast, limited broadcast, directed broadcast, or wildcard address
     */
    public static boolean isGroupAddress(InetAddress address) {
        if (address.isMulticastAddress() || address.isAnyLocalAddress()) {
            return true;
        }
        if (address instanceof Inet4Address) {
            final byte[] raw = address.getAddress();
            return unsign(raw[3]) == 0xff;
        }
        return false;
    }

    /**
     * Formats a hardware address the way network tools show them.
     *
     * @param mac the six bytes of an Ethernet address
     *
     * @return the colon-separated, upper-case hexadecimal form of the address
     */
    public static String formatMacAddress(byte[] mac) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mac.length; i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(String.format("%02X", unsign(mac[i])));
        }
        return sb.toString();
    }

    /**
     * Adds a listener to a list of weak references, unless it is {@code null} or already present.
     *
     * @param listeners the list of registered listeners
     * @param listener the listener to add
     * @param <T> the type of listener
     */
    static <T> void addListener(List<WeakReference<T>> listeners, T listener) {
        if (listener == null) {
            return;
        }
        for (WeakReference<T> reference : listeners) {
            if (reference.get() == listener) {
                return;
            }
        }
        listeners.add(new WeakReference<>(listener));
    }

    /**
     * Removes a listener from a list of weak references, also cleaning out any references whose listeners have
     * been garbage collected.
     *
     * @param listeners the list of registered listeners
     * @param listener the listener to remove
     * @param <T> the type of listener
     */
    static <T> void removeListener(List<WeakReference<T>> listeners, T listener) {
        final Iterator<WeakReference<T>> iterator = listeners.iterator();
        while (iterator.hasNext()) {
            final T candidate = iterator.next().get();
            if (candidate == null || candidate == listener) {
                iterator.remove();
            }
        }
    }

    /**
     * Collects the listeners which are still reachable from a list of weak references.
     *
     * @param listeners the list of registered listeners
     * @param <T> the type of listener
     *
     * @return the listeners that have not been garbage collected
     */
    static <T> Set<T> gatherListeners(List<WeakReference<T>> listeners) {
        final Set<T> result = new HashSet<>();
        for (WeakReference<T> reference : listeners) {
            final T listener = reference.get();
            if (listener != null) {
                result.add(listener);
            }
        }
        return result;
    }

    /**
     * Prevent instantiation.
     */
    private Util() {
        // Nothing to do.
    }
}
