package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.artnet.ArtNet;
import org.deepsymmetry.lxmonitor.sacn.Sacn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Properties;

/**
 * The settings which control how the {@link NetworkMonitor} listens to the network. Instances are immutable;
 * create them with a {@link Builder}, or with {@link #load()} to use the defaults found in the
 * {@code lx-monitor.properties} resource as overridden by any {@code lxmonitor.*} system properties.
 */
@API(status = API.Status.STABLE)
public final class MonitorConfig {

    private static final Logger logger = LoggerFactory.getLogger(MonitorConfig.class);

    /**
     * The class path resource from which default settings are read.
     */
    public static final String RESOURCE = "/lx-monitor.properties";

    /**
     * The prefix shared by all configuration property names.
     */
    public static final String PREFIX = "lxmonitor.";

    public static final String BIND_ADDRESS = PREFIX + "bindAddress";
    public static final String ARTNET_PORT = PREFIX + "artnet.port";
    public static final String SACN_PORT = PREFIX + "sacn.port";
    public static final String FIRST_UNIVERSE = PREFIX + "sacn.firstUniverse";
    public static final String LAST_UNIVERSE = PREFIX + "sacn.lastUniverse";
    public static final String POLL_INTERVAL = PREFIX + "artnet.pollInterval";
    public static final String BROADCAST_ADDRESS = PREFIX + "artnet.broadcastAddress";
    public static final String MAINTENANCE_INTERVAL = PREFIX + "maintenanceInterval";
    public static final String EVENT_QUEUE_CAPACITY = PREFIX + "eventQueueCapacity";
    public static final String CAPTURE_SNAP_LENGTH = PREFIX + "capture.snapLength";
    public static final String CAPTURE_READ_TIMEOUT = PREFIX + "capture.readTimeout";

    /**
     * The highest universe number sACN allows.
     */
    public static final int MAXIMUM_SACN_UNIVERSE = 63999;

    private final InetAddress bindAddress;
    private final int artNetPort;
    private final int sacnPort;
    private final int firstUniverse;
    private final int lastUniverse;
    private final long pollInterval;
    private final InetAddress broadcastAddress;
    private final long maintenanceInterval;
    private final int eventQueueCapacity;
    private final int captureSnapLength;
    private final int captureReadTimeout;

    private MonitorConfig(Builder builder) {
        bindAddress = builder.bindAddress;
        artNetPort = builder.artNetPort;
        sacnPort = builder.sacnPort;
        firstUniverse = builder.firstUniverse;
        lastUniverse = builder.lastUniverse;
        pollInterval = builder.pollInterval;
        broadcastAddress = builder.broadcastAddress;
        maintenanceInterval = builder.maintenanceInterval;
        eventQueueCapacity = builder.eventQueueCapacity;
        captureSnapLength = builder.captureSnapLength;
        captureReadTimeout = builder.captureReadTimeout;
    }

    /**
     * Get the local address on which the sockets are bound.
     *
     * @return the address, the wildcard address by default
     */
    @API(status = API.Status.STABLE)
    public InetAddress getBindAddress() {
        return bindAddress;
    }

    @API(status = API.Status.STABLE)
    public int getArtNetPort() {
        return artNetPort;
    }

    @API(status = API.Status.STABLE)
    public int getSacnPort() {
        return sacnPort;
    }

    /**
     * Get the lowest universe whose sACN multicast group is joined at startup.
     *
     * @return the first universe joined, 1 by default
     */
    @API(status = API.Status.STABLE)
    public int getFirstUniverse() {
        return firstUniverse;
    }

    /**
     * Get the highest universe whose sACN multicast group is joined at startup. Traffic for higher universes is
     * only received once {@link NetworkMonitor#joinUniverse(int)} is called for them.
     *
     * @return the last universe joined, 100 by default
     */
    @API(status = API.Status.STABLE)
    public int getLastUniverse() {
        return lastUniverse;
    }

    /**
     * Get how often an ArtPoll is broadcast to discover Art-Net nodes.
     *
     * @return the interval in milliseconds
     */
    @API(status = API.Status.STABLE)
    public long getPollInterval() {
        return pollInterval;
    }

    @API(status = API.Status.STABLE)
    public InetAddress getBroadcastAddress() {
        return broadcastAddress;
    }

    /**
     * Get how often the source registry is swept to update statuses and find duplicate universes.
     *
     * @return the interval in milliseconds
     */
    @API(status = API.Status.STABLE)
    public long getMaintenanceInterval() {
        return maintenanceInterval;
    }

    @API(status = API.Status.STABLE)
    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    @API(status = API.Status.STABLE)
    public int getCaptureSnapLength() {
        return captureSnapLength;
    }

    @API(status = API.Status.STABLE)
    public int getCaptureReadTimeout() {
        return captureReadTimeout;
    }

    /**
     * Create a builder starting from the built-in defaults.
     *
     * @return a new builder
     */
    @API(status = API.Status.STABLE)
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder starting from the settings of this configuration.
     *
     * @return a new builder
     */
    @API(status = API.Status.STABLE)
    public Builder toBuilder() {
        return new Builder()
                .bindAddress(bindAddress)
                .artNetPort(artNetPort)
                .sacnPort(sacnPort)
                .universeRange(firstUniverse, lastUniverse)
                .pollInterval(pollInterval)
                .broadcastAddress(broadcastAddress)
                .maintenanceInterval(maintenanceInterval)
                .eventQueueCapacity(eventQueueCapacity)
                .captureSnapLength(captureSnapLength)
                .captureReadTimeout(captureReadTimeout);
    }

    /**
     * Build a configuration from the {@code lx-monitor.properties} resource, if there is one, with any
     * {@code lxmonitor.*} system properties taking precedence.
     *
     * @return the configuration
     *
     * @throws IllegalArgumentException if a property has a value that cannot be used
     */
    @API(status = API.Status.STABLE)
    public static MonitorConfig load() {
        final Properties properties = new Properties();
        try (InputStream stream = MonitorConfig.class.getResourceAsStream(RESOURCE)) {
            if (stream != null) {
                properties.load(stream);
            }
        } catch (IOException e) {
            logger.warn("Unable to read " + RESOURCE + ", using built-in defaults", e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Build a configuration from a set of properties, using built-in defaults for any that are missing.
     *
     * @param properties the settings, named with the {@code lxmonitor.} prefix
     *
     * @return the configuration
     *
     * @throws IllegalArgumentException if a property has a value that cannot be used
     */
    @API(status = API.Status.STABLE)
    public static MonitorConfig fromProperties(Properties properties) {
        final Builder builder = new Builder();
        final String bind = properties.getProperty(BIND_ADDRESS);
        if (bind != null) {
            builder.bindAddress(parseAddress(BIND_ADDRESS, bind));
        }
        final String broadcast = properties.getProperty(BROADCAST_ADDRESS);
        if (broadcast != null) {
            builder.broadcastAddress(parseAddress(BROADCAST_ADDRESS, broadcast));
        }
        builder.artNetPort(intProperty(properties, ARTNET_PORT, builder.artNetPort));
        builder.sacnPort(intProperty(properties, SACN_PORT, builder.sacnPort));
        builder.universeRange(intProperty(properties, FIRST_UNIVERSE, builder.firstUniverse),
                intProperty(properties, LAST_UNIVERSE, builder.lastUniverse));
        builder.pollInterval(intProperty(properties, POLL_INTERVAL, (int) builder.pollInterval));
        builder.maintenanceInterval(intProperty(properties, MAINTENANCE_INTERVAL, (int) builder.maintenanceInterval));
        builder.eventQueueCapacity(intProperty(properties, EVENT_QUEUE_CAPACITY, builder.eventQueueCapacity));
        builder.captureSnapLength(intProperty(properties, CAPTURE_SNAP_LENGTH, builder.captureSnapLength));
        builder.captureReadTimeout(intProperty(properties, CAPTURE_READ_TIMEOUT, builder.captureReadTimeout));
        return builder.build();
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        final String value = properties.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " must be an integer, not \"" + value + "\"", e);
        }
    }

    private static InetAddress parseAddress(String name, String value) {
        try {
            return InetAddress.getByName(value.trim());
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Property " + name + " is not a usable address: \"" + value + "\"", e);
        }
    }

    /**
     * Assembles a {@link MonitorConfig}, starting from the built-in defaults.
     */
    @API(status = API.Status.STABLE)
    public static final class Builder {
        private InetAddress bindAddress;
        private int artNetPort = ArtNet.PORT;
        private int sacnPort = Sacn.PORT;
        private int firstUniverse = 1;
        private int lastUniverse = 100;
        private long pollInterval = 10000;
        private InetAddress broadcastAddress;
        private long maintenanceInterval = 1000;
        private int eventQueueCapacity = 1000;
        private int captureSnapLength = 1500;
        private int captureReadTimeout = 100;

        private Builder() {
            try {
                bindAddress = InetAddress.getByAddress(new byte[4]);
                broadcastAddress = InetAddress.getByAddress(new byte[] {(byte) 255, (byte) 255, (byte) 255, (byte) 255});
            } catch (UnknownHostException e) {
                throw new IllegalStateException("Four-byte address was rejected", e);
            }
        }

        public Builder bindAddress(InetAddress address) {
            if (address == null) {
                throw new IllegalArgumentException("bindAddress must not be null");
            }
            bindAddress = address;
            return this;
        }

        public Builder artNetPort(int port) {
            artNetPort = checkPort(ARTNET_PORT, port);
            return this;
        }

        public Builder sacnPort(int port) {
            sacnPort = checkPort(SACN_PORT, port);
            return this;
        }

        /**
         * Set the range of universes whose sACN multicast groups are joined at startup.
         *
         * @param first the lowest universe to join
         * @param last the highest universe to join; if lower than {@code first}, none are joined
         *
         * @return this builder
         */
        public Builder universeRange(int first, int last) {
            if (first < 1 || first > MAXIMUM_SACN_UNIVERSE || last > MAXIMUM_SACN_UNIVERSE) {
                throw new IllegalArgumentException("sACN universes must be between 1 and " + MAXIMUM_SACN_UNIVERSE);
            }
            firstUniverse = first;
            lastUniverse = last;
            return this;
        }

        public Builder pollInterval(long millis) {
            pollInterval = checkPositive(POLL_INTERVAL, millis);
            return this;
        }

        public Builder broadcastAddress(InetAddress address) {
            if (address == null) {
                throw new IllegalArgumentException("broadcastAddress must not be null");
            }
            broadcastAddress = address;
            return this;
        }

        public Builder maintenanceInterval(long millis) {
            maintenanceInterval = checkPositive(MAINTENANCE_INTERVAL, millis);
            return this;
        }

        public Builder eventQueueCapacity(int capacity) {
            eventQueueCapacity = (int) checkPositive(EVENT_QUEUE_CAPACITY, capacity);
            return this;
        }

        public Builder captureSnapLength(int length) {
            captureSnapLength = (int) checkPositive(CAPTURE_SNAP_LENGTH, length);
            return this;
        }

        public Builder captureReadTimeout(int millis) {
            captureReadTimeout = (int) checkPositive(CAPTURE_READ_TIMEOUT, millis);
            return this;
        }

        public MonitorConfig build() {
            return new MonitorConfig(this);
        }

        private static int checkPort(String name, int port) {
            if (port < 0 || port > 0xffff) {
                throw new IllegalArgumentException(name + " must be a valid UDP port, not " + port);
            }
            return port;
        }

        private static long checkPositive(String name, long value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be positive, not " + value);
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "MonitorConfig[bind:" + bindAddress.getHostAddress() + ", artNetPort:" + artNetPort + ", sacnPort:" +
                sacnPort + ", universes:" + firstUniverse + "-" + lastUniverse + ", pollInterval:" + pollInterval +
                ", broadcast:" + broadcastAddress.getHostAddress() + ", maintenanceInterval:" + maintenanceInterval +
                ", eventQueueCapacity:" + eventQueueCapacity + ", snapLength:" + captureSnapLength +
                ", readTimeout:" + captureReadTimeout + "]";
    }
}
