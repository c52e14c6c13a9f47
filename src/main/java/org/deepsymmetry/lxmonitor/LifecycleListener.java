package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;

/**
 * <p>The listener interface for hearing when one of the network-facing LX Monitor components starts or stops.</p>
 *
 * <p>The {@link NetworkMonitor} registers one with each of its finders, so that it can tell when the socket of a
 * protocol fails underneath it and report that in its {@link MonitorStatus}.</p>
 */
@API(status = API.Status.STABLE)
public interface LifecycleListener {

    /**
     * Called when the component has bound its socket and begun listening.
     *
     * @param sender the component reporting this event
     */
    @API(status = API.Status.STABLE)
    void started(LifecycleParticipant sender);

    /**
     * Called when the component has stopped listening.
     *
     * @param sender the component reporting this event
     * @param cause the failure that forced it to stop, or {@code null} if it was asked to stop
     */
    @API(status = API.Status.STABLE)
    void stopped(LifecycleParticipant sender, Throwable cause);
}
