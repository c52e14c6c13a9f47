package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;

/**
 * <p>The listener interface for receiving news of changes on the lighting network. Classes that are interested can
 * either implement this interface (and all the methods it contains) or extend the abstract {@link MonitorAdapter}
 * class (overriding only the methods of interest). The listener object is then registered using
 * {@link NetworkMonitor#addMonitorListener(MonitorListener)}.</p>
 *
 * <p>Each listener is called on its own delivery thread, so a slow listener does not hold up packet processing or
 * other listeners. If it falls too far behind, the oldest undelivered events are discarded, and it is told how
 * many it missed. The registry and frame store always hold the current state, so a listener which misses events
 * can simply query them again.</p>
 */
@API(status = API.Status.STABLE)
public interface MonitorListener {

    /**
     * Invoked when sources may have been found, lost, or changed. Carries no details; call
     * {@link NetworkMonitor#getSources()} to see the current state.
     */
    @API(status = API.Status.STABLE)
    void sourcesChanged();

    /**
     * Invoked when a frame of DMX data has been received.
     *
     * @param update the universe, sender and contents of the frame
     */
    @API(status = API.Status.STABLE)
    void frameUpdated(FrameUpdate update);

    /**
     * Invoked before the next event is delivered, when events had to be discarded because this listener was not
     * keeping up with them.
     *
     * @param count how many events were discarded
     */
    @API(status = API.Status.STABLE)
    void eventsMissed(int count);
}
