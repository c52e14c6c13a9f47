package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;

/**
 * <p>An abstract adapter class for receiving lighting network events. The methods in this class are empty; it
 * exists as a convenience for creating listener objects.</p>
 *
 * <p>Extend this class to create a {@link MonitorListener} and override only the methods for events that you
 * care about.</p>
 */
@API(status = API.Status.STABLE)
public abstract class MonitorAdapter implements MonitorListener {

    @Override
    public void sourcesChanged() {

    }

    @Override
    public void frameUpdated(FrameUpdate update) {

    }

    @Override
    public void eventsMissed(int count) {

    }
}
