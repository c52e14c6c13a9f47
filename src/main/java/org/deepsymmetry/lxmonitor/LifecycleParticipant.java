package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.slf4j.Logger;

import java.lang.ref.WeakReference;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * The common base of the components that listen to the network. Besides announcing when they start and stop, they
 * remember the failure which last stopped them (or kept them from starting), so that a monitor which carries on
 * with its other protocol can still explain why one of them went quiet.
 */
@API(status = API.Status.STABLE)
public abstract class LifecycleParticipant {

    private final List<WeakReference<LifecycleListener>> lifecycleListeners = new LinkedList<>();

    /**
     * The failure which last stopped us or prevented us from starting, cleared when we start successfully.
     */
    private final AtomicReference<Throwable> failure = new AtomicReference<>(null);

    /**
     * Adds a listener to hear when the component starts and stops. Adding {@code null}, or a listener which is
     * already registered, has no effect. Registration does not keep the listener from being garbage collected.
     * Announcements are delivered on a separate thread, so listeners need not worry about the locks held by
     * {@code start()} and {@code stop()}.
     *
     * @param listener the lifecycle listener to add
     */
    @API(status = API.Status.STABLE)
    public synchronized void addLifecycleListener(LifecycleListener listener) {
        Util.addListener(lifecycleListeners, listener);
    }

    /**
     * Removes a lifecycle listener. Removing {@code null}, or a listener which is not registered, has no effect.
     *
     * @param listener the lifecycle listener to remove
     */
    @API(status = API.Status.STABLE)
    public synchronized void removeLifecycleListener(LifecycleListener listener) {
        Util.removeListener(lifecycleListeners, listener);
    }

    @API(status = API.Status.STABLE)
    public synchronized Set<LifecycleListener> getLifecycleListeners() {
        return Collections.unmodifiableSet(Util.gatherListeners(lifecycleListeners));
    }

    /**
     * Get the failure which most recently stopped this component, or kept it from starting.
     *
     * @return the failure, or {@code null} if the component last started cleanly and has not failed since
     */
    @API(status = API.Status.STABLE)
    public Throwable getFailure() {
        return failure.get();
    }

    /**
     * Note a failure that kept the component from starting. No announcement is sent, since it never started.
     *
     * @param cause what went wrong
     */
    protected void recordFailure(Throwable cause) {
        failure.set(cause);
    }

    /**
     * Forget any earlier failure and tell listeners we have started.
     *
     * @param logger the subclass logger, so problems show up under the right component
     */
    protected void deliverStarted(Logger logger) {
        failure.set(null);
        deliver(logger, listener -> listener.started(this));
    }

    /**
     * Tell listeners we have stopped, remembering the cause if we were forced to.
     *
     * @param logger the subclass logger, so problems show up under the right component
     * @param cause the failure that stopped us, or {@code null} for a requested stop
     */
    protected void deliverStopped(Logger logger, Throwable cause) {
        if (cause != null) {
            failure.set(cause);
        }
        deliver(logger, listener -> listener.stopped(this, cause));
    }

    private void deliver(final Logger logger, final Consumer<LifecycleListener> announcement) {
        final Set<LifecycleListener> listeners = getLifecycleListeners();
        if (listeners.isEmpty()) {
            return;
        }
        final Thread delivery = new Thread(null, () -> {
            for (final LifecycleListener listener : listeners) {
                try {
                    announcement.accept(listener);
                } catch (Throwable t) {
                    logger.warn("Problem delivering lifecycle announcement to listener", t);
                }
            }
        }, "lx-monitor lifecycle announcement");
        delivery.setDaemon(true);
        delivery.start();
    }

    /**
     * Check whether this component is listening to the network.
     *
     * @return {@code true} if the component has started and not stopped since
     */
    @API(status = API.Status.STABLE)
    abstract public boolean isRunning();

    /**
     * @throws IllegalStateException if the component is not running
     */
    protected void ensureRunning() {
        if (!isRunning()) {
            throw new IllegalStateException(this.getClass().getName() + " is not running");
        }
    }
}
