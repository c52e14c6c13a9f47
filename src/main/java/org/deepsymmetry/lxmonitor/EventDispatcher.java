package org.deepsymmetry.lxmonitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers monitor events to listeners without ever making the thread that produced them wait. Each listener
 * gets a bounded queue and a daemon thread which drains it. When a queue is full the oldest event in it is
 * discarded, and the listener is told how many it missed before it receives the next one.
 */
class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    /**
     * Something that can be delivered to a listener.
     */
    private interface Event {
        void deliverTo(MonitorListener listener);
    }

    private static final Event SOURCES_CHANGED = MonitorListener::sourcesChanged;

    /**
     * The queue and delivery thread belonging to one listener.
     */
    private static class Channel {
        final MonitorListener listener;
        final LinkedBlockingDeque<Event> queue;
        final AtomicInteger missed = new AtomicInteger(0);
        final Thread thread;

        Channel(MonitorListener listener, int capacity) {
            this.listener = listener;
            this.queue = new LinkedBlockingDeque<>(capacity);
            thread = new Thread(null, this::deliver, "lx-monitor event delivery to " + listener);
            thread.setDaemon(true);
        }

        void offer(Event event) {
            while (!queue.offerLast(event)) {
                if (queue.pollFirst() != null) {
                    missed.incrementAndGet();
                }
            }
        }

        private void deliver() {
            while (true) {
                final Event event;
                try {
                    event = queue.takeFirst();
                } catch (InterruptedException e) {
                    return;  // The listener has been removed.
                }
                final int dropped = missed.getAndSet(0);
                try {
                    if (dropped > 0) {
                        listener.eventsMissed(dropped);
                    }
                    event.deliverTo(listener);
                } catch (Throwable t) {
                    logger.warn("Problem delivering monitor event to listener", t);
                }
            }
        }
    }

    private final int capacity;

    private final Map<MonitorListener, Channel> channels = new LinkedHashMap<>();

    /**
     * Create a dispatcher.
     *
     * @param capacity how many undelivered events each listener may have before the oldest are discarded
     */
    EventDispatcher(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Event queue capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Start delivering events to a listener. Adding a listener which is already registered has no effect.
     */
    synchronized void addListener(MonitorListener listener) {
        if (listener != null && !channels.containsKey(listener)) {
            final Channel channel = new Channel(listener, capacity);
            channels.put(listener, channel);
            channel.thread.start();
        }
    }

    /**
     * Stop delivering events to a listener, discarding any it has not yet received.
     */
    synchronized void removeListener(MonitorListener listener) {
        final Channel channel = channels.remove(listener);
        if (channel != null) {
            channel.thread.interrupt();
        }
    }

    synchronized List<MonitorListener> getListeners() {
        return new ArrayList<>(channels.keySet());
    }

    /**
     * Tell every listener that the set of sources, or their details, may have changed.
     */
    void sourcesChanged() {
        publish(SOURCES_CHANGED);
    }

    /**
     * Tell every listener about a frame of DMX data.
     */
    void frameUpdated(final FrameUpdate update) {
        publish(listener -> listener.frameUpdated(update));
    }

    private synchronized void publish(Event event) {
        for (Channel channel : channels.values()) {
            channel.offer(event);
        }
    }
}
