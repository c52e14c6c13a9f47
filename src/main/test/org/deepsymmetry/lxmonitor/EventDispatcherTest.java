package org.deepsymmetry.lxmonitor;

import org.deepsymmetry.lxmonitor.data.Protocol;
import org.junit.Test;

import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class EventDispatcherTest {

    private static FrameUpdate frame(int universe) throws Exception {
        return new FrameUpdate(universe, InetAddress.getByName("10.0.0.1"), Protocol.ARTNET, 0L, new byte[] {1});
    }

    @Test
    public void deliversToEveryListener() throws Exception {
        final EventDispatcher dispatcher = new EventDispatcher(10);
        final CountDownLatch delivered = new CountDownLatch(2);
        final MonitorListener listener = new MonitorAdapter() {
            @Override
            public void sourcesChanged() {
                delivered.countDown();
            }
        };
        final MonitorListener other = new MonitorAdapter() {
            @Override
            public void sourcesChanged() {
                delivered.countDown();
            }
        };
        dispatcher.addListener(listener);
        dispatcher.addListener(other);
        dispatcher.addListener(listener);
        assertEquals(2, dispatcher.getListeners().size());

        dispatcher.sourcesChanged();
        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        dispatcher.removeListener(listener);
        dispatcher.removeListener(other);
        assertTrue(dispatcher.getListeners().isEmpty());
    }

    @Test
    public void slowListenerIsToldWhatItMissed() throws Exception {
        final EventDispatcher dispatcher = new EventDispatcher(2);
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch finished = new CountDownLatch(3);
        final List<Integer> universes = new CopyOnWriteArrayList<>();
        final AtomicInteger missed = new AtomicInteger(0);

        dispatcher.addListener(new MonitorAdapter() {
            @Override
            public void frameUpdated(FrameUpdate update) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                universes.add(update.getUniverse());
                finished.countDown();
            }

            @Override
            public void eventsMissed(int count) {
                missed.addAndGet(count);
            }
        });

        dispatcher.frameUpdated(frame(1));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        for (int universe = 2; universe <= 6; universe++) {
            dispatcher.frameUpdated(frame(universe));  // Must not block even though the listener is stuck.
        }
        release.countDown();

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(3, missed.get());
        assertEquals(java.util.Arrays.asList(1, 5, 6), universes);
    }

    @Test
    public void listenerExceptionsDoNotStopDelivery() throws Exception {
        final EventDispatcher dispatcher = new EventDispatcher(10);
        final CountDownLatch delivered = new CountDownLatch(2);
        dispatcher.addListener(new MonitorAdapter() {
            @Override
            public void sourcesChanged() {
                delivered.countDown();
                throw new RuntimeException("Listener failure expected by test");
            }
        });
        dispatcher.sourcesChanged();
        dispatcher.sourcesChanged();
        assertTrue(delivered.await(5, TimeUnit.SECONDS));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyQueues() {
        new EventDispatcher(0);
    }
}
