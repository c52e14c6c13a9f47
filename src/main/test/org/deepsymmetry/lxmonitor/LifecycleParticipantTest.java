package org.deepsymmetry.lxmonitor;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class LifecycleParticipantTest {

    private static final Logger logger = LoggerFactory.getLogger(LifecycleParticipantTest.class);

    /**
     * A component whose socket never really opens, so failures can be injected.
     */
    private static class FakeFinder extends LifecycleParticipant {
        private volatile boolean running;

        @Override
        public boolean isRunning() {
            return running;
        }

        void start() {
            running = true;
            deliverStarted(logger);
        }

        void fail(Throwable cause) {
            running = false;
            deliverStopped(logger, cause);
        }

        void refuseToStart(Throwable cause) {
            recordFailure(cause);
        }
    }

    private final FakeFinder finder = new FakeFinder();
    private final BlockingQueue<String> announcements = new LinkedBlockingQueue<>();

    private final LifecycleListener listener = new LifecycleListener() {
        @Override
        public void started(LifecycleParticipant sender) {
            announcements.add("started");
        }

        @Override
        public void stopped(LifecycleParticipant sender, Throwable cause) {
            announcements.add("stopped " + (cause == null ? "normally" : cause.getMessage()));
        }
    };

    @Test
    public void socketFailureIsAnnouncedAndRemembered() throws Exception {
        finder.addLifecycleListener(listener);
        finder.start();
        assertEquals("started", announcements.poll(5, TimeUnit.SECONDS));
        assertNull(finder.getFailure());

        final IOException failure = new IOException("Network is down");
        finder.fail(failure);
        assertEquals("stopped Network is down", announcements.poll(5, TimeUnit.SECONDS));
        assertSame(failure, finder.getFailure());
        assertEquals("Network is down", NetworkMonitor.describeFailure(finder.getFailure()));
    }

    @Test
    public void requestedStopKeepsEarlierFailureUntilRestart() throws Exception {
        finder.addLifecycleListener(listener);
        finder.refuseToStart(new SocketException());
        assertEquals("SocketException", NetworkMonitor.describeFailure(finder.getFailure()));

        finder.fail(null);
        assertEquals("stopped normally", announcements.poll(5, TimeUnit.SECONDS));
        assertNotNull(finder.getFailure());

        finder.start();
        assertNull(finder.getFailure());
        assertNull(NetworkMonitor.describeFailure(finder.getFailure()));
    }

    @Test
    public void listenersCanBeRemoved() {
        finder.addLifecycleListener(listener);
        finder.addLifecycleListener(listener);
        assertEquals(1, finder.getLifecycleListeners().size());
        finder.removeLifecycleListener(listener);
        assertTrue(finder.getLifecycleListeners().isEmpty());
    }
}
