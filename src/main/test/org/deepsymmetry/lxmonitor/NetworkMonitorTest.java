package org.deepsymmetry.lxmonitor;

import org.deepsymmetry.lxmonitor.capture.UnavailablePacketCapture;
import org.deepsymmetry.lxmonitor.data.ManualTimeSource;
import org.junit.Test;

import static org.junit.Assert.*;

public class NetworkMonitorTest {

    private final NetworkMonitor monitor = new NetworkMonitor(MonitorConfig.builder().build(),
            new ManualTimeSource(), new UnavailablePacketCapture("not installed"));

    @Test
    public void reportsStatusWhileStopped() {
        assertFalse(monitor.isRunning());
        final MonitorStatus status = monitor.getStatus();
        assertFalse(status.isArtNetListening());
        assertFalse(status.isSacnListening());
        assertNull(status.getArtNetError());
        assertNull(status.getSacnError());
        assertTrue(status.getJoinedUniverses().isEmpty());
        assertFalse(status.getCaptureStatus().isAvailable());
        assertEquals("not installed", status.getCaptureStatus().getLastError());
        assertTrue(monitor.getCaptureInterfaces().isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void queriesRequireRunning() {
        monitor.getSources();
    }

    @Test(expected = IllegalStateException.class)
    public void captureRequiresRunning() {
        monitor.enableCapture(null);
    }

    @Test(expected = IllegalStateException.class)
    public void pollRequiresRunning() throws Exception {
        monitor.sendPoll();
    }

    @Test
    public void stoppingWhenStoppedIsHarmless() {
        monitor.stop();
        monitor.disableCapture();
        assertFalse(monitor.isRunning());
    }

    @Test
    public void managesListeners() {
        final MonitorListener listener = new MonitorAdapter() {
        };
        monitor.addMonitorListener(listener);
        assertEquals(1, monitor.getMonitorListeners().size());
        monitor.removeMonitorListener(listener);
        assertTrue(monitor.getMonitorListeners().isEmpty());
    }
}
