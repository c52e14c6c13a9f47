package org.deepsymmetry.lxmonitor;

import org.apiguardian.api.API;
import org.deepsymmetry.lxmonitor.capture.CaptureStatus;

import java.util.Collections;
import java.util.List;

/**
 * A snapshot of which parts of the {@link NetworkMonitor} are listening to the network.
 */
@API(status = API.Status.STABLE)
public final class MonitorStatus {

    private final boolean artNetListening;
    private final String artNetError;
    private final boolean sacnListening;
    private final String sacnError;
    private final List<Integer> joinedUniverses;
    private final CaptureStatus captureStatus;

    MonitorStatus(boolean artNetListening, String artNetError, boolean sacnListening, String sacnError,
                  List<Integer> joinedUniverses, CaptureStatus captureStatus) {
        this.artNetListening = artNetListening;
        this.artNetError = artNetError;
        this.sacnListening = sacnListening;
        this.sacnError = sacnError;
        this.joinedUniverses = Collections.unmodifiableList(joinedUniverses);
        this.captureStatus = captureStatus;
    }

    @API(status = API.Status.STABLE)
    public boolean isArtNetListening() {
        return artNetListening;
    }

    /**
     * Explain why Art-Net is not being heard, if its socket could not be opened or failed while we were running.
     *
     * @return the socket error, or {@code null} if the Art-Net socket last opened without trouble
     */
    @API(status = API.Status.STABLE)
    public String getArtNetError() {
        return artNetError;
    }

    @API(status = API.Status.STABLE)
    public boolean isSacnListening() {
        return sacnListening;
    }

    /**
     * Explain why sACN is not being heard, if its socket could not be opened or failed while we were running.
     *
     * @return the socket error, or {@code null} if the sACN socket last opened without trouble
     */
    @API(status = API.Status.STABLE)
    public String getSacnError() {
        return sacnError;
    }

    /**
     * Get the universes whose sACN multicast groups have been joined.
     *
     * @return the universe numbers, in ascending order
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getJoinedUniverses() {
        return joinedUniverses;
    }

    @API(status = API.Status.STABLE)
    public CaptureStatus getCaptureStatus() {
        return captureStatus;
    }

    @Override
    public String toString() {
        return "MonitorStatus[artNet:" + artNetListening + (artNetError == null ? "" : " (" + artNetError + ")") +
                ", sACN:" + sacnListening + (sacnError == null ? "" : " (" + sacnError + ")") + ", joined:" +
                joinedUniverses.size() + ", capture:" + captureStatus + "]";
    }
}
