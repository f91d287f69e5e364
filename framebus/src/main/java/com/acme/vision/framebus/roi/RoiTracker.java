package com.acme.vision.framebus.roi;

import com.acme.vision.framebus.hardware.Region;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Holds the ROI a substream believes it is receiving and reconciles it with the
 * region reported on each buffer.
 *
 * <p>Cameras may change the ROI mid-stream, and a component's real ROI can differ
 * from the stream-level default it was initialised with. The observed region wins and
 * every change is logged once. The exception is a buffer that reports no region at
 * all ({@link Region#EMPTY}): it leaves the cached ROI in place instead of resetting
 * it to 0x0, unlike a tracker that adopts whatever the buffer carries.
 *
 * <p>Not thread-safe: owned by a single substream worker. {@link #current()} may be
 * read from other threads.
 */
public final class RoiTracker {
    private static final Logger LOG = Logger.getLogger(RoiTracker.class.getName());

    private final int streamId;
    private final String substreamName;
    private final int partIndex;
    private volatile Roi current;
    private long changes;

    public RoiTracker(int streamId, String substreamName, int partIndex, Roi initial) {
        this.streamId = streamId;
        this.substreamName = Objects.requireNonNull(substreamName, "substreamName");
        this.partIndex = partIndex;
        this.current = Objects.requireNonNull(initial, "initial");
    }

    /**
     * Compares {@code observed} with the cached ROI and adopts it on mismatch.
     * {@link Region#EMPTY} means the hardware reported no region and is ignored.
     *
     * @return {@code true} when the cached ROI was replaced
     */
    public boolean adapt(Region observed) {
        Objects.requireNonNull(observed, "observed");
        Roi roi = current;
        if (Region.EMPTY.equals(observed) || roi.matches(observed)) {
            return false;
        }
        LOG.warning("Initial ROI for stream=" + streamId + " substream=" + substreamName
            + " part=" + partIndex + " doesn't match received data ROI, reinitializing to"
            + " x=" + observed.x() + " y=" + observed.y()
            + " width=" + observed.width() + " height=" + observed.height());
        current = roi.withRegion(observed);
        changes++;
        return true;
    }

    public Roi current() {
        return current;
    }

    public int partIndex() {
        return partIndex;
    }

    public long changes() {
        return changes;
    }
}
