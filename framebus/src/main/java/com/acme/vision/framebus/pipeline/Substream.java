package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.config.SubstreamLayout;
import com.acme.vision.framebus.convert.ConversionFunction;
import com.acme.vision.framebus.convert.ConversionRegistry;
import com.acme.vision.framebus.image.CameraInfo;
import com.acme.vision.framebus.image.ImageHeader;
import com.acme.vision.framebus.memory.RecyclingImagePool;
import com.acme.vision.framebus.roi.Roi;
import com.acme.vision.framebus.roi.RoiTracker;
import com.acme.vision.framebus.roi.SensorDescriptor;
import com.acme.vision.framebus.sink.ImageSink;
import io.netty.buffer.ByteBufAllocator;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * One logical sub-image of a stream: its naming, sensor geometry, conversion, sink and
 * the mailbox its worker reads from.
 *
 * <p>Everything except the output pool is fixed at setup. The output pool exists
 * between {@link #openOutputPool} and {@link #closeOutputPool}.
 */
public final class Substream {
    private static final Logger LOG = Logger.getLogger(Substream.class.getName());

    private final SubstreamLayout layout;
    private final SensorDescriptor sensor;
    private final RoiTracker roiTracker;
    private final ConversionFunction conversion;
    private final ImageSink sink;
    private final Mailbox mailbox;
    private final AtomicBoolean calibrationFallbackWarned = new AtomicBoolean(false);
    private volatile RecyclingImagePool outputPool;

    public Substream(SubstreamLayout layout,
                     SensorDescriptor sensor,
                     Roi initialRoi,
                     ConversionRegistry conversions,
                     ImageSink sink) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.sensor = Objects.requireNonNull(sensor, "sensor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.roiTracker = new RoiTracker(layout.streamId(), layout.label(), layout.index(), initialRoi);
        this.mailbox = new Mailbox(layout.streamId(), layout.label());
        this.conversion = resolveConversion(Objects.requireNonNull(conversions, "conversions")).orElse(null);
    }

    private Optional<ConversionFunction> resolveConversion(ConversionRegistry conversions) {
        String format = sensor.pixelFormat();
        if (layout.hasPixelFormatOverride()) {
            LOG.warning("Substream stream=" + layout.streamId() + " substream=" + layout.label()
                + " uses internal pixel format override " + layout.pixelFormatOverride()
                + " instead of device format " + format);
            format = layout.pixelFormatOverride();
        }
        Optional<ConversionFunction> found = conversions.lookup(format);
        if (found.isEmpty()) {
            LOG.warning("No conversion registered for pixel format " + format + " on stream="
                + layout.streamId() + " substream=" + layout.label() + ", images are published as received");
        }
        return found;
    }

    /**
     * Calibration for an outgoing image. A calibration without resolution falls back to
     * the current ROI size; that fallback is logged once.
     */
    CameraInfo cameraInfoFor(ImageHeader header, Roi roi) {
        CameraInfo info = sink.calibration().withHeader(header);
        if (info.hasResolution()) {
            return info;
        }
        if (calibrationFallbackWarned.compareAndSet(false, true)) {
            LOG.warning("Calibration for stream=" + layout.streamId() + " substream=" + layout.label()
                + " has no resolution, using ROI width=" + roi.width() + " height=" + roi.height());
        }
        return info.withResolution(roi.width(), roi.height());
    }

    void openOutputPool(ByteBufAllocator allocator) {
        outputPool = new RecyclingImagePool(allocator);
    }

    void closeOutputPool() {
        RecyclingImagePool pool = outputPool;
        if (pool != null) {
            pool.close();
        }
    }

    public SubstreamLayout layout() {
        return layout;
    }

    public SensorDescriptor sensor() {
        return sensor;
    }

    public RoiTracker roiTracker() {
        return roiTracker;
    }

    public Optional<ConversionFunction> conversion() {
        return Optional.ofNullable(conversion);
    }

    public ImageSink sink() {
        return sink;
    }

    public Mailbox mailbox() {
        return mailbox;
    }

    public RecyclingImagePool outputPool() {
        RecyclingImagePool pool = outputPool;
        if (pool == null) {
            throw new IllegalStateException("Output pool not open for substream " + layout.label());
        }
        return pool;
    }

    public boolean hasSubscribers() {
        return sink.hasSubscribers();
    }
}
