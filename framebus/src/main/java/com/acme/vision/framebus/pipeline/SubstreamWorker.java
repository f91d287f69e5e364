package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.convert.ConversionFunction;
import com.acme.vision.framebus.hardware.PayloadType;
import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.image.CameraInfo;
import com.acme.vision.framebus.memory.ImagePool;
import com.acme.vision.framebus.memory.PooledImage;
import com.acme.vision.framebus.roi.Roi;
import com.acme.vision.framebus.telemetry.DropReason;
import com.acme.vision.framebus.telemetry.NoopPipelineMetrics;
import com.acme.vision.framebus.telemetry.PipelineMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker loop of one substream.
 *
 * <p>Waits on the substream's mailbox for at most {@code waitTimeout}, then checks its
 * stop flag. A delivery taken after the flag was set is released without being
 * processed. The flag is only ever polled; the thread is never interrupted.
 *
 * <p>Processing reconciles the ROI, stamps the image, extracts the substream's part,
 * converts it if a conversion is registered and publishes. Every reference taken along
 * the way is released before the next wait.
 */
public final class SubstreamWorker implements Runnable {
    private static final Logger LOG = Logger.getLogger(SubstreamWorker.class.getName());

    private final Substream substream;
    private final ImagePool streamPool;
    private final ImageStamper stamper;
    private final Duration waitTimeout;
    private final PipelineMetrics metrics;
    private volatile boolean stopRequested;

    /**
     * @param streamPool pool of the owning stream, source of conversion output on the
     *                   single-image path
     */
    public SubstreamWorker(Substream substream,
                           ImagePool streamPool,
                           ImageStamper stamper,
                           Duration waitTimeout,
                           PipelineMetrics metrics) {
        this.substream = Objects.requireNonNull(substream, "substream");
        this.streamPool = Objects.requireNonNull(streamPool, "streamPool");
        this.stamper = Objects.requireNonNull(stamper, "stamper");
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout");
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    @Override
    public void run() {
        Mailbox mailbox = substream.mailbox();
        LOG.fine(() -> "Worker started stream=" + substream.layout().streamId()
            + " substream=" + substream.layout().label());
        try {
            while (!stopRequested) {
                Delivery delivery;
                try {
                    delivery = mailbox.take(waitTimeout);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warning("Worker interrupted stream=" + substream.layout().streamId()
                        + " substream=" + substream.layout().label());
                    return;
                }
                if (delivery == null) {
                    continue;
                }
                if (stopRequested) {
                    delivery.release();
                    metrics.incDropped(1L, DropReason.SHUTDOWN);
                    return;
                }
                process(delivery);
            }
        } finally {
            if (mailbox.close()) {
                metrics.incDropped(1L, DropReason.SHUTDOWN);
            }
            LOG.fine(() -> "Worker finished stream=" + substream.layout().streamId()
                + " substream=" + substream.layout().label());
        }
    }

    /** Asks the loop to exit after its current wait or processing step. */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    void process(Delivery delivery) {
        long startNanos = System.nanoTime();
        RawBuffer buffer = delivery.buffer();
        long frameId = buffer.frameId();
        List<PooledImage> held = new ArrayList<>(3);
        held.add(delivery.source());
        try {
            PooledImage outgoing = prepare(buffer, delivery.source(), held);
            if (outgoing == null) {
                return;
            }
            Roi roi = substream.roiTracker().current();
            CameraInfo info = substream.cameraInfoFor(outgoing.image().header(), roi);
            substream.sink().publish(outgoing, info);
            metrics.incPublished(1L);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Processing failed stream=" + substream.layout().streamId()
                + " substream=" + substream.layout().label() + " frameId=" + frameId, e);
            metrics.incDropped(1L, DropReason.PROCESSING_FAILURE);
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                releaseQuietly(held.get(i), frameId);
            }
            metrics.observeProcessingNanos(System.nanoTime() - startNanos);
        }
    }

    private PooledImage prepare(RawBuffer buffer, PooledImage source, List<PooledImage> held) {
        int part;
        ImagePool conversionPool;
        PooledImage image;
        if (buffer.payloadType() == PayloadType.IMAGE) {
            part = 0;
            image = source;
            conversionPool = streamPool;
        } else if (buffer.payloadType() == PayloadType.MULTIPART) {
            part = substream.layout().index();
            conversionPool = substream.outputPool();
            image = conversionPool.getRecyclableImage();
            held.add(image);
        } else {
            LOG.severe("Worker received unsupported payload type=" + buffer.payloadType()
                + " stream=" + substream.layout().streamId() + " substream=" + substream.layout().label());
            metrics.incDropped(1L, DropReason.UNSUPPORTED_PAYLOAD);
            return null;
        }

        substream.roiTracker().adapt(buffer.partRegion(part));
        Roi roi = substream.roiTracker().current();
        stamper.fill(image.image(), buffer, roi, substream.sensor(), substream.layout().frameId());
        if (image != source) {
            image.image().copyDataFrom(buffer.partData(part));
        }

        Optional<ConversionFunction> conversion = substream.conversion();
        if (conversion.isEmpty()) {
            return image;
        }
        PooledImage converted = conversionPool.getRecyclableImage();
        held.add(converted);
        converted.image().header(image.image().header());
        conversion.get().convert(image.image(), converted.image());
        return converted;
    }

    private void releaseQuietly(PooledImage ref, long frameId) {
        try {
            ref.release();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to release image ref stream=" + substream.layout().streamId()
                + " substream=" + substream.layout().label() + " frameId=" + frameId, e);
        }
    }
}
