package com.acme.vision.framebus.sim;

import com.acme.vision.framebus.config.SubstreamLayout;
import com.acme.vision.framebus.image.CameraInfo;
import com.acme.vision.framebus.memory.PooledImage;
import com.acme.vision.framebus.sink.ImageSink;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Sink that only logs what it receives. Always subscribed.
 */
public final class LoggingImageSink implements ImageSink {
    private static final Logger LOG = Logger.getLogger(LoggingImageSink.class.getName());
    private static final long LOG_EVERY = 100L;

    private final SubstreamLayout layout;
    private final AtomicLong published = new AtomicLong();

    public LoggingImageSink(SubstreamLayout layout, Runnable onSubscriptionChange) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public void publish(PooledImage image, CameraInfo cameraInfo) {
        long n = published.incrementAndGet();
        if (n == 1L || n % LOG_EVERY == 0L) {
            LOG.info(() -> "topic=" + layout.topic() + " published=" + n + " image=" + image.image()
                + " calibration=" + cameraInfo.width() + "x" + cameraInfo.height());
        }
    }

    @Override
    public boolean hasSubscribers() {
        return true;
    }

    public long publishedCount() {
        return published.get();
    }
}
