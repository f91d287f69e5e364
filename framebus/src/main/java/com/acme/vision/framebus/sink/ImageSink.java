package com.acme.vision.framebus.sink;

import com.acme.vision.framebus.image.CameraInfo;
import com.acme.vision.framebus.memory.PooledImage;

/**
 * Downstream consumer of one substream.
 *
 * <p>{@link #publish} is called from the substream's worker thread. The pipeline
 * releases its reference to {@code image} as soon as the call returns; a sink that
 * needs the image afterwards must {@link PooledImage#retain() retain} it and release it
 * when done. Images are read-only for sinks.
 */
public interface ImageSink extends AutoCloseable {
    void publish(PooledImage image, CameraInfo cameraInfo);

    /** Whether anyone is listening; no subscribers means frames are not processed. */
    boolean hasSubscribers();

    /** Current calibration for this substream; header and resolution may be unset. */
    default CameraInfo calibration() {
        return CameraInfo.uncalibrated();
    }

    @Override
    default void close() {
    }
}
