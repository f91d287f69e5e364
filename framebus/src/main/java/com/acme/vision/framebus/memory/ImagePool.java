package com.acme.vision.framebus.memory;

/**
 * Source of reusable output images.
 *
 * <p>Implementations must be thread-safe. Each returned {@link PooledImage} starts with
 * one reference owned by the caller; the image goes back to the pool when the last
 * reference is released.
 */
public interface ImagePool extends AutoCloseable {
    PooledImage getRecyclableImage();

    /** Returns a snapshot of current pool statistics. */
    PoolStats stats();

    @Override
    default void close() {
    }
}
