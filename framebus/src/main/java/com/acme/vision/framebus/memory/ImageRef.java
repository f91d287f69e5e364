package com.acme.vision.framebus.memory;

import com.acme.vision.framebus.image.Image;

/**
 * ImageRef: shared-ownership handle around a pooled image.
 * Ownership: caller MUST release exactly once per ownership unit.
 */
public interface ImageRef extends AutoCloseable {
    long imageId();
    Image image();

    int refCount();
    boolean isExclusiveOwner();

    ImageRef retain();
    boolean release();

    @Override
    default void close() { release(); }
}
