package com.acme.vision.framebus.memory;

import com.acme.vision.framebus.image.Image;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

public final class PooledImage implements ImageRef {
    private final long imageId;
    private final Image image;
    private final Recycler recycler;
    private final AtomicInteger refCount = new AtomicInteger(1);

    public PooledImage(long imageId, Image image, Recycler recycler) {
        this.imageId = imageId;
        this.image = Objects.requireNonNull(image, "image");
        this.recycler = Objects.requireNonNull(recycler, "recycler");
    }

    @Override
    public long imageId() {
        return imageId;
    }

    @Override
    public Image image() {
        return image;
    }

    @Override
    public int refCount() {
        return refCount.get();
    }

    @Override
    public boolean isExclusiveOwner() {
        return refCount.get() == 1;
    }

    @Override
    public PooledImage retain() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                throw new IllegalStateException("Retain after release for imageId=" + imageId);
            }
            if (refCount.compareAndSet(current, current + 1)) {
                return this;
            }
        }
    }

    @Override
    public boolean release() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                throw new IllegalStateException("Double release for imageId=" + imageId);
            }
            int next = current - 1;
            if (!refCount.compareAndSet(current, next)) {
                continue;
            }
            if (next == 0) {
                recycler.recycle(this);
                return true;
            }
            return false;
        }
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "PooledImage{imageId=" + imageId + ", refCount=" + refCount.get() + ", image=" + image + '}';
    }

    /**
     * Invoked exactly once, by the thread that dropped the last reference.
     */
    @FunctionalInterface
    public interface Recycler {
        void recycle(PooledImage image);
    }
}
