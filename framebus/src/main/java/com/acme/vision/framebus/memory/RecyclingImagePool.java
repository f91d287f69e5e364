package com.acme.vision.framebus.memory;

import com.acme.vision.framebus.image.Image;
import io.netty.buffer.ByteBufAllocator;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pool of independently owned images used for conversion and multipart output.
 *
 * <p>Unlike {@link HardwareBufferPool} nothing is handed back to hardware: released
 * images are reset and kept on a free list. Buffers keep their grown capacity, so a
 * steady stream of same-sized frames stops allocating after warm-up.
 */
public final class RecyclingImagePool implements ImagePool {
    private static final int INITIAL_CAPACITY = 4096;

    private final ByteBufAllocator allocator;
    private final ConcurrentLinkedDeque<Image> free = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong ids = new AtomicLong(1);

    private final AtomicLong allocated = new AtomicLong();
    private final AtomicLong acquired = new AtomicLong();
    private final AtomicLong recycled = new AtomicLong();

    public RecyclingImagePool(ByteBufAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    @Override
    public PooledImage getRecyclableImage() {
        if (closed.get()) {
            throw new IllegalStateException("Image pool is closed");
        }
        Image image = free.pollFirst();
        if (image == null) {
            image = new Image(allocator.heapBuffer(INITIAL_CAPACITY));
            allocated.incrementAndGet();
        }
        acquired.incrementAndGet();
        return new PooledImage(ids.getAndIncrement(), image, this::recycle);
    }

    private void recycle(PooledImage ref) {
        recycled.incrementAndGet();
        Image image = ref.image();
        if (closed.get()) {
            image.data().release();
            return;
        }
        image.reset();
        free.offerFirst(image);
        // close() may have drained the free list between the check and the offer
        if (closed.get() && free.remove(image)) {
            image.data().release();
        }
    }

    public int freeCount() {
        return free.size();
    }

    @Override
    public PoolStats stats() {
        long a = acquired.get();
        long r = recycled.get();
        return new PoolStats(allocated.get(), a, r, a - r, 0L);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Image image;
        while ((image = free.pollFirst()) != null) {
            image.data().release();
        }
    }
}
