package com.acme.vision.framebus.memory;

import com.acme.vision.framebus.hardware.HardwareChannel;
import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.image.Image;
import com.acme.vision.framebus.telemetry.NoopPipelineMetrics;
import com.acme.vision.framebus.telemetry.PipelineMetrics;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Stream-level pool of hardware buffers.
 *
 * <p>Owns the direct memory lent to the hardware channel and wraps filled buffers into
 * {@link PooledImage}s without copying. When the last reference to a wrapper is
 * released the underlying {@link RawBuffer} goes back to the channel, exactly once.
 *
 * <h3>Growth</h3>
 * The pool only grows. {@link #ensureAvailable(int)} adds a single buffer when the
 * hardware reports none left, so a starved channel keeps a buffer to fill instead of
 * stalling.
 *
 * <h3>Close</h3>
 * After {@link #close()} buffers are no longer pushed to the channel. Memory of idle
 * buffers is freed at once; memory of buffers still wrapped is freed when their last
 * reference is released.
 */
public final class HardwareBufferPool implements ImagePool {
    private static final Logger LOG = Logger.getLogger(HardwareBufferPool.class.getName());

    private final HardwareChannel channel;
    private final int payloadBytes;
    private final ByteBufAllocator allocator;
    private final RecyclingImagePool conversionPool;
    private final PipelineMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Map<Long, RawBuffer> buffers = new ConcurrentHashMap<>();
    private final Set<Long> wrappedIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong bufferIds = new AtomicLong(1);

    private final AtomicLong wrapCount = new AtomicLong();
    private final AtomicLong returnCount = new AtomicLong();
    private final AtomicLong grownCount = new AtomicLong();

    public HardwareBufferPool(HardwareChannel channel,
                              int payloadBytes,
                              int initialBuffers,
                              ByteBufAllocator allocator,
                              PipelineMetrics metrics) {
        if (payloadBytes <= 0) {
            throw new IllegalArgumentException("payloadBytes must be > 0, got " + payloadBytes);
        }
        if (initialBuffers < 0) {
            throw new IllegalArgumentException("initialBuffers must be >= 0, got " + initialBuffers);
        }
        this.channel = Objects.requireNonNull(channel, "channel");
        this.payloadBytes = payloadBytes;
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
        this.conversionPool = new RecyclingImagePool(allocator);
        allocateBuffers(initialBuffers);
    }

    /**
     * Allocates {@code n} payload-sized buffers and pushes them to the channel.
     *
     * @return number of buffers actually added (0 once closed)
     */
    public int allocateBuffers(int n) {
        int added = 0;
        for (int i = 0; i < n; i++) {
            if (closed.get()) {
                break;
            }
            ByteBuf memory = allocator.directBuffer(payloadBytes, payloadBytes);
            RawBuffer buffer = new RawBuffer(bufferIds.getAndIncrement(), memory);
            buffers.put(buffer.bufferId(), buffer);
            channel.pushBuffer(buffer);
            added++;
        }
        return added;
    }

    /**
     * Grows the pool by one buffer when the hardware has none left to fill.
     *
     * @param availableCount empty buffers the hardware currently holds
     * @return {@code true} when a buffer was added
     */
    public boolean ensureAvailable(int availableCount) {
        if (availableCount > 0) {
            return false;
        }
        if (allocateBuffers(1) == 0) {
            return false;
        }
        long grown = grownCount.incrementAndGet();
        metrics.incPoolGrowth(1L);
        LOG.fine(() -> "Hardware pool grew by one buffer, total=" + buffers.size() + " grown=" + grown);
        return true;
    }

    /**
     * Wraps a filled buffer without copying. The returned handle holds one reference;
     * the buffer returns to the channel when the last reference is released.
     */
    public PooledImage wrap(RawBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        if (!wrappedIds.add(buffer.bufferId())) {
            throw new IllegalStateException("Buffer already wrapped, bufferId=" + buffer.bufferId());
        }
        ByteBuf view = buffer.memory().slice(0, buffer.byteLength());
        wrapCount.incrementAndGet();
        return new PooledImage(buffer.bufferId(), new Image(view), ref -> {
            wrappedIds.remove(buffer.bufferId());
            returnBuffer(buffer);
        });
    }

    /**
     * Hands a popped buffer back to the hardware rotation. Used both for wrapped buffers
     * reaching zero references and for buffers that never entered routing.
     */
    public void returnBuffer(RawBuffer buffer) {
        returnCount.incrementAndGet();
        metrics.incBuffersReturned(1L);
        if (closed.get()) {
            freeMemory(buffer);
            return;
        }
        channel.pushBuffer(buffer);
    }

    @Override
    public PooledImage getRecyclableImage() {
        return conversionPool.getRecyclableImage();
    }

    public int payloadBytes() {
        return payloadBytes;
    }

    public int size() {
        return buffers.size();
    }

    @Override
    public PoolStats stats() {
        long wrapped = wrapCount.get();
        return new PoolStats(
            buffers.size(),
            wrapped,
            returnCount.get(),
            wrappedIds.size(),
            grownCount.get()
        );
    }

    public PoolStats conversionStats() {
        return conversionPool.stats();
    }

    private void freeMemory(RawBuffer buffer) {
        if (buffers.remove(buffer.bufferId()) != null && buffer.memory().refCnt() > 0) {
            buffer.memory().release();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int inFlight = wrappedIds.size();
        if (inFlight > 0) {
            LOG.warning("Closing HardwareBufferPool with " + inFlight
                + " wrapped buffers still referenced, their memory is freed on last release");
        }
        for (RawBuffer buffer : buffers.values()) {
            if (!wrappedIds.contains(buffer.bufferId())) {
                freeMemory(buffer);
            }
        }
        conversionPool.close();
    }
}
