package com.acme.vision.framebus.sim;

import com.acme.vision.framebus.hardware.BufferReadyListener;
import com.acme.vision.framebus.hardware.BufferStatus;
import com.acme.vision.framebus.hardware.ChannelStatistics;
import com.acme.vision.framebus.hardware.FrameMetadata;
import com.acme.vision.framebus.hardware.HardwareChannel;
import com.acme.vision.framebus.hardware.PartInfo;
import com.acme.vision.framebus.hardware.PayloadType;
import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.hardware.Region;
import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory stream channel. {@link #fillNext()} plays the part of the hardware: it
 * takes an empty buffer, writes a moving gradient into it and signals the listener.
 */
public final class SimulatedChannel implements HardwareChannel {
    private static final Logger LOG = Logger.getLogger(SimulatedChannel.class.getName());

    private final int streamId;
    private final SimulationSettings settings;
    private final ConcurrentLinkedQueue<RawBuffer> empty = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<RawBuffer> filled = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean emitSignals = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong frameIds = new AtomicLong(1);
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong underruns = new AtomicLong();
    private volatile BufferReadyListener listener;

    public SimulatedChannel(int streamId, SimulationSettings settings) {
        this.streamId = streamId;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Fills one empty buffer, if there is one, and signals the listener.
     *
     * @return {@code false} on underrun or after close
     */
    public boolean fillNext() {
        if (closed.get()) {
            return false;
        }
        RawBuffer buffer = empty.poll();
        if (buffer == null) {
            underruns.incrementAndGet();
            return false;
        }
        long frameId = frameIds.getAndIncrement();
        buffer.complete(writeFrame(buffer.memory(), frameId));
        filled.offer(buffer);
        completed.incrementAndGet();

        BufferReadyListener l = listener;
        if (emitSignals.get() && l != null) {
            try {
                l.onBufferReady(streamId);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Buffer ready listener failed stream=" + streamId, e);
            }
        }
        return true;
    }

    private FrameMetadata writeFrame(ByteBuf memory, long frameId) {
        int partBytes = settings.partBytes();
        int parts = settings.parts();
        int total = Math.min(partBytes * parts, memory.capacity());
        for (int i = 0; i < total; i++) {
            memory.setByte(i, (int) ((i + frameId) & 0xFF));
        }
        memory.setIndex(0, total);

        List<PartInfo> partInfos = new ArrayList<>(parts);
        Region region = new Region(0, 0, settings.width(), settings.height());
        for (int p = 0; p < parts; p++) {
            partInfos.add(new PartInfo(region, p * partBytes, partBytes));
        }
        long now = System.nanoTime();
        return new FrameMetadata(
            BufferStatus.SUCCESS,
            parts == 1 ? PayloadType.IMAGE : PayloadType.MULTIPART,
            total,
            partInfos,
            now,
            System.currentTimeMillis() * 1_000_000L,
            frameId
        );
    }

    @Override
    public RawBuffer tryPopBuffer() {
        return filled.poll();
    }

    @Override
    public int availableCount() {
        return empty.size();
    }

    @Override
    public void pushBuffer(RawBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        if (closed.get()) {
            return;
        }
        empty.offer(buffer);
    }

    @Override
    public void setBufferReadyListener(BufferReadyListener listener) {
        this.listener = listener;
    }

    @Override
    public void setEmitSignals(boolean emit) {
        emitSignals.set(emit);
    }

    @Override
    public ChannelStatistics statistics() {
        return new ChannelStatistics(completed.get(), 0L, underruns.get());
    }

    public int streamId() {
        return streamId;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            empty.clear();
            filled.clear();
            listener = null;
        }
    }
}
