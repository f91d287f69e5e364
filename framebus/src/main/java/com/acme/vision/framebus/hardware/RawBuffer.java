package com.acme.vision.framebus.hardware;

import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * A hardware frame buffer. Memory is allocated by the buffer pool and lent to the
 * hardware layer, which fills it and publishes {@link FrameMetadata} before the
 * buffer becomes poppable.
 *
 * <p>Ownership: a popped buffer must be handed back through
 * {@link HardwareChannel#pushBuffer(RawBuffer)} exactly once.
 */
public final class RawBuffer {
    private final long bufferId;
    private final ByteBuf memory;
    private volatile FrameMetadata metadata = FrameMetadata.failed(BufferStatus.CLEARED, 0L);

    public RawBuffer(long bufferId, ByteBuf memory) {
        this.bufferId = bufferId;
        this.memory = Objects.requireNonNull(memory, "memory");
    }

    public long bufferId() {
        return bufferId;
    }

    public ByteBuf memory() {
        return memory;
    }

    public int capacity() {
        return memory.capacity();
    }

    /** Called by the hardware layer once the buffer has been filled. */
    public void complete(FrameMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public FrameMetadata metadata() {
        return metadata;
    }

    public BufferStatus status() {
        return metadata.status();
    }

    public PayloadType payloadType() {
        return metadata.payloadType();
    }

    public int byteLength() {
        return Math.min(metadata.byteLength(), memory.capacity());
    }

    public int partCount() {
        return metadata.parts().size();
    }

    public PartInfo part(int index) {
        return metadata.parts().get(index);
    }

    /**
     * Region of the given part, or {@link Region#EMPTY} when the hardware did not
     * report one.
     */
    public Region partRegion(int index) {
        if (index < 0 || index >= metadata.parts().size()) {
            return Region.EMPTY;
        }
        return metadata.parts().get(index).region();
    }

    /**
     * Read-only view of the part's bytes, sharing the buffer memory. The view is
     * valid only while the buffer is held.
     */
    public ByteBuf partData(int index) {
        PartInfo part = part(index);
        int end = Math.min(part.offset() + part.length(), memory.capacity());
        int start = Math.min(part.offset(), end);
        return memory.slice(start, end - start).asReadOnly();
    }

    public long timestampNanos() {
        return metadata.timestampNanos();
    }

    public long systemTimestampNanos() {
        return metadata.systemTimestampNanos();
    }

    public long frameId() {
        return metadata.frameId();
    }

    @Override
    public String toString() {
        return "RawBuffer{bufferId=" + bufferId + ", frameId=" + metadata.frameId()
            + ", status=" + metadata.status() + ", payloadType=" + metadata.payloadType() + '}';
    }
}
