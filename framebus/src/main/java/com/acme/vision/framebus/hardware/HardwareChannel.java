package com.acme.vision.framebus.hardware;

/**
 * One hardware stream channel.
 *
 * <p>Implementations must be thread-safe: {@link #pushBuffer} is called from the
 * producer thread and from substream worker threads concurrently.
 */
public interface HardwareChannel extends AutoCloseable {
    /** Non-blocking; returns {@code null} when no filled buffer is queued. */
    RawBuffer tryPopBuffer();

    /** Number of empty buffers the hardware still has to fill. */
    int availableCount();

    /** Hands a buffer (new or previously popped) to the hardware rotation. */
    void pushBuffer(RawBuffer buffer);

    void setBufferReadyListener(BufferReadyListener listener);

    void setEmitSignals(boolean emit);

    ChannelStatistics statistics();

    @Override
    default void close() {
    }
}
