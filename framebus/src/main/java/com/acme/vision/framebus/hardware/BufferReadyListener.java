package com.acme.vision.framebus.hardware;

/**
 * Event sink for the hardware "new buffer" signal. Invoked on the hardware event
 * thread; implementations must not block.
 */
@FunctionalInterface
public interface BufferReadyListener {
    void onBufferReady(int streamId);
}
