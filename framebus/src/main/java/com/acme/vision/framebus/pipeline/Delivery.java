package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.memory.PooledImage;

import java.util.Objects;

/**
 * A buffer handed to one substream, together with the reference that substream owns
 * on the shared wrapper.
 */
public record Delivery(RawBuffer buffer, PooledImage source) {
    public Delivery {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(source, "source");
    }

    /** Drops this delivery's reference on the shared wrapper. */
    public void release() {
        source.release();
    }
}
