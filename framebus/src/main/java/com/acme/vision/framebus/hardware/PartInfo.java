package com.acme.vision.framebus.hardware;

import java.util.Objects;

/**
 * Location of one part inside a buffer: the sensor region it covers and the
 * byte range holding its pixels.
 */
public record PartInfo(Region region, int offset, int length) {
    public PartInfo {
        Objects.requireNonNull(region, "region");
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("offset and length must be >= 0, got offset=" + offset + " length=" + length);
        }
    }
}
