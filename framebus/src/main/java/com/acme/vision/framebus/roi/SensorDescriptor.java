package com.acme.vision.framebus.roi;

import java.util.Objects;

/**
 * Pixel layout the sensor reports for one component.
 *
 * @param pixelFormat  device pixel format name, e.g. {@code Mono12}
 * @param bitsPerPixel bits occupied by one pixel in the packed buffer
 * @param width        full sensor width
 * @param height       full sensor height
 */
public record SensorDescriptor(String pixelFormat, int bitsPerPixel, int width, int height) {
    public SensorDescriptor {
        Objects.requireNonNull(pixelFormat, "pixelFormat");
        if (bitsPerPixel < 0) {
            throw new IllegalArgumentException("bitsPerPixel must be >= 0, got " + bitsPerPixel);
        }
    }

    /**
     * Row stride in bytes for an image of {@code width} pixels. Integer division
     * matches how the hardware packs formats whose row bits are not a multiple of 8.
     */
    public int strideFor(int width) {
        return (width * bitsPerPixel) / 8;
    }
}
