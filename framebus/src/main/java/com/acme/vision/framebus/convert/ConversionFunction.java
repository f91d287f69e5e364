package com.acme.vision.framebus.convert;

import com.acme.vision.framebus.image.Image;

/**
 * Converts a device pixel format into a consumer encoding.
 *
 * <p>{@code source} must not be modified: it may be a zero-copy view of hardware
 * memory. {@code destination} is exclusively owned by the caller; implementations
 * fill its data, geometry, step and encoding. The header is copied by the caller.
 */
@FunctionalInterface
public interface ConversionFunction {
    void convert(Image source, Image destination);
}
