package com.acme.vision.framebus.config;

import java.util.Objects;

/**
 * Naming of one substream, resolved from configuration before the pipeline starts.
 *
 * @param streamId            hardware stream channel index
 * @param index               substream index, equal to the part index in multipart payloads
 * @param name                component name, may be empty for a single unnamed substream
 * @param frameId             destination identifier stamped on every image
 * @param topic               name the sink publishes under
 * @param pixelFormatOverride pixel format to use for conversion lookup instead of the
 *                            device-reported one; empty when not overridden
 */
public record SubstreamLayout(
    int streamId,
    int index,
    String name,
    String frameId,
    String topic,
    String pixelFormatOverride
) {
    public SubstreamLayout {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(frameId, "frameId");
        Objects.requireNonNull(topic, "topic");
        pixelFormatOverride = pixelFormatOverride == null ? "" : pixelFormatOverride;
    }

    public boolean hasPixelFormatOverride() {
        return !pixelFormatOverride.isEmpty();
    }

    /** Label used in log lines. */
    public String label() {
        return name.isEmpty() ? "#" + index : name;
    }
}
