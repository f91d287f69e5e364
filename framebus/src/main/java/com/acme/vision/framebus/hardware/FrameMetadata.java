package com.acme.vision.framebus.hardware;

import java.util.List;
import java.util.Objects;

/**
 * What the hardware layer reports about a filled buffer.
 *
 * <p>For {@link PayloadType#IMAGE} payloads {@code parts} holds exactly one entry
 * describing the whole image. Timestamps are in nanoseconds.
 */
public record FrameMetadata(
    BufferStatus status,
    PayloadType payloadType,
    int byteLength,
    List<PartInfo> parts,
    long timestampNanos,
    long systemTimestampNanos,
    long frameId
) {
    public FrameMetadata {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(payloadType, "payloadType");
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static FrameMetadata failed(BufferStatus status, long frameId) {
        return new FrameMetadata(status, PayloadType.UNKNOWN, 0, List.of(), 0L, 0L, frameId);
    }
}
