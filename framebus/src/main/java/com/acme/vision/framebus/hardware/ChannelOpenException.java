package com.acme.vision.framebus.hardware;

/**
 * Thrown when the device refuses to open a stream channel. Callers are expected to
 * retry; the failure is not fatal.
 */
public final class ChannelOpenException extends Exception {
    private final int streamId;

    public ChannelOpenException(int streamId, String message) {
        super("Could not open stream channel " + streamId + ": " + message);
        this.streamId = streamId;
    }

    public ChannelOpenException(int streamId, String message, Throwable cause) {
        super("Could not open stream channel " + streamId + ": " + message, cause);
        this.streamId = streamId;
    }

    public int streamId() {
        return streamId;
    }
}
