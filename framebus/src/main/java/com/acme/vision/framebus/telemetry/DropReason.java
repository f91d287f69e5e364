package com.acme.vision.framebus.telemetry;

/**
 * Why a frame did not reach a sink.
 */
public enum DropReason {
    BUFFER_FAILURE,
    NO_SUBSCRIBERS,
    UNSUPPORTED_PAYLOAD,
    CHUNK_DATA_UNIMPLEMENTED,
    MAILBOX_OVERWRITE,
    PROCESSING_FAILURE,
    SHUTDOWN
}
