package com.acme.vision.framebus.hardware;

public enum BufferStatus {
    UNKNOWN,
    SUCCESS,
    CLEARED,
    TIMEOUT,
    MISSING_PACKETS,
    WRONG_PACKET_ID,
    SIZE_MISMATCH,
    FILLING,
    ABORTED,
    PAYLOAD_NOT_SUPPORTED
}
