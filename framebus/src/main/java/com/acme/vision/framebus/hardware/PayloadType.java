package com.acme.vision.framebus.hardware;

/**
 * Shape of the data carried by a hardware buffer.
 */
public enum PayloadType {
    IMAGE,
    MULTIPART,
    CHUNK_DATA,
    UNKNOWN
}
