package com.acme.vision.framebus.config;

/**
 * Which clock stamps outgoing images.
 */
public enum ClockSource {
    /** Camera timestamp, e.g. a PTP-synchronised device clock. */
    HARDWARE,
    /** Host time at which the buffer was received. */
    SYSTEM
}
