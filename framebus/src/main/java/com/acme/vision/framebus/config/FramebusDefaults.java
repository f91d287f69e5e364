package com.acme.vision.framebus.config;

/**
 * Default capacity, timeout, and tuning constants for the pipeline.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class FramebusDefaults {

    public static final String DEFAULT_NODE_NAME = "camera";

    // ---- Hardware pool ----
    public static final int DEFAULT_INITIAL_BUFFERS = 10;
    public static final int MAX_INITIAL_BUFFERS = 256;

    // ---- Substream workers ----
    public static final long DEFAULT_MAILBOX_WAIT_MS = 1_000L;
    public static final long MIN_MAILBOX_WAIT_MS = 10L;
    public static final long MAX_MAILBOX_WAIT_MS = 10_000L;
    public static final long WORKER_JOIN_GRACE_MS = 2_000L;

    // ---- Channel open retry ----
    public static final long DEFAULT_CHANNEL_RETRY_DELAY_MS = 1_000L;
    public static final int DEFAULT_CHANNEL_RETRY_MAX_ATTEMPTS = 0;

    // ---- Software trigger ----
    public static final double MAX_SOFTWARE_TRIGGER_RATE_HZ = 1_000.0d;

    // ---- Metrics ----
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 30;

    // ---- Simulator ----
    public static final int DEFAULT_SIM_WIDTH = 640;
    public static final int DEFAULT_SIM_HEIGHT = 480;
    public static final int DEFAULT_SIM_FPS = 30;
    public static final int DEFAULT_SIM_PARTS = 1;
    public static final String DEFAULT_SIM_PIXEL_FORMAT = "Mono8";

    private FramebusDefaults() {
    }
}
