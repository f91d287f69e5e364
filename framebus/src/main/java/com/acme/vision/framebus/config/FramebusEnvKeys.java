package com.acme.vision.framebus.config;

/**
 * Canonical environment variable names read at pipeline setup.
 */
public final class FramebusEnvKeys {
    public static final String FRAMEBUS_NODE_NAME = "FRAMEBUS_NODE_NAME";
    public static final String FRAMEBUS_CHANNEL_NAMES = "FRAMEBUS_CHANNEL_NAMES";
    public static final String FRAMEBUS_FRAME_IDS = "FRAMEBUS_FRAME_IDS";
    public static final String FRAMEBUS_TF_PREFIX = "FRAMEBUS_TF_PREFIX";
    public static final String FRAMEBUS_PIXEL_FORMAT_INTERNAL = "FRAMEBUS_PIXEL_FORMAT_INTERNAL";
    public static final String FRAMEBUS_USE_HARDWARE_TIMESTAMP = "FRAMEBUS_USE_HARDWARE_TIMESTAMP";

    public static final String FRAMEBUS_INITIAL_BUFFERS = "FRAMEBUS_INITIAL_BUFFERS";
    public static final String FRAMEBUS_MAILBOX_WAIT_MS = "FRAMEBUS_MAILBOX_WAIT_MS";
    public static final String FRAMEBUS_CHANNEL_RETRY_DELAY_MS = "FRAMEBUS_CHANNEL_RETRY_DELAY_MS";
    public static final String FRAMEBUS_CHANNEL_RETRY_MAX_ATTEMPTS = "FRAMEBUS_CHANNEL_RETRY_MAX_ATTEMPTS";
    public static final String FRAMEBUS_SOFTWARE_TRIGGER_RATE_HZ = "FRAMEBUS_SOFTWARE_TRIGGER_RATE_HZ";

    public static final String FRAMEBUS_METRICS_ENABLED = "FRAMEBUS_METRICS_ENABLED";
    public static final String FRAMEBUS_METRICS_LOG_INTERVAL_SEC = "FRAMEBUS_METRICS_LOG_INTERVAL_SEC";

    public static final String FRAMEBUS_SIM_WIDTH = "FRAMEBUS_SIM_WIDTH";
    public static final String FRAMEBUS_SIM_HEIGHT = "FRAMEBUS_SIM_HEIGHT";
    public static final String FRAMEBUS_SIM_FPS = "FRAMEBUS_SIM_FPS";
    public static final String FRAMEBUS_SIM_PARTS = "FRAMEBUS_SIM_PARTS";
    public static final String FRAMEBUS_SIM_PIXEL_FORMAT = "FRAMEBUS_SIM_PIXEL_FORMAT";

    private FramebusEnvKeys() {
    }
}
