package com.acme.vision.framebus.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable pipeline configuration, read once at setup.
 */
public record PipelineConfig(
    String nodeName,
    List<List<String>> channelNames,
    List<List<String>> frameIds,
    String tfPrefix,
    List<List<String>> pixelFormatInternal,
    ClockSource clockSource,
    int initialBuffers,
    Duration mailboxWait,
    Duration channelRetryDelay,
    int channelRetryMaxAttempts,
    double softwareTriggerRateHz,
    boolean metricsEnabled,
    int metricsIntervalSeconds
) {
    public PipelineConfig {
        Objects.requireNonNull(nodeName, "nodeName");
        Objects.requireNonNull(clockSource, "clockSource");
        Objects.requireNonNull(mailboxWait, "mailboxWait");
        Objects.requireNonNull(channelRetryDelay, "channelRetryDelay");
        channelNames = copy2D(channelNames == null || channelNames.isEmpty() ? List.of(List.of("")) : channelNames);
        frameIds = copy2D(frameIds == null ? List.of() : frameIds);
        pixelFormatInternal = copy2D(pixelFormatInternal == null ? List.of() : pixelFormatInternal);
        tfPrefix = tfPrefix == null ? "" : tfPrefix;
        if (initialBuffers < 0) {
            throw new IllegalArgumentException("initialBuffers must be >= 0, got " + initialBuffers);
        }
        if (mailboxWait.isNegative() || mailboxWait.isZero()) {
            throw new IllegalArgumentException("mailboxWait must be positive, got " + mailboxWait);
        }
    }

    /** Single unnamed substream on one stream, everything else at defaults. */
    public static PipelineConfig defaults() {
        return fromEnv(Map.of());
    }

    public static PipelineConfig fromEnv(Map<String, String> env) {
        String nodeName = EnvVars.getOrDefault(env, FramebusEnvKeys.FRAMEBUS_NODE_NAME, FramebusDefaults.DEFAULT_NODE_NAME);
        String frameIdArgs = EnvVars.getOrDefault(env, FramebusEnvKeys.FRAMEBUS_FRAME_IDS, null);
        boolean hardwareStamp = EnvVars.getBoolean(env, FramebusEnvKeys.FRAMEBUS_USE_HARDWARE_TIMESTAMP, false);
        long mailboxWaitMs = EnvVars.getLongClamped(env, FramebusEnvKeys.FRAMEBUS_MAILBOX_WAIT_MS,
            FramebusDefaults.DEFAULT_MAILBOX_WAIT_MS, FramebusDefaults.MIN_MAILBOX_WAIT_MS, FramebusDefaults.MAX_MAILBOX_WAIT_MS);
        long retryDelayMs = EnvVars.getLongClamped(env, FramebusEnvKeys.FRAMEBUS_CHANNEL_RETRY_DELAY_MS,
            FramebusDefaults.DEFAULT_CHANNEL_RETRY_DELAY_MS, 0L, 60_000L);

        return new PipelineConfig(
            nodeName,
            StreamArgs.parse2D(EnvVars.getOrDefault(env, FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "")),
            frameIdArgs == null ? List.of() : StreamArgs.parse2D(frameIdArgs),
            EnvVars.getOrDefault(env, FramebusEnvKeys.FRAMEBUS_TF_PREFIX, ""),
            StreamArgs.parse2D(EnvVars.getOrDefault(env, FramebusEnvKeys.FRAMEBUS_PIXEL_FORMAT_INTERNAL, "")),
            hardwareStamp ? ClockSource.HARDWARE : ClockSource.SYSTEM,
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_INITIAL_BUFFERS,
                FramebusDefaults.DEFAULT_INITIAL_BUFFERS, 1, FramebusDefaults.MAX_INITIAL_BUFFERS),
            Duration.ofMillis(mailboxWaitMs),
            Duration.ofMillis(retryDelayMs),
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_CHANNEL_RETRY_MAX_ATTEMPTS,
                FramebusDefaults.DEFAULT_CHANNEL_RETRY_MAX_ATTEMPTS, 0, Integer.MAX_VALUE),
            EnvVars.getDoubleClamped(env, FramebusEnvKeys.FRAMEBUS_SOFTWARE_TRIGGER_RATE_HZ,
                0.0d, 0.0d, FramebusDefaults.MAX_SOFTWARE_TRIGGER_RATE_HZ),
            EnvVars.getBoolean(env, FramebusEnvKeys.FRAMEBUS_METRICS_ENABLED, true),
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_METRICS_LOG_INTERVAL_SEC,
                FramebusDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, 3600)
        );
    }

    /** Number of stream channels named in the configuration. */
    public int configuredStreams() {
        return channelNames.size();
    }

    public PipelineConfig withClockSource(ClockSource source) {
        return new PipelineConfig(nodeName, channelNames, frameIds, tfPrefix, pixelFormatInternal, source,
            initialBuffers, mailboxWait, channelRetryDelay, channelRetryMaxAttempts, softwareTriggerRateHz,
            metricsEnabled, metricsIntervalSeconds);
    }

    public PipelineConfig withMailboxWait(Duration wait) {
        return new PipelineConfig(nodeName, channelNames, frameIds, tfPrefix, pixelFormatInternal, clockSource,
            initialBuffers, wait, channelRetryDelay, channelRetryMaxAttempts, softwareTriggerRateHz,
            metricsEnabled, metricsIntervalSeconds);
    }

    /**
     * Resolves names, frame ids, topics and pixel format overrides for the first
     * {@code streamCount} streams.
     */
    public List<List<SubstreamLayout>> layouts(int streamCount) {
        int streams = Math.min(streamCount, channelNames.size());
        List<List<SubstreamLayout>> out = new ArrayList<>(streams);
        boolean single = streams == 1 && channelNames.get(0).size() == 1;
        for (int s = 0; s < streams; s++) {
            List<String> names = channelNames.get(s);
            List<SubstreamLayout> row = new ArrayList<>(names.size());
            for (int j = 0; j < names.size(); j++) {
                String name = names.get(j);
                row.add(new SubstreamLayout(
                    s,
                    j,
                    name,
                    resolveFrameId(s, j, name),
                    topicFor(name, single),
                    StreamArgs.at(pixelFormatInternal, s, j)
                ));
            }
            out.add(List.copyOf(row));
        }
        return List.copyOf(out);
    }

    private String resolveFrameId(int stream, int substream, String name) {
        String frameId = StreamArgs.at(frameIds, stream, substream);
        if (frameId.isEmpty()) {
            frameId = name.isEmpty() ? nodeName : nodeName + "/" + name;
        }
        if (tfPrefix.isEmpty() || frameId.startsWith("/")) {
            return frameId;
        }
        return tfPrefix + "/" + frameId;
    }

    private String topicFor(String name, boolean single) {
        if (single && name.isEmpty()) {
            return nodeName + "/image_raw";
        }
        return nodeName + "/" + name + "/image_raw";
    }

    private static List<List<String>> copy2D(List<List<String>> in) {
        List<List<String>> out = new ArrayList<>(in.size());
        for (List<String> row : in) {
            out.add(List.copyOf(row));
        }
        return List.copyOf(out);
    }
}
