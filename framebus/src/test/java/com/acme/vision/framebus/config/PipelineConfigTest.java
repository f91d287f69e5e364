package com.acme.vision.framebus.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineConfigTest {

    @Test
    void shouldUseDefaultsWhenEnvironmentIsEmpty() {
        PipelineConfig config = PipelineConfig.defaults();

        assertEquals("camera", config.nodeName());
        assertEquals(List.of(List.of("")), config.channelNames());
        assertEquals(1, config.configuredStreams());
        assertEquals(ClockSource.SYSTEM, config.clockSource());
        assertEquals(10, config.initialBuffers());
        assertEquals(Duration.ofMillis(1_000), config.mailboxWait());
        assertEquals(Duration.ofMillis(1_000), config.channelRetryDelay());
        assertEquals(0, config.channelRetryMaxAttempts());
        assertEquals(0.0d, config.softwareTriggerRateHz());
        assertTrue(config.metricsEnabled());
        assertEquals(30, config.metricsIntervalSeconds());
    }

    @Test
    void shouldReadAndClampEnvironment() {
        PipelineConfig config = PipelineConfig.fromEnv(Map.of(
            FramebusEnvKeys.FRAMEBUS_NODE_NAME, "stereo",
            FramebusEnvKeys.FRAMEBUS_USE_HARDWARE_TIMESTAMP, "true",
            FramebusEnvKeys.FRAMEBUS_INITIAL_BUFFERS, "1000",
            FramebusEnvKeys.FRAMEBUS_MAILBOX_WAIT_MS, "1",
            FramebusEnvKeys.FRAMEBUS_SOFTWARE_TRIGGER_RATE_HZ, "30",
            FramebusEnvKeys.FRAMEBUS_METRICS_ENABLED, "false"
        ));

        assertEquals("stereo", config.nodeName());
        assertEquals(ClockSource.HARDWARE, config.clockSource());
        assertEquals(256, config.initialBuffers());
        assertEquals(Duration.ofMillis(10), config.mailboxWait());
        assertEquals(30.0d, config.softwareTriggerRateHz());
        assertFalse(config.metricsEnabled());
    }

    @Test
    void shouldNameSingleUnnamedSubstreamAfterNode() {
        List<List<SubstreamLayout>> layouts = PipelineConfig.fromEnv(Map.of(
            FramebusEnvKeys.FRAMEBUS_NODE_NAME, "cam")).layouts(1);

        SubstreamLayout only = layouts.get(0).get(0);
        assertEquals("cam", only.frameId());
        assertEquals("cam/image_raw", only.topic());
        assertEquals("#0", only.label());
    }

    @Test
    void shouldDeriveFrameIdsAndTopicsForNamedSubstreams() {
        PipelineConfig config = PipelineConfig.fromEnv(Map.of(
            FramebusEnvKeys.FRAMEBUS_NODE_NAME, "cam",
            FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "left,right;depth",
            FramebusEnvKeys.FRAMEBUS_FRAME_IDS, ",right_optical;/world/depth",
            FramebusEnvKeys.FRAMEBUS_TF_PREFIX, "robot1",
            FramebusEnvKeys.FRAMEBUS_PIXEL_FORMAT_INTERNAL, "BayerRG8"
        ));

        List<List<SubstreamLayout>> layouts = config.layouts(2);
        SubstreamLayout left = layouts.get(0).get(0);
        SubstreamLayout right = layouts.get(0).get(1);
        SubstreamLayout depth = layouts.get(1).get(0);

        assertEquals("robot1/cam/left", left.frameId());
        assertEquals("robot1/right_optical", right.frameId());
        assertEquals("/world/depth", depth.frameId(), "absolute frame ids are not prefixed");
        assertEquals("cam/left/image_raw", left.topic());
        assertEquals("cam/depth/image_raw", depth.topic());
        assertEquals("BayerRG8", left.pixelFormatOverride());
        assertFalse(right.hasPixelFormatOverride());
        assertEquals(1, depth.streamId());
    }

    @Test
    void shouldOnlyLayOutStreamsTheDeviceProvides() {
        PipelineConfig config = PipelineConfig.fromEnv(Map.of(FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "a;b;c"));
        assertEquals(3, config.configuredStreams());
        assertEquals(2, config.layouts(2).size());
    }

    @Test
    void shouldUseNamedTopicForSingleNamedSubstream() {
        PipelineConfig config = PipelineConfig.fromEnv(Map.of(
            FramebusEnvKeys.FRAMEBUS_NODE_NAME, "cam",
            FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "ir"));
        assertEquals("cam/ir/image_raw", config.layouts(1).get(0).get(0).topic());
    }

    @Test
    void shouldRejectNonPositiveMailboxWait() {
        PipelineConfig config = PipelineConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.withMailboxWait(Duration.ZERO));
        assertEquals(ClockSource.HARDWARE, config.withClockSource(ClockSource.HARDWARE).clockSource());
    }
}
