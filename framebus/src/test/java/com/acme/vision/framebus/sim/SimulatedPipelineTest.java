package com.acme.vision.framebus.sim;

import com.acme.vision.framebus.config.FramebusEnvKeys;
import com.acme.vision.framebus.config.PipelineConfig;
import com.acme.vision.framebus.hardware.BufferStatus;
import com.acme.vision.framebus.hardware.PayloadType;
import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.pipeline.FramePipeline;
import com.acme.vision.framebus.telemetry.AtomicPipelineMetrics;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimulatedPipelineTest {

    @Test
    void shouldStreamMultipartFramesToEverySubstream() throws Exception {
        Map<String, String> env = Map.of(
            FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "left,right",
            FramebusEnvKeys.FRAMEBUS_MAILBOX_WAIT_MS, "20",
            FramebusEnvKeys.FRAMEBUS_METRICS_ENABLED, "false"
        );
        PipelineConfig config = PipelineConfig.fromEnv(env);
        SimulationSettings settings = new SimulationSettings(8, 4, 200, 2, "Mono8");
        SimulatedCameraDevice device = new SimulatedCameraDevice("sim", 1, settings, true);
        List<LoggingImageSink> sinks = new CopyOnWriteArrayList<>();
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();

        FramePipeline pipeline = FramePipeline.builder(device, (layout, onChange) -> {
                LoggingImageSink sink = new LoggingImageSink(layout, onChange);
                sinks.add(sink);
                return sink;
            })
            .config(config)
            .metrics(metrics)
            .build();
        try {
            assertTrue(pipeline.start());
            assertTrue(device.isAcquiring());
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while ((sinks.get(0).publishedCount() < 5 || sinks.get(1).publishedCount() < 5)
                && System.nanoTime() < deadline) {
                Thread.sleep(10L);
            }
            assertTrue(sinks.get(0).publishedCount() >= 5);
            assertTrue(sinks.get(1).publishedCount() >= 5);
        } finally {
            pipeline.close();
        }
        assertFalse(device.isAcquiring());
        assertTrue(metrics.snapshot().buffersIn() >= 5L);
    }

    @Test
    void shouldFillBuffersWithFrameMetadataAndCountUnderruns() {
        SimulationSettings settings = new SimulationSettings(4, 2, 30, 1, "Mono8");
        SimulatedChannel channel = new SimulatedChannel(0, settings);
        assertFalse(channel.fillNext());
        assertEquals(1L, channel.statistics().underruns());

        RawBuffer buffer = new RawBuffer(1L, Unpooled.directBuffer(settings.payloadBytes()));
        channel.pushBuffer(buffer);
        assertEquals(1, channel.availableCount());
        assertTrue(channel.fillNext());

        RawBuffer popped = channel.tryPopBuffer();
        assertNotNull(popped);
        assertSame(buffer, popped);
        assertEquals(BufferStatus.SUCCESS, popped.status());
        assertEquals(PayloadType.IMAGE, popped.payloadType());
        assertEquals(8, popped.byteLength());
        assertEquals(1L, popped.frameId());
        assertEquals(1L, channel.statistics().completedBuffers());
        channel.close();
        buffer.memory().release();
    }

    @Test
    void shouldDeriveBitsPerPixelFromFormat() {
        assertEquals(24, new SimulationSettings(2, 2, 1, 1, "RGB8").bitsPerPixel());
        assertEquals(16, new SimulationSettings(2, 2, 1, 1, "Mono12").bitsPerPixel());
        assertEquals(8, new SimulationSettings(2, 2, 1, 1, "BayerRG8").bitsPerPixel());
        assertEquals(2 * 2 * 2 * 3, new SimulationSettings(2, 2, 1, 3, "Mono16").payloadBytes());
    }
}
