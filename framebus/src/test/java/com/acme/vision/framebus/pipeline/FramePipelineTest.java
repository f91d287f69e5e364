package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.config.FramebusEnvKeys;
import com.acme.vision.framebus.config.PipelineConfig;
import com.acme.vision.framebus.config.SubstreamLayout;
import com.acme.vision.framebus.sink.SinkFactory;
import com.acme.vision.framebus.telemetry.AtomicPipelineMetrics;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FramePipelineTest {
    private static final byte[] PIXELS = {1, 2, 3, 4, 5, 6, 7, 8};

    private final List<SubstreamLayout> opened = new CopyOnWriteArrayList<>();
    private final List<RecordingSink> sinks = new CopyOnWriteArrayList<>();
    private final List<Runnable> subscriptionCallbacks = new CopyOnWriteArrayList<>();

    private final SinkFactory sinkFactory = (layout, onChange) -> {
        RecordingSink sink = new RecordingSink();
        opened.add(layout);
        sinks.add(sink);
        subscriptionCallbacks.add(onChange);
        return sink;
    };

    private static PipelineConfig config(String... keyValues) {
        Map<String, String> env = new HashMap<>();
        env.put(FramebusEnvKeys.FRAMEBUS_MAILBOX_WAIT_MS, "20");
        env.put(FramebusEnvKeys.FRAMEBUS_CHANNEL_RETRY_DELAY_MS, "0");
        env.put(FramebusEnvKeys.FRAMEBUS_METRICS_ENABLED, "false");
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            env.put(keyValues[i], keyValues[i + 1]);
        }
        return PipelineConfig.fromEnv(env);
    }

    private FramePipeline pipeline(FakeCameraDevice device, PipelineConfig config) {
        return FramePipeline.builder(device, sinkFactory)
            .config(config)
            .allocator(UnpooledByteBufAllocator.DEFAULT)
            .metrics(new AtomicPipelineMetrics())
            .sleeper(d -> { })
            .build();
    }

    @Test
    void shouldTreatZeroReportedChannelsAsOneAndCapByConfiguredStreams() {
        assertEquals(1, FramePipeline.discoverStreams(new FakeCameraDevice(0, 8), config()));
        assertEquals(1, FramePipeline.discoverStreams(new FakeCameraDevice(4, 8), config()));
        assertEquals(2, FramePipeline.discoverStreams(new FakeCameraDevice(4, 8),
            config(FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "a;b")));
        assertEquals(1, FramePipeline.discoverStreams(new FakeCameraDevice(1, 8),
            config(FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "a;b")));
    }

    @Test
    void shouldOpenOneSinkPerConfiguredSubstreamWithResolvedNames() {
        FakeCameraDevice device = new FakeCameraDevice(2, 16);
        FramePipeline pipeline = pipeline(device, config(
            FramebusEnvKeys.FRAMEBUS_NODE_NAME, "cam",
            FramebusEnvKeys.FRAMEBUS_CHANNEL_NAMES, "left,right;depth"));
        try {
            assertEquals(2, pipeline.streams().size());
            assertEquals(3, opened.size());
            assertEquals("cam/left", opened.get(0).frameId());
            assertEquals("cam/right/image_raw", opened.get(1).topic());
            assertEquals(1, opened.get(2).streamId());
            assertEquals(0, opened.get(2).index());
            assertTrue(device.channels.isEmpty(), "no hardware access before start");
        } finally {
            pipeline.close();
        }
    }

    @Test
    void shouldStartAcquisitionOnlyWhenSomeoneIsSubscribed() {
        FakeCameraDevice device = new FakeCameraDevice(1, 16);
        FramePipeline pipeline = pipeline(device, config());
        sinks.get(0).subscribed = false;
        try {
            assertTrue(pipeline.start());
            assertTrue(device.commands.isEmpty());
            assertFalse(pipeline.isAcquiring());

            sinks.get(0).subscribed = true;
            subscriptionCallbacks.get(0).run();
            assertEquals(List.of("start"), device.commands);

            sinks.get(0).subscribed = false;
            subscriptionCallbacks.get(0).run();
            subscriptionCallbacks.get(0).run();
            assertEquals(List.of("start", "stop"), device.commands);
        } finally {
            pipeline.close();
        }
    }

    @Test
    void shouldDeliverFramesEndToEnd() throws Exception {
        FakeCameraDevice device = new FakeCameraDevice(1, 16);
        FramePipeline pipeline = pipeline(device, config(FramebusEnvKeys.FRAMEBUS_NODE_NAME, "cam"));
        try {
            assertTrue(pipeline.start());
            assertTrue(pipeline.isAcquiring());
            FakeHardwareChannel channel = device.channel(0);
            channel.produce(FakeHardwareChannel.image(3L, 4, 2, 8), PIXELS);

            RecordingSink.Published published = sinks.get(0).next();
            assertNotNull(published);
            assertEquals("mono8", published.encoding());
            assertEquals("cam", published.header().frameId());
            assertEquals(3L, published.header().seq());
        } finally {
            pipeline.close();
        }
    }

    @Test
    void shouldTearDownInOrderAndReturnAllBuffers() {
        FakeCameraDevice device = new FakeCameraDevice(1, 16);
        FramePipeline pipeline = pipeline(device, config());
        assertTrue(pipeline.start());
        FakeHardwareChannel channel = device.channel(0);
        for (int i = 1; i <= 50; i++) {
            channel.produce(FakeHardwareChannel.image(i, 4, 2, 8), PIXELS);
        }

        pipeline.close();

        assertFalse(channel.emit.get());
        assertTrue(channel.closed.get());
        assertEquals(List.of("start", "stop"), device.commands);
        assertEquals(0, channel.outstanding());
        assertEquals(0, channel.doubleReturns.get());
        assertTrue(device.closed);
        assertTrue(sinks.get(0).closed);
        assertTrue(pipeline.isClosed());
        pipeline.close();
        assertEquals(List.of("start", "stop"), device.commands, "close is idempotent");
    }

    @Test
    void shouldCloseAsynchronouslyWhenDeviceControlIsLost() throws Exception {
        FakeCameraDevice device = new FakeCameraDevice(1, 16);
        FramePipeline pipeline = pipeline(device, config());
        assertTrue(pipeline.start());
        assertNotNull(device.controlLost);

        device.controlLost.run();
        Thread waiter = new Thread(() -> {
            try {
                pipeline.awaitClose();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        waiter.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(waiter.isAlive());
        assertTrue(pipeline.isClosed());
        assertTrue(device.closed);
    }

    @Test
    void shouldFailStartAndCleanUpWhenChannelNeverOpens() {
        FakeCameraDevice device = new FakeCameraDevice(1, 16);
        device.failOpens = Integer.MAX_VALUE;
        FramePipeline pipeline = pipeline(device, config(FramebusEnvKeys.FRAMEBUS_CHANNEL_RETRY_MAX_ATTEMPTS, "3"));

        assertFalse(pipeline.start());
        assertEquals(3, device.openAttempts.get());
        assertTrue(pipeline.isClosed());
        assertTrue(device.closed);
    }

    @Test
    void shouldFireSoftwareTriggerWhileSubscribed() throws Exception {
        FakeCameraDevice device = new FakeCameraDevice(1, 16);
        FramePipeline pipeline = pipeline(device, config(FramebusEnvKeys.FRAMEBUS_SOFTWARE_TRIGGER_RATE_HZ, "200"));
        try {
            assertTrue(pipeline.start());
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (device.triggers.get() < 3 && System.nanoTime() < deadline) {
                Thread.sleep(5L);
            }
            assertTrue(device.triggers.get() >= 3);
        } finally {
            pipeline.close();
        }
    }
}
