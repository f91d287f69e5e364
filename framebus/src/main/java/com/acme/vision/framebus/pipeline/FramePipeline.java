package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.config.PipelineConfig;
import com.acme.vision.framebus.config.SubstreamLayout;
import com.acme.vision.framebus.convert.ConversionRegistry;
import com.acme.vision.framebus.hardware.CameraDevice;
import com.acme.vision.framebus.memory.HardwareBufferPool;
import com.acme.vision.framebus.memory.PoolStats;
import com.acme.vision.framebus.sink.ImageSink;
import com.acme.vision.framebus.sink.SinkFactory;
import com.acme.vision.framebus.telemetry.AtomicPipelineMetrics;
import com.acme.vision.framebus.telemetry.NoopPipelineMetrics;
import com.acme.vision.framebus.telemetry.PeriodicMetricsReporter;
import com.acme.vision.framebus.telemetry.PipelineMetrics;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Device-level owner of all streams.
 *
 * <p>The constructor resolves the stream and substream layout, opens one sink per
 * substream and looks up conversions; nothing touches the hardware until
 * {@link #start()}. {@link #close()} tears down in a fixed order: signals off on every
 * stream, workers stopped and joined, trigger stopped, statistics logged, acquisition
 * stopped, then channels and pools released.
 */
public final class FramePipeline implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(FramePipeline.class.getName());

    private final CameraDevice device;
    private final PipelineConfig config;
    private final PipelineMetrics metrics;
    private final List<Stream> streams;
    private final List<ImageSink> sinks;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final Object acquisitionLock = new Object();
    private volatile boolean spawning;
    private boolean acquiring;
    private SoftwareTrigger trigger;
    private PeriodicMetricsReporter reporter;

    private FramePipeline(Builder builder) {
        this.device = builder.device;
        this.config = builder.config;
        this.metrics = builder.metrics;
        RetryPolicy retryPolicy = new RetryPolicy(config.channelRetryDelay(), config.channelRetryMaxAttempts(), builder.sleeper);

        int streamCount = discoverStreams(device, config);
        List<List<SubstreamLayout>> layouts = config.layouts(streamCount);
        List<Stream> createdStreams = new ArrayList<>(layouts.size());
        List<ImageSink> createdSinks = new ArrayList<>();
        for (int s = 0; s < layouts.size(); s++) {
            List<Substream> substreams = new ArrayList<>(layouts.get(s).size());
            for (SubstreamLayout layout : layouts.get(s)) {
                ImageSink sink = builder.sinkFactory.open(layout, this::onSubscriptionChanged);
                createdSinks.add(sink);
                substreams.add(new Substream(
                    layout,
                    device.sensor(s, layout.name()),
                    device.initialRoi(s, layout.name()),
                    builder.conversions,
                    sink
                ));
            }
            createdStreams.add(new Stream(s, device, config, substreams, builder.allocator, retryPolicy, metrics));
        }
        this.streams = List.copyOf(createdStreams);
        this.sinks = List.copyOf(createdSinks);
    }

    public static Builder builder(CameraDevice device, SinkFactory sinkFactory) {
        return new Builder(device, sinkFactory);
    }

    /**
     * Number of streams to run: the device's channel count capped by the configured
     * name groups. A device reporting no channels is treated as having one.
     */
    static int discoverStreams(CameraDevice device, PipelineConfig config) {
        int available = device.streamChannelCount();
        if (available <= 0) {
            LOG.warning("Device " + device.deviceId() + " reports no stream channels, assuming 1");
            available = 1;
        }
        int configured = config.configuredStreams();
        if (configured > available) {
            LOG.warning("Configured " + configured + " streams but device supports " + available
                + ", extra streams are ignored");
        }
        return Math.min(available, configured);
    }

    /**
     * Opens every stream, then starts acquisition if anyone is subscribed.
     *
     * @return {@code false} when a stream channel could not be opened; streams opened so
     * far are shut down again
     */
    public boolean start() {
        if (closed.get() || !started.compareAndSet(false, true)) {
            return false;
        }
        spawning = true;
        for (Stream stream : streams) {
            if (!stream.start(() -> spawning && !closed.get())) {
                LOG.severe("Failed to start stream=" + stream.streamId() + " on device " + device.deviceId());
                spawning = false;
                close();
                return false;
            }
        }
        spawning = false;
        device.setControlLostListener(this::onControlLost);

        synchronized (acquisitionLock) {
            if (anySubscribers()) {
                device.startAcquisition();
                acquiring = true;
            }
        }
        if (config.softwareTriggerRateHz() > 0.0d) {
            trigger = new SoftwareTrigger(device, config.softwareTriggerRateHz(), this::anySubscribers);
            trigger.start();
        }
        if (config.metricsEnabled() && metrics instanceof AtomicPipelineMetrics) {
            reporter = new PeriodicMetricsReporter((AtomicPipelineMetrics) metrics,
                config.metricsIntervalSeconds(), this::poolCounters);
            reporter.start();
        }
        LOG.info(() -> "Frame pipeline started device=" + device.deviceId() + " streams=" + streams.size()
            + " acquiring=" + isAcquiring());
        return true;
    }

    /** Starts acquisition on the first subscriber and stops it when the last one leaves. */
    public void onSubscriptionChanged() {
        if (!started.get() || closed.get()) {
            return;
        }
        synchronized (acquisitionLock) {
            boolean wanted = anySubscribers();
            if (wanted && !acquiring) {
                LOG.info(() -> "Subscribers present, starting acquisition device=" + device.deviceId());
                device.startAcquisition();
                acquiring = true;
            } else if (!wanted && acquiring) {
                LOG.info(() -> "No subscribers left, stopping acquisition device=" + device.deviceId());
                device.stopAcquisition();
                acquiring = false;
            }
        }
    }

    private void onControlLost() {
        LOG.severe("Control of device " + device.deviceId() + " lost, shutting down frame pipeline");
        Thread t = new Thread(this::close, "framebus-control-lost");
        t.setDaemon(true);
        t.start();
    }

    public boolean anySubscribers() {
        for (Stream stream : streams) {
            if (stream.hasSubscribers()) {
                return true;
            }
        }
        return false;
    }

    public boolean isAcquiring() {
        synchronized (acquisitionLock) {
            return acquiring;
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Blocks until {@link #close()} has finished, whichever thread ran it. */
    public void awaitClose() throws InterruptedException {
        closedLatch.await();
    }

    public List<Stream> streams() {
        return streams;
    }

    Map<String, Long> poolCounters() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Stream stream : streams) {
            HardwareBufferPool pool = stream.pool();
            if (pool == null) {
                continue;
            }
            PoolStats stats = pool.stats();
            String prefix = "stream" + stream.streamId() + ".";
            out.put(prefix + "buffers", stats.allocated());
            out.put(prefix + "inFlight", stats.inFlight());
            out.put(prefix + "grown", stats.grown());
        }
        return out;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        spawning = false;
        for (Stream stream : streams) {
            stream.disableSignals();
        }
        for (Stream stream : streams) {
            stream.stopWorkers();
        }
        for (Stream stream : streams) {
            stream.joinWorkers();
        }
        if (trigger != null) {
            trigger.close();
        }
        for (Stream stream : streams) {
            stream.logStatistics();
        }
        synchronized (acquisitionLock) {
            if (started.get()) {
                try {
                    device.stopAcquisition();
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "Failed to stop acquisition device=" + device.deviceId(), e);
                }
            }
            acquiring = false;
        }
        for (Stream stream : streams) {
            stream.release();
        }
        if (reporter != null) {
            reporter.close();
        }
        for (ImageSink sink : sinks) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to close sink", e);
            }
        }
        try {
            device.close();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to close device " + device.deviceId(), e);
        }
        LOG.info(() -> "Frame pipeline closed device=" + device.deviceId());
        closedLatch.countDown();
    }

    public static final class Builder {
        private final CameraDevice device;
        private final SinkFactory sinkFactory;
        private PipelineConfig config = PipelineConfig.defaults();
        private ConversionRegistry conversions = ConversionRegistry.defaults();
        private PipelineMetrics metrics = NoopPipelineMetrics.INSTANCE;
        private ByteBufAllocator allocator = PooledByteBufAllocator.DEFAULT;
        private Sleeper sleeper = Sleeper.SYSTEM;

        private Builder(CameraDevice device, SinkFactory sinkFactory) {
            this.device = Objects.requireNonNull(device, "device");
            this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
        }

        public Builder config(PipelineConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder conversions(ConversionRegistry conversions) {
            this.conversions = Objects.requireNonNull(conversions, "conversions");
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
            return this;
        }

        public Builder allocator(ByteBufAllocator allocator) {
            this.allocator = Objects.requireNonNull(allocator, "allocator");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public FramePipeline build() {
            return new FramePipeline(this);
        }
    }
}
