package com.acme.vision.framebus.telemetry;

import com.acme.vision.framebus.config.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs a JSON snapshot of pipeline counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicPipelineMetrics metrics;
    private final Supplier<Map<String, Long>> poolCountersSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicPipelineMetrics metrics, long intervalSeconds) {
        this(metrics, intervalSeconds, () -> Map.of());
    }

    public PeriodicMetricsReporter(AtomicPipelineMetrics metrics,
                                   long intervalSeconds,
                                   Supplier<Map<String, Long>> poolCountersSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.poolCountersSupplier = poolCountersSupplier == null ? (() -> Map.of()) : poolCountersSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "framebus-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicPipelineMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "framebus");
        payload.put("type", "pipeline_metrics");
        payload.put("buffersIn", s.buffersIn());
        payload.put("buffersReturned", s.buffersReturned());
        payload.put("delivered", s.delivered());
        payload.put("published", s.published());
        payload.put("poolGrowth", s.poolGrowth());
        payload.put("processingNanosTotal", s.processingNanosTotal());
        payload.put("processingSamples", s.processingSamples());
        payload.put("processingP99Nanos", s.processingP99Nanos());
        payload.put("droppedByReason", s.droppedByReason());
        Map<String, Long> pools = poolCountersSupplier.get();
        if (pools != null && !pools.isEmpty()) {
            payload.put("pools", pools);
        }
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.warning("Metrics reporter failure: " + t.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
