package com.acme.vision.framebus.telemetry;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicPipelineMetrics implements PipelineMetrics {
    private final LongAdder buffersIn = new LongAdder();
    private final LongAdder buffersReturned = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder published = new LongAdder();
    private final LongAdder poolGrowth = new LongAdder();
    private final LongAdder processingNanos = new LongAdder();
    private final LongAdder processingSamples = new LongAdder();
    private final Map<DropReason, LongAdder> droppedByReason = new EnumMap<>(DropReason.class);

    private static final int LATENCY_RING_SIZE = 4096;
    private static final int LATENCY_RING_MASK = LATENCY_RING_SIZE - 1;
    private final AtomicLongArray latencyRing = new AtomicLongArray(LATENCY_RING_SIZE);
    private final AtomicLong latencyRingPos = new AtomicLong();

    public AtomicPipelineMetrics() {
        // fully populated up front so the map is never structurally modified
        for (DropReason reason : DropReason.values()) {
            droppedByReason.put(reason, new LongAdder());
        }
    }

    @Override
    public void incBuffersIn(long n) {
        buffersIn.add(Math.max(0L, n));
    }

    @Override
    public void incBuffersReturned(long n) {
        buffersReturned.add(Math.max(0L, n));
    }

    @Override
    public void incDelivered(long n) {
        delivered.add(Math.max(0L, n));
    }

    @Override
    public void incPublished(long n) {
        published.add(Math.max(0L, n));
    }

    @Override
    public void incDropped(long n, DropReason reason) {
        if (n <= 0 || reason == null) return;
        droppedByReason.get(reason).add(n);
    }

    @Override
    public void incPoolGrowth(long n) {
        poolGrowth.add(Math.max(0L, n));
    }

    @Override
    public void observeProcessingNanos(long nanos) {
        if (nanos < 0) return;
        processingNanos.add(nanos);
        processingSamples.increment();
        latencyRing.set((int) (latencyRingPos.getAndIncrement() & LATENCY_RING_MASK), nanos);
    }

    public long dropped(DropReason reason) {
        return droppedByReason.get(reason).sum();
    }

    public long p99ProcessingNanos() {
        long pos = latencyRingPos.get();
        int count = (int) Math.min(pos, LATENCY_RING_SIZE);
        if (count == 0) return 0;
        long[] samples = new long[count];
        int start = (int) ((pos - count) & LATENCY_RING_MASK);
        for (int i = 0; i < count; i++) {
            samples[i] = latencyRing.get((start + i) & LATENCY_RING_MASK);
        }
        Arrays.sort(samples);
        int idx = Math.min((int) (count * 0.99), count - 1);
        return samples[idx];
    }

    public Snapshot snapshot() {
        Map<String, Long> drops = new LinkedHashMap<>();
        droppedByReason.forEach((reason, adder) -> drops.put(reason.name(), adder.sum()));
        return new Snapshot(
            buffersIn.sum(),
            buffersReturned.sum(),
            delivered.sum(),
            published.sum(),
            poolGrowth.sum(),
            processingNanos.sum(),
            processingSamples.sum(),
            p99ProcessingNanos(),
            Collections.unmodifiableMap(drops)
        );
    }

    public record Snapshot(long buffersIn,
                           long buffersReturned,
                           long delivered,
                           long published,
                           long poolGrowth,
                           long processingNanosTotal,
                           long processingSamples,
                           long processingP99Nanos,
                           Map<String, Long> droppedByReason) {}
}
