package com.acme.vision.framebus.telemetry;

/**
 * Hot-path counters. Implementations must be thread-safe and must not block: they are
 * called from the hardware event thread.
 */
public interface PipelineMetrics {
    void incBuffersIn(long n);
    void incBuffersReturned(long n);
    void incDelivered(long n);
    void incPublished(long n);
    void incDropped(long n, DropReason reason);
    void incPoolGrowth(long n);
    void observeProcessingNanos(long nanos);
}
