package com.acme.vision.framebus.telemetry;

public final class NoopPipelineMetrics implements PipelineMetrics {
    public static final NoopPipelineMetrics INSTANCE = new NoopPipelineMetrics();

    private NoopPipelineMetrics() {
    }

    @Override
    public void incBuffersIn(long n) {
    }

    @Override
    public void incBuffersReturned(long n) {
    }

    @Override
    public void incDelivered(long n) {
    }

    @Override
    public void incPublished(long n) {
    }

    @Override
    public void incDropped(long n, DropReason reason) {
    }

    @Override
    public void incPoolGrowth(long n) {
    }

    @Override
    public void observeProcessingNanos(long nanos) {
    }
}
