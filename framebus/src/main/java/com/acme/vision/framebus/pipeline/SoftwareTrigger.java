package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.hardware.CameraDevice;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires {@link CameraDevice#triggerSoftware()} at a fixed rate while someone is
 * subscribed.
 */
public final class SoftwareTrigger implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SoftwareTrigger.class.getName());

    private final CameraDevice device;
    private final long periodNanos;
    private final BooleanSupplier active;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong fired = new AtomicLong();
    private final AtomicLong missed = new AtomicLong();
    private volatile Thread thread;

    public SoftwareTrigger(CameraDevice device, double rateHz, BooleanSupplier active) {
        if (!(rateHz > 0.0d)) {
            throw new IllegalArgumentException("rateHz must be > 0, got " + rateHz);
        }
        this.device = Objects.requireNonNull(device, "device");
        this.active = Objects.requireNonNull(active, "active");
        this.periodNanos = Math.max(1L, Math.round(1_000_000_000.0d / rateHz));
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::loop, "framebus-software-trigger");
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info(() -> "Software trigger started periodNanos=" + periodNanos);
    }

    private void loop() {
        long next = System.nanoTime();
        while (running.get()) {
            next += periodNanos;
            if (active.getAsBoolean()) {
                try {
                    device.triggerSoftware();
                    fired.incrementAndGet();
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "Software trigger failed", e);
                }
            }
            long now = System.nanoTime();
            if (next > now) {
                LockSupport.parkNanos(next - now);
            } else {
                missed.incrementAndGet();
                LOG.warning("Missed software trigger, late by " + (now - next) / 1_000L + "us");
                next = now;
            }
        }
    }

    public long firedCount() {
        return fired.get();
    }

    public long missedCount() {
        return missed.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread t = thread;
        if (t == null) {
            return;
        }
        LockSupport.unpark(t);
        try {
            t.join(Math.max(1_000L, periodNanos / 1_000_000L * 2L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
