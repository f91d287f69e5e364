package com.acme.vision.framebus.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Single-slot handoff between the producer and one substream worker.
 *
 * <p>A deposit never waits: if the previous delivery has not been taken yet it is
 * discarded and its reference released. Consumers see the gap in frame ids.
 *
 * <p>References are released outside the lock, since releasing the last one pushes a
 * buffer back to the hardware channel.
 */
public final class Mailbox {
    private static final Logger LOG = Logger.getLogger(Mailbox.class.getName());

    private final int streamId;
    private final String substreamName;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition ready = lock.newCondition();
    private Delivery pending;
    private boolean closed;
    private long drops;

    public Mailbox(int streamId, String substreamName) {
        this.streamId = streamId;
        this.substreamName = Objects.requireNonNull(substreamName, "substreamName");
    }

    public DepositResult deposit(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        Delivery dropped;
        lock.lock();
        try {
            if (closed) {
                dropped = delivery;
            } else {
                dropped = pending;
                pending = delivery;
                if (dropped != null) {
                    drops++;
                }
                ready.signal();
            }
        } finally {
            lock.unlock();
        }

        if (dropped == delivery) {
            delivery.release();
            return new DepositResult.Rejected();
        }
        if (dropped != null) {
            // the last release hands the buffer back to the hardware, read it first
            long droppedFrameId = dropped.buffer().frameId();
            LOG.warning("Dropped unprocessed data for stream=" + streamId + " substream=" + substreamName
                + " frameId=" + droppedFrameId);
            dropped.release();
            return new DepositResult.Replaced(droppedFrameId);
        }
        return new DepositResult.Stored();
    }

    /**
     * Waits up to {@code timeout} for a delivery and takes ownership of it.
     *
     * @return the delivery, or {@code null} on timeout or when the mailbox is closed
     */
    public Delivery take(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (pending == null) {
                if (closed || remaining <= 0L) {
                    return null;
                }
                remaining = ready.awaitNanos(remaining);
            }
            Delivery delivery = pending;
            pending = null;
            return delivery;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        lock.lock();
        try {
            return pending != null;
        } finally {
            lock.unlock();
        }
    }

    /** Number of deliveries overwritten before their worker took them. */
    public long drops() {
        lock.lock();
        try {
            return drops;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuses further deposits and releases a pending delivery without processing it.
     *
     * @return {@code true} when a pending delivery was discarded
     */
    public boolean close() {
        Delivery discarded;
        lock.lock();
        try {
            closed = true;
            discarded = pending;
            pending = null;
            ready.signalAll();
        } finally {
            lock.unlock();
        }
        if (discarded != null) {
            discarded.release();
            return true;
        }
        return false;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
