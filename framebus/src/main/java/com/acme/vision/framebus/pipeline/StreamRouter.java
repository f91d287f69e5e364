package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.memory.HardwareBufferPool;
import com.acme.vision.framebus.memory.PooledImage;
import com.acme.vision.framebus.telemetry.DropReason;
import com.acme.vision.framebus.telemetry.NoopPipelineMetrics;
import com.acme.vision.framebus.telemetry.PipelineMetrics;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Fans a validated buffer out to the mailboxes of a stream's substreams.
 *
 * <p>The buffer is wrapped once. Every deposit owns one reference and the router
 * drops its own reference last, so the buffer goes back to the hardware after the
 * slowest substream is done with it. Payloads that are not routed are returned
 * immediately.
 */
public final class StreamRouter {
    private static final Logger LOG = Logger.getLogger(StreamRouter.class.getName());

    private final int streamId;
    private final HardwareBufferPool pool;
    private final List<Mailbox> mailboxes;
    private final PipelineMetrics metrics;
    private final AtomicBoolean excessPartsWarned = new AtomicBoolean(false);

    public StreamRouter(int streamId, HardwareBufferPool pool, List<Mailbox> mailboxes, PipelineMetrics metrics) {
        this.streamId = streamId;
        this.pool = Objects.requireNonNull(pool, "pool");
        this.mailboxes = List.copyOf(Objects.requireNonNull(mailboxes, "mailboxes"));
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    public RouteResult delegate(RawBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        switch (buffer.payloadType()) {
            case IMAGE:
                return fanOut(buffer, 1);
            case MULTIPART:
                return fanOut(buffer, buffer.partCount());
            case CHUNK_DATA:
                LOG.info(() -> "Chunk data not implemented, returning buffer stream=" + streamId
                    + " frameId=" + buffer.frameId());
                return giveBack(buffer, DropReason.CHUNK_DATA_UNIMPLEMENTED);
            default:
                LOG.severe("Unsupported payload type=" + buffer.payloadType() + " stream=" + streamId
                    + " frameId=" + buffer.frameId() + ", returning buffer");
                return giveBack(buffer, DropReason.UNSUPPORTED_PAYLOAD);
        }
    }

    private RouteResult fanOut(RawBuffer buffer, int parts) {
        int targets = Math.min(parts, mailboxes.size());
        if (parts > targets && excessPartsWarned.compareAndSet(false, true)) {
            LOG.warning("Buffer on stream=" + streamId + " carries " + parts + " parts but only "
                + mailboxes.size() + " substreams are configured, extra parts are ignored");
        }
        if (targets == 0) {
            return giveBack(buffer, DropReason.UNSUPPORTED_PAYLOAD);
        }

        PooledImage source = pool.wrap(buffer);
        try {
            for (int i = 0; i < targets; i++) {
                source.retain();
                DepositResult result = mailboxes.get(i).deposit(new Delivery(buffer, source));
                if (result instanceof DepositResult.Rejected) {
                    metrics.incDropped(1L, DropReason.SHUTDOWN);
                    continue;
                }
                if (result instanceof DepositResult.Replaced) {
                    metrics.incDropped(1L, DropReason.MAILBOX_OVERWRITE);
                }
                metrics.incDelivered(1L);
            }
        } finally {
            source.release();
        }
        return new RouteResult.Routed(targets);
    }

    private RouteResult giveBack(RawBuffer buffer, DropReason reason) {
        metrics.incDropped(1L, reason);
        pool.returnBuffer(buffer);
        return new RouteResult.Returned(reason);
    }
}
