package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.config.FramebusDefaults;
import com.acme.vision.framebus.config.PipelineConfig;
import com.acme.vision.framebus.hardware.BufferReadyListener;
import com.acme.vision.framebus.hardware.BufferStatus;
import com.acme.vision.framebus.hardware.CameraDevice;
import com.acme.vision.framebus.hardware.ChannelStatistics;
import com.acme.vision.framebus.hardware.HardwareChannel;
import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.memory.HardwareBufferPool;
import com.acme.vision.framebus.memory.PoolStats;
import com.acme.vision.framebus.telemetry.DropReason;
import com.acme.vision.framebus.telemetry.NoopPipelineMetrics;
import com.acme.vision.framebus.telemetry.PipelineMetrics;
import io.netty.buffer.ByteBufAllocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One hardware stream channel with its buffer pool, router and substream workers.
 *
 * <p>{@link #onBufferReady(int)} runs on the channel's event thread. It never waits on
 * a worker: it pops, validates and either routes the buffer or hands it straight back.
 *
 * <p>Teardown is split into steps so the device-level pipeline can interleave them
 * across streams: {@link #disableSignals()}, {@link #stopWorkers()},
 * {@link #joinWorkers()}, {@link #logStatistics()}, {@link #release()}.
 */
public final class Stream implements BufferReadyListener {
    private static final Logger LOG = Logger.getLogger(Stream.class.getName());

    private final int streamId;
    private final CameraDevice device;
    private final PipelineConfig config;
    private final List<Substream> substreams;
    private final ByteBufAllocator allocator;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    private volatile HardwareChannel channel;
    private volatile HardwareBufferPool pool;
    private volatile StreamRouter router;
    private List<SubstreamWorker> workers = List.of();
    private List<Thread> workerThreads = List.of();

    public Stream(int streamId,
                  CameraDevice device,
                  PipelineConfig config,
                  List<Substream> substreams,
                  ByteBufAllocator allocator,
                  RetryPolicy retryPolicy,
                  PipelineMetrics metrics) {
        this.streamId = streamId;
        this.device = Objects.requireNonNull(device, "device");
        this.config = Objects.requireNonNull(config, "config");
        this.substreams = List.copyOf(Objects.requireNonNull(substreams, "substreams"));
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    /**
     * Opens the channel, allocates buffers, spawns workers and enables signals.
     *
     * @param keepGoing polled between channel open attempts; {@code false} aborts
     * @return {@code false} when the channel could not be opened
     */
    public boolean start(BooleanSupplier keepGoing) {
        Optional<HardwareChannel> opened = retryPolicy.execute(
            "open stream channel stream=" + streamId, () -> device.openChannel(streamId), keepGoing);
        if (opened.isEmpty()) {
            return false;
        }
        HardwareChannel ch = opened.get();
        channel = ch;

        int payloadBytes = device.payloadSize(streamId);
        HardwareBufferPool bufferPool = new HardwareBufferPool(ch, payloadBytes, config.initialBuffers(), allocator, metrics);
        pool = bufferPool;
        List<Mailbox> mailboxes = new ArrayList<>(substreams.size());
        for (Substream substream : substreams) {
            substream.openOutputPool(allocator);
            mailboxes.add(substream.mailbox());
        }
        router = new StreamRouter(streamId, bufferPool, mailboxes, metrics);

        ImageStamper stamper = new ImageStamper(config.clockSource());
        List<SubstreamWorker> createdWorkers = new ArrayList<>(substreams.size());
        List<Thread> started = new ArrayList<>(substreams.size());
        for (Substream substream : substreams) {
            SubstreamWorker worker = new SubstreamWorker(substream, bufferPool, stamper, config.mailboxWait(), metrics);
            Thread t = new Thread(worker, "framebus-stream" + streamId + "-" + substream.layout().label());
            t.setDaemon(true);
            t.start();
            createdWorkers.add(worker);
            started.add(t);
        }
        workers = List.copyOf(createdWorkers);
        workerThreads = List.copyOf(started);

        ch.setBufferReadyListener(this);
        ch.setEmitSignals(true);
        LOG.info(() -> "Started stream=" + streamId + " substreams=" + substreams.size()
            + " payloadBytes=" + payloadBytes + " buffers=" + bufferPool.size());
        return true;
    }

    @Override
    public void onBufferReady(int signalledStreamId) {
        HardwareChannel ch = channel;
        HardwareBufferPool bufferPool = pool;
        StreamRouter r = router;
        if (ch == null || bufferPool == null || r == null) {
            return;
        }
        RawBuffer buffer = ch.tryPopBuffer();
        bufferPool.ensureAvailable(ch.availableCount());
        if (buffer == null) {
            return;
        }
        metrics.incBuffersIn(1L);

        if (buffer.status() != BufferStatus.SUCCESS) {
            LOG.warning("Failed to get buffer for stream=" + signalledStreamId + " frameId=" + buffer.frameId()
                + " (and possibly subframes) status=" + buffer.status());
            metrics.incDropped(1L, DropReason.BUFFER_FAILURE);
            bufferPool.returnBuffer(buffer);
            return;
        }
        if (!hasSubscribers()) {
            metrics.incDropped(1L, DropReason.NO_SUBSCRIBERS);
            bufferPool.returnBuffer(buffer);
            return;
        }
        r.delegate(buffer);
    }

    public boolean hasSubscribers() {
        for (Substream substream : substreams) {
            if (substream.hasSubscribers()) {
                return true;
            }
        }
        return false;
    }

    public void disableSignals() {
        HardwareChannel ch = channel;
        if (ch != null) {
            ch.setEmitSignals(false);
        }
    }

    public void stopWorkers() {
        for (SubstreamWorker worker : workers) {
            worker.requestStop();
        }
    }

    /** Waits for every worker; each one exits within one mailbox wait of its stop request. */
    public void joinWorkers() {
        long graceMillis = config.mailboxWait().toMillis() + FramebusDefaults.WORKER_JOIN_GRACE_MS;
        for (Thread t : workerThreads) {
            try {
                t.join(graceMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warning("Interrupted while joining worker " + t.getName());
                return;
            }
            if (t.isAlive()) {
                LOG.warning("Worker " + t.getName() + " did not exit within " + graceMillis + "ms");
            }
        }
    }

    public void logStatistics() {
        HardwareChannel ch = channel;
        HardwareBufferPool bufferPool = pool;
        if (ch == null || bufferPool == null) {
            return;
        }
        ChannelStatistics stats = ch.statistics();
        PoolStats poolStats = bufferPool.stats();
        LOG.info(() -> "Stream statistics stream=" + streamId
            + " completed=" + stats.completedBuffers()
            + " failures=" + stats.failures()
            + " underruns=" + stats.underruns()
            + " poolBuffers=" + poolStats.allocated()
            + " wrapped=" + poolStats.acquired()
            + " returned=" + poolStats.recycled()
            + " grown=" + poolStats.grown());
    }

    /**
     * Closes the channel, then every pool of this stream. The channel goes first so no
     * fill can land in memory the pool has already freed.
     */
    public void release() {
        HardwareChannel ch = channel;
        HardwareBufferPool bufferPool = pool;
        channel = null;
        router = null;
        if (ch != null) {
            try {
                ch.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to close channel stream=" + streamId, e);
            }
        }
        if (bufferPool != null) {
            bufferPool.close();
        }
        for (Substream substream : substreams) {
            substream.closeOutputPool();
        }
    }

    /** Full teardown of this stream on its own. */
    public void shutdown() {
        disableSignals();
        stopWorkers();
        joinWorkers();
        logStatistics();
        release();
    }

    public int streamId() {
        return streamId;
    }

    public List<Substream> substreams() {
        return substreams;
    }

    /** The buffer pool, or {@code null} before start. */
    public HardwareBufferPool pool() {
        return pool;
    }

    public boolean isStarted() {
        return channel != null;
    }
}
