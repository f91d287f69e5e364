package com.acme.vision.framebus.sim;

import com.acme.vision.framebus.hardware.CameraDevice;
import com.acme.vision.framebus.hardware.ChannelOpenException;
import com.acme.vision.framebus.hardware.HardwareChannel;
import com.acme.vision.framebus.roi.Roi;
import com.acme.vision.framebus.roi.SensorDescriptor;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Camera that produces synthetic frames, for running the pipeline without hardware.
 *
 * <p>In free-running mode a scheduler fills one buffer per channel at the configured
 * frame rate while acquisition is on. In triggered mode frames are only produced by
 * {@link #triggerSoftware()}.
 */
public final class SimulatedCameraDevice implements CameraDevice {
    private static final Logger LOG = Logger.getLogger(SimulatedCameraDevice.class.getName());

    private final String deviceId;
    private final int streamChannels;
    private final SimulationSettings settings;
    private final boolean freeRunning;
    private final Map<Integer, SimulatedChannel> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean acquiring = new AtomicBoolean(false);
    private final ScheduledExecutorService frameClock;
    private volatile Runnable controlLostListener = () -> { };

    public SimulatedCameraDevice(String deviceId, int streamChannels, SimulationSettings settings, boolean freeRunning) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.streamChannels = streamChannels;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.freeRunning = freeRunning;
        this.frameClock = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "framebus-sim-clock");
            t.setDaemon(true);
            return t;
        });
        long periodMicros = Math.max(1L, 1_000_000L / settings.fps());
        frameClock.scheduleAtFixedRate(this::tick, periodMicros, periodMicros, TimeUnit.MICROSECONDS);
    }

    private void tick() {
        if (!freeRunning || !acquiring.get()) {
            return;
        }
        fillAll();
    }

    private void fillAll() {
        for (SimulatedChannel channel : channels.values()) {
            try {
                channel.fillNext();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Simulated fill failed stream=" + channel.streamId(), e);
            }
        }
    }

    @Override
    public String deviceId() {
        return deviceId;
    }

    @Override
    public int streamChannelCount() {
        return streamChannels;
    }

    @Override
    public HardwareChannel openChannel(int streamId) throws ChannelOpenException {
        if (streamId < 0 || (streamChannels > 0 && streamId >= streamChannels)) {
            throw new ChannelOpenException(streamId, "No such stream channel on " + deviceId);
        }
        SimulatedChannel channel = new SimulatedChannel(streamId, settings);
        if (channels.putIfAbsent(streamId, channel) != null) {
            throw new ChannelOpenException(streamId, "Stream channel already open on " + deviceId);
        }
        return channel;
    }

    @Override
    public int payloadSize(int streamId) {
        return settings.payloadBytes();
    }

    @Override
    public SensorDescriptor sensor(int streamId, String component) {
        return new SensorDescriptor(settings.pixelFormat(), settings.bitsPerPixel(), settings.width(), settings.height());
    }

    @Override
    public Roi initialRoi(int streamId, String component) {
        return Roi.of(0, 0, settings.width(), settings.height());
    }

    @Override
    public void startAcquisition() {
        if (acquiring.compareAndSet(false, true)) {
            LOG.info(() -> "Acquisition started device=" + deviceId);
        }
    }

    @Override
    public void stopAcquisition() {
        if (acquiring.compareAndSet(true, false)) {
            LOG.info(() -> "Acquisition stopped device=" + deviceId);
        }
    }

    @Override
    public void triggerSoftware() {
        if (acquiring.get()) {
            fillAll();
        }
    }

    @Override
    public void setControlLostListener(Runnable listener) {
        this.controlLostListener = listener == null ? () -> { } : listener;
    }

    /** Simulates losing the control connection to the device. */
    public void loseControl() {
        controlLostListener.run();
    }

    public boolean isAcquiring() {
        return acquiring.get();
    }

    @Override
    public void close() {
        frameClock.shutdownNow();
        for (SimulatedChannel channel : channels.values()) {
            channel.close();
        }
        channels.clear();
    }
}
