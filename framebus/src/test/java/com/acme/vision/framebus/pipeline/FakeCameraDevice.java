package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.hardware.CameraDevice;
import com.acme.vision.framebus.hardware.ChannelOpenException;
import com.acme.vision.framebus.hardware.HardwareChannel;
import com.acme.vision.framebus.roi.Roi;
import com.acme.vision.framebus.roi.SensorDescriptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

final class FakeCameraDevice implements CameraDevice {
    final int streamChannels;
    final int payloadBytes;
    final Map<Integer, FakeHardwareChannel> channels = new ConcurrentHashMap<>();
    final List<String> commands = new CopyOnWriteArrayList<>();
    final AtomicInteger openAttempts = new AtomicInteger();
    final AtomicInteger triggers = new AtomicInteger();
    volatile int failOpens;
    volatile SensorDescriptor sensor = new SensorDescriptor("Mono8", 8, 4, 2);
    volatile Roi roi = Roi.of(0, 0, 4, 2);
    volatile Runnable controlLost;
    volatile boolean closed;

    FakeCameraDevice(int streamChannels, int payloadBytes) {
        this.streamChannels = streamChannels;
        this.payloadBytes = payloadBytes;
    }

    FakeHardwareChannel channel(int streamId) {
        return channels.get(streamId);
    }

    @Override
    public String deviceId() {
        return "fake";
    }

    @Override
    public int streamChannelCount() {
        return streamChannels;
    }

    @Override
    public HardwareChannel openChannel(int streamId) throws ChannelOpenException {
        openAttempts.incrementAndGet();
        if (failOpens > 0) {
            failOpens--;
            throw new ChannelOpenException(streamId, "device busy");
        }
        FakeHardwareChannel channel = new FakeHardwareChannel(streamId);
        channels.put(streamId, channel);
        return channel;
    }

    @Override
    public int payloadSize(int streamId) {
        return payloadBytes;
    }

    @Override
    public SensorDescriptor sensor(int streamId, String component) {
        return sensor;
    }

    @Override
    public Roi initialRoi(int streamId, String component) {
        return roi;
    }

    @Override
    public void startAcquisition() {
        commands.add("start");
    }

    @Override
    public void stopAcquisition() {
        commands.add("stop");
    }

    @Override
    public void triggerSoftware() {
        triggers.incrementAndGet();
    }

    @Override
    public void setControlLostListener(Runnable listener) {
        controlLost = listener;
    }

    @Override
    public void close() {
        closed = true;
    }
}
