package com.acme.vision.framebus.hardware;

public record ChannelStatistics(long completedBuffers, long failures, long underruns) {
    public static final ChannelStatistics EMPTY = new ChannelStatistics(0L, 0L, 0L);
}
