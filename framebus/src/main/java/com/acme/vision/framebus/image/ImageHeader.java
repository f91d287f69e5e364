package com.acme.vision.framebus.image;

public record ImageHeader(long stampNanos, long seq, String frameId) {
    public static final ImageHeader EMPTY = new ImageHeader(0L, 0L, "");
}
