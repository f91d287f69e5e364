package com.acme.vision.framebus.hardware;

/**
 * Rectangle in sensor coordinates.
 */
public record Region(int x, int y, int width, int height) {
    public static final Region EMPTY = new Region(0, 0, 0, 0);
}
