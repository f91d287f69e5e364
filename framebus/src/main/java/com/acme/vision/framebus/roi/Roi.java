package com.acme.vision.framebus.roi;

import com.acme.vision.framebus.hardware.Region;

public record Roi(
    int x,
    int y,
    int width,
    int height,
    int widthMin,
    int widthMax,
    int heightMin,
    int heightMax
) {
    public static Roi of(int x, int y, int width, int height) {
        return new Roi(x, y, width, height, 0, width, 0, height);
    }

    public boolean matches(Region region) {
        return region.x() == x
            && region.y() == y
            && region.width() == width
            && region.height() == height;
    }

    /** Same bounds, position and size taken from {@code region}. */
    public Roi withRegion(Region region) {
        return new Roi(region.x(), region.y(), region.width(), region.height(),
            widthMin, widthMax, heightMin, heightMax);
    }

    public Region region() {
        return new Region(x, y, width, height);
    }
}
