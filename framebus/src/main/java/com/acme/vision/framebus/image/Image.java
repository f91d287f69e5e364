package com.acme.vision.framebus.image;

import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * Image message handed to sinks.
 *
 * <p>Instances are recycled by their pool, so fields are mutable. An image is written
 * only by the thread that currently owns it exclusively; once published it must be
 * treated as read-only.
 */
public final class Image {
    private ImageHeader header = ImageHeader.EMPTY;
    private int width;
    private int height;
    private String encoding = "";
    private int step;
    private ByteBuf data;

    public Image(ByteBuf data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    public ImageHeader header() {
        return header;
    }

    public void header(ImageHeader header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public void size(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public String encoding() {
        return encoding;
    }

    public void encoding(String encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    public int step() {
        return step;
    }

    public void step(int step) {
        this.step = step;
    }

    /** Pixel bytes between reader and writer index. */
    public ByteBuf data() {
        return data;
    }

    /** Replaces the pixel bytes with a copy of {@code source}'s readable bytes. */
    public void copyDataFrom(ByteBuf source) {
        int length = source.readableBytes();
        data.clear();
        data.ensureWritable(length);
        data.writeBytes(source, source.readerIndex(), length);
    }

    /** Clears metadata and empties the data buffer, keeping its capacity. */
    public void reset() {
        header = ImageHeader.EMPTY;
        width = 0;
        height = 0;
        encoding = "";
        step = 0;
        data.clear();
    }

    @Override
    public String toString() {
        return "Image{frameId=" + header.frameId() + ", seq=" + header.seq()
            + ", " + width + "x" + height + ", encoding=" + encoding
            + ", step=" + step + ", bytes=" + data.readableBytes() + '}';
    }
}
