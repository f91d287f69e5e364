package com.acme.vision.framebus.convert;

import io.netty.buffer.ByteBuf;

/**
 * Stock conversions for formats that need no unpacking.
 */
public final class Conversions {

    private Conversions() {
    }

    /** Copies the pixels unchanged and relabels them with {@code encoding}. */
    public static ConversionFunction rename(String encoding) {
        return (source, destination) -> {
            destination.copyDataFrom(source.data());
            destination.size(source.width(), source.height());
            destination.step(source.step());
            destination.encoding(encoding);
        };
    }

    /**
     * Left-aligns little-endian 16-bit samples holding fewer significant bits, e.g.
     * 12-bit data shifted by 4 so the full 16-bit range is used.
     */
    public static ConversionFunction shift16(String encoding, int bits) {
        if (bits < 0 || bits > 15) {
            throw new IllegalArgumentException("bits must be in [0, 15], got " + bits);
        }
        return (source, destination) -> {
            ByteBuf in = source.data();
            ByteBuf out = destination.data();
            int length = in.readableBytes() & ~1;
            out.clear();
            out.ensureWritable(length);
            int base = in.readerIndex();
            for (int i = 0; i < length; i += 2) {
                int sample = in.getUnsignedShortLE(base + i);
                out.writeShortLE((sample << bits) & 0xFFFF);
            }
            destination.size(source.width(), source.height());
            destination.step(source.width() * 2);
            destination.encoding(encoding);
        };
    }
}
