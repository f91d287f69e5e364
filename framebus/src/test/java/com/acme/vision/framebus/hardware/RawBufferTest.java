package com.acme.vision.framebus.hardware;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RawBufferTest {

    @Test
    void shouldStartClearedUntilHardwareCompletesIt() {
        RawBuffer buffer = new RawBuffer(1L, Unpooled.buffer(8));
        assertEquals(BufferStatus.CLEARED, buffer.status());
        assertEquals(0, buffer.byteLength());
        assertEquals(Region.EMPTY, buffer.partRegion(0));
    }

    @Test
    void shouldExposePartBytesAsReadOnlyViewOfSharedMemory() {
        ByteBuf memory = Unpooled.buffer(8);
        memory.writeBytes(new byte[]{0, 1, 2, 3, 4, 5, 6, 7});
        RawBuffer buffer = new RawBuffer(2L, memory);
        buffer.complete(new FrameMetadata(BufferStatus.SUCCESS, PayloadType.MULTIPART, 8, List.of(
            new PartInfo(new Region(0, 0, 2, 2), 0, 4),
            new PartInfo(new Region(0, 2, 2, 2), 4, 4)
        ), 10L, 20L, 3L));

        ByteBuf second = buffer.partData(1);
        assertArrayEquals(new byte[]{4, 5, 6, 7}, ByteBufUtil.getBytes(second));
        assertTrue(second.isReadOnly());
        memory.setByte(4, 42);
        assertEquals(42, second.getByte(0));
        assertEquals(new Region(0, 2, 2, 2), buffer.partRegion(1));
        assertEquals(2, buffer.partCount());
    }

    @Test
    void shouldClampReportedLengthsToCapacity() {
        RawBuffer buffer = new RawBuffer(3L, Unpooled.buffer(4));
        buffer.complete(new FrameMetadata(BufferStatus.SUCCESS, PayloadType.IMAGE, 64,
            List.of(new PartInfo(new Region(0, 0, 8, 8), 2, 64)), 0L, 0L, 1L));

        assertEquals(4, buffer.byteLength());
        assertEquals(2, buffer.partData(0).readableBytes());
    }

    @Test
    void shouldRejectNegativePartOffsets() {
        assertThrows(IllegalArgumentException.class, () -> new PartInfo(Region.EMPTY, -1, 4));
    }
}
