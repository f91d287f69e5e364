package com.acme.vision.framebus.pipeline;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SoftwareTriggerTest {

    @Test
    void shouldOnlyTriggerWhileActive() throws Exception {
        FakeCameraDevice device = new FakeCameraDevice(1, 8);
        AtomicBoolean active = new AtomicBoolean(false);
        SoftwareTrigger trigger = new SoftwareTrigger(device, 500.0d, active::get);
        try {
            trigger.start();
            Thread.sleep(50L);
            assertEquals(0, device.triggers.get());

            active.set(true);
            long deadline = System.nanoTime() + 2_000_000_000L;
            while (device.triggers.get() < 5 && System.nanoTime() < deadline) {
                Thread.sleep(5L);
            }
            assertTrue(device.triggers.get() >= 5);
            assertTrue(trigger.firedCount() >= 4);
        } finally {
            trigger.close();
        }
        int afterClose = device.triggers.get();
        Thread.sleep(30L);
        assertEquals(afterClose, device.triggers.get());
    }

    @Test
    void shouldRejectNonPositiveRate() {
        FakeCameraDevice device = new FakeCameraDevice(1, 8);
        assertThrows(IllegalArgumentException.class, () -> new SoftwareTrigger(device, 0.0d, () -> true));
        assertThrows(IllegalArgumentException.class, () -> new SoftwareTrigger(device, Double.NaN, () -> true));
    }
}
