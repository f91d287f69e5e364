package com.acme.vision.framebus.roi;

import com.acme.vision.framebus.hardware.Region;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoiTrackerTest {
    private final Logger logger = Logger.getLogger(RoiTracker.class.getName());
    private final List<LogRecord> warnings = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            if (record.getLevel() == Level.WARNING) {
                warnings.add(record);
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attach() {
        logger.addHandler(handler);
    }

    @AfterEach
    void detach() {
        logger.removeHandler(handler);
    }

    @Test
    void shouldAdoptObservedRegionAndWarnOncePerChange() {
        RoiTracker tracker = new RoiTracker(0, "left", 0, new Roi(0, 0, 800, 600, 16, 1024, 16, 768));

        assertTrue(tracker.adapt(new Region(0, 0, 640, 480)));
        Roi current = tracker.current();
        assertEquals(640, current.width());
        assertEquals(480, current.height());
        assertEquals(1024, current.widthMax(), "bounds are kept");
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getMessage().contains("width=640 height=480"));

        assertFalse(tracker.adapt(new Region(0, 0, 640, 480)));
        assertEquals(1, warnings.size());
        assertEquals(1L, tracker.changes());
    }

    @Test
    void shouldTrackOffsetChanges() {
        RoiTracker tracker = new RoiTracker(1, "depth", 2, Roi.of(0, 0, 100, 100));
        assertTrue(tracker.adapt(new Region(10, 20, 100, 100)));
        assertEquals(10, tracker.current().x());
        assertEquals(20, tracker.current().y());
        assertEquals(2, tracker.partIndex());
    }

    @Test
    void shouldIgnoreMissingRegion() {
        RoiTracker tracker = new RoiTracker(0, "", 0, Roi.of(0, 0, 64, 48));
        assertFalse(tracker.adapt(Region.EMPTY));
        assertEquals(64, tracker.current().width());
        assertTrue(warnings.isEmpty());
    }
}
