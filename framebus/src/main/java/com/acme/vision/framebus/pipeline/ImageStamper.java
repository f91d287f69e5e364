package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.config.ClockSource;
import com.acme.vision.framebus.hardware.RawBuffer;
import com.acme.vision.framebus.image.Image;
import com.acme.vision.framebus.image.ImageHeader;
import com.acme.vision.framebus.roi.Roi;
import com.acme.vision.framebus.roi.SensorDescriptor;

import java.util.Objects;

/**
 * Writes header, geometry and encoding of an outgoing image from the buffer it came
 * from and the substream's current ROI.
 */
public final class ImageStamper {
    private final ClockSource clockSource;

    public ImageStamper(ClockSource clockSource) {
        this.clockSource = Objects.requireNonNull(clockSource, "clockSource");
    }

    public void fill(Image image, RawBuffer buffer, Roi roi, SensorDescriptor sensor, String frameId) {
        long stamp = clockSource == ClockSource.HARDWARE
            ? buffer.timestampNanos()
            : buffer.systemTimestampNanos();
        image.header(new ImageHeader(stamp, buffer.frameId(), frameId));
        image.size(roi.width(), roi.height());
        image.encoding(sensor.pixelFormat());
        image.step(sensor.strideFor(roi.width()));
    }

    public ClockSource clockSource() {
        return clockSource;
    }
}
