package com.acme.vision.framebus.hardware;

import com.acme.vision.framebus.roi.Roi;
import com.acme.vision.framebus.roi.SensorDescriptor;

/**
 * The configured camera as seen by the pipeline. Feature negotiation happens before
 * the pipeline is built; everything here is read-only apart from acquisition
 * commands.
 */
public interface CameraDevice extends AutoCloseable {
    String deviceId();

    /** Stream channels the device supports; 0 when the device does not say. */
    int streamChannelCount();

    HardwareChannel openChannel(int streamId) throws ChannelOpenException;

    /** Negotiated payload size in bytes for one buffer of the given stream. */
    int payloadSize(int streamId);

    SensorDescriptor sensor(int streamId, String component);

    /** ROI the device reports for the component, including width/height bounds. */
    Roi initialRoi(int streamId, String component);

    void startAcquisition();

    void stopAcquisition();

    void triggerSoftware();

    void setControlLostListener(Runnable listener);

    @Override
    default void close() {
    }
}
