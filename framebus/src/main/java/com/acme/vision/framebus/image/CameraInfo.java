package com.acme.vision.framebus.image;

import java.util.List;
import java.util.Objects;

/**
 * Calibration metadata published next to each image. Width and height are the
 * resolution the camera was calibrated at; zero means "not set".
 */
public record CameraInfo(
    ImageHeader header,
    int width,
    int height,
    String distortionModel,
    List<Double> distortion,
    List<Double> intrinsics
) {
    public CameraInfo {
        Objects.requireNonNull(header, "header");
        distortionModel = distortionModel == null ? "" : distortionModel;
        distortion = distortion == null ? List.of() : List.copyOf(distortion);
        intrinsics = intrinsics == null ? List.of() : List.copyOf(intrinsics);
    }

    public static CameraInfo uncalibrated() {
        return new CameraInfo(ImageHeader.EMPTY, 0, 0, "", List.of(), List.of());
    }

    public boolean hasResolution() {
        return width != 0 && height != 0;
    }

    public CameraInfo withHeader(ImageHeader header) {
        return new CameraInfo(header, width, height, distortionModel, distortion, intrinsics);
    }

    public CameraInfo withResolution(int width, int height) {
        return new CameraInfo(header, width, height, distortionModel, distortion, intrinsics);
    }
}
