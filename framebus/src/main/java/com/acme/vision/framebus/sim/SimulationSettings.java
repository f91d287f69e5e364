package com.acme.vision.framebus.sim;

import com.acme.vision.framebus.config.EnvVars;
import com.acme.vision.framebus.config.FramebusDefaults;
import com.acme.vision.framebus.config.FramebusEnvKeys;

import java.util.Map;
import java.util.Objects;

/**
 * Geometry and timing of the simulated camera. Multipart output stacks {@code parts}
 * equally sized images in one buffer.
 */
public record SimulationSettings(int width, int height, int fps, int parts, String pixelFormat) {
    public SimulationSettings {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be > 0, got " + width + "x" + height);
        }
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be > 0, got " + fps);
        }
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be > 0, got " + parts);
        }
        Objects.requireNonNull(pixelFormat, "pixelFormat");
    }

    public static SimulationSettings fromEnv(Map<String, String> env) {
        return new SimulationSettings(
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_SIM_WIDTH, FramebusDefaults.DEFAULT_SIM_WIDTH, 1, 16_384),
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_SIM_HEIGHT, FramebusDefaults.DEFAULT_SIM_HEIGHT, 1, 16_384),
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_SIM_FPS, FramebusDefaults.DEFAULT_SIM_FPS, 1, 1_000),
            EnvVars.getIntClamped(env, FramebusEnvKeys.FRAMEBUS_SIM_PARTS, FramebusDefaults.DEFAULT_SIM_PARTS, 1, 16),
            EnvVars.getOrDefault(env, FramebusEnvKeys.FRAMEBUS_SIM_PIXEL_FORMAT, FramebusDefaults.DEFAULT_SIM_PIXEL_FORMAT)
        );
    }

    public int bitsPerPixel() {
        switch (pixelFormat) {
            case "RGB8":
            case "RGB8Packed":
            case "BGR8":
            case "BGR8Packed":
                return 24;
            case "Mono10":
            case "Mono12":
            case "Mono16":
            case "Coord3D_C16":
                return 16;
            default:
                return 8;
        }
    }

    public int partBytes() {
        return width * height * bitsPerPixel() / 8;
    }

    public int payloadBytes() {
        return partBytes() * parts;
    }
}
