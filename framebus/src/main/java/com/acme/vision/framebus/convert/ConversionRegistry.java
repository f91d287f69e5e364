package com.acme.vision.framebus.convert;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable pixel-format to conversion table. Built once at setup and shared
 * read-only by every substream.
 */
public final class ConversionRegistry {
    private final Map<String, ConversionFunction> conversions;

    private ConversionRegistry(Map<String, ConversionFunction> conversions) {
        this.conversions = Map.copyOf(conversions);
    }

    public static ConversionRegistry empty() {
        return new ConversionRegistry(Map.of());
    }

    public static ConversionRegistry defaults() {
        return builder()
            .register("Mono8", Conversions.rename("mono8"))
            .register("RGB8", Conversions.rename("rgb8"))
            .register("RGB8Packed", Conversions.rename("rgb8"))
            .register("BGR8", Conversions.rename("bgr8"))
            .register("BGR8Packed", Conversions.rename("bgr8"))
            .register("BayerRG8", Conversions.rename("bayer_rggb8"))
            .register("BayerBG8", Conversions.rename("bayer_bggr8"))
            .register("BayerGB8", Conversions.rename("bayer_gbrg8"))
            .register("BayerGR8", Conversions.rename("bayer_grbg8"))
            .register("Mono16", Conversions.rename("mono16"))
            .register("Mono10", Conversions.shift16("mono16", 6))
            .register("Mono12", Conversions.shift16("mono16", 4))
            .register("Coord3D_C16", Conversions.rename("mono16"))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ConversionFunction> lookup(String pixelFormat) {
        if (pixelFormat == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversions.get(pixelFormat));
    }

    public boolean supports(String pixelFormat) {
        return pixelFormat != null && conversions.containsKey(pixelFormat);
    }

    public int size() {
        return conversions.size();
    }

    public static final class Builder {
        private final Map<String, ConversionFunction> conversions = new HashMap<>();

        private Builder() {
        }

        public Builder register(String pixelFormat, ConversionFunction function) {
            conversions.put(Objects.requireNonNull(pixelFormat, "pixelFormat"),
                Objects.requireNonNull(function, "function"));
            return this;
        }

        public Builder registerAll(ConversionRegistry other) {
            conversions.putAll(other.conversions);
            return this;
        }

        public ConversionRegistry build() {
            return new ConversionRegistry(conversions);
        }
    }
}
