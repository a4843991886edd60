package com.lucsartech.raw.decode;

import com.lucsartech.raw.error.InvalidOptionException;

import java.util.Objects;
import java.util.Optional;

/**
 * Rendering parameters handed to the decoder: gamma curve, brightness, white balance,
 * colour space and bit depth. They shape the decoded raster, so they are fixed before
 * a session decodes.
 */
public record OutputParams(
        Gamma gamma,
        double brightness,
        boolean autoBrightness,
        Optional<WhiteBalance> whiteBalance,
        OutputColorSpace colorSpace,
        int bitsPerSample,
        int highlightMode
) {

    public static final double MIN_BRIGHTNESS = 0.25;
    public static final double MAX_BRIGHTNESS = 8.0;
    public static final int MAX_HIGHLIGHT_MODE = 9;

    private static final OutputParams DEFAULTS = builder().build();

    /**
     * Gamma curve as power and toe slope; BT.709 is {@code 0.45 / 4.5}.
     */
    public record Gamma(double power, double toeSlope) {

        public static final Gamma BT709 = new Gamma(0.45, 4.5);

        public Gamma {
            if (!(power > 0) || !(toeSlope >= 0)) {
                throw new InvalidOptionException("Invalid gamma curve: power " + power + ", slope " + toeSlope);
            }
        }
    }

    /**
     * User white balance multipliers for the four sensor channels.
     */
    public record WhiteBalance(double red, double green, double blue, double green2) {

        public WhiteBalance {
            if (!(red > 0) || !(green > 0) || !(blue > 0) || !(green2 > 0)) {
                throw new InvalidOptionException("White balance multipliers must be positive: "
                        + red + ", " + green + ", " + blue + ", " + green2);
            }
        }

        public double redGain() {
            return red / green;
        }

        public double blueGain() {
            return blue / green;
        }
    }

    public OutputParams {
        Objects.requireNonNull(gamma, "Gamma is required");
        Objects.requireNonNull(whiteBalance, "White balance is required");
        Objects.requireNonNull(colorSpace, "Color space is required");
        if (!(brightness >= MIN_BRIGHTNESS && brightness <= MAX_BRIGHTNESS)) {
            throw new InvalidOptionException("brightness must be within " + MIN_BRIGHTNESS + "-" + MAX_BRIGHTNESS
                    + ", got " + brightness);
        }
        if (bitsPerSample != 8 && bitsPerSample != 16) {
            throw new InvalidOptionException("bitsPerSample must be 8 or 16, got " + bitsPerSample);
        }
        if (highlightMode < 0 || highlightMode > MAX_HIGHLIGHT_MODE) {
            throw new InvalidOptionException("highlightMode must be within 0-" + MAX_HIGHLIGHT_MODE
                    + ", got " + highlightMode);
        }
    }

    /** BT.709 gamma, brightness 1.0 with auto brightness, camera white balance, 8-bit sRGB. */
    public static OutputParams defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .gamma(gamma)
                .brightness(brightness)
                .autoBrightness(autoBrightness)
                .whiteBalance(whiteBalance.orElse(null))
                .colorSpace(colorSpace)
                .bitsPerSample(bitsPerSample)
                .highlightMode(highlightMode);
    }

    public boolean isDefault() {
        return equals(DEFAULTS);
    }

    public static final class Builder {
        private Gamma gamma = Gamma.BT709;
        private double brightness = 1.0;
        private boolean autoBrightness = true;
        private WhiteBalance whiteBalance;
        private OutputColorSpace colorSpace = OutputColorSpace.SRGB;
        private int bitsPerSample = 8;
        private int highlightMode = 0;

        private Builder() {}

        public Builder gamma(Gamma gamma) { this.gamma = gamma; return this; }
        public Builder gamma(double power, double toeSlope) { return gamma(new Gamma(power, toeSlope)); }
        public Builder brightness(double brightness) { this.brightness = brightness; return this; }
        public Builder autoBrightness(boolean autoBrightness) { this.autoBrightness = autoBrightness; return this; }
        public Builder whiteBalance(WhiteBalance whiteBalance) { this.whiteBalance = whiteBalance; return this; }
        public Builder whiteBalance(double red, double green, double blue, double green2) {
            return whiteBalance(new WhiteBalance(red, green, blue, green2));
        }
        public Builder colorSpace(OutputColorSpace colorSpace) { this.colorSpace = colorSpace; return this; }
        public Builder bitsPerSample(int bitsPerSample) { this.bitsPerSample = bitsPerSample; return this; }
        public Builder highlightMode(int highlightMode) { this.highlightMode = highlightMode; return this; }

        /**
         * @throws InvalidOptionException for out-of-range values
         */
        public OutputParams build() {
            return new OutputParams(gamma, brightness, autoBrightness, Optional.ofNullable(whiteBalance),
                    colorSpace, bitsPerSample, highlightMode);
        }
    }
}
