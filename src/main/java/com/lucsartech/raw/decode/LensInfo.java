package com.lucsartech.raw.decode;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Lens description recorded in the source.
 */
public record LensInfo(
        Optional<String> make,
        Optional<String> model,
        OptionalDouble minFocalLength,
        OptionalDouble maxFocalLength,
        OptionalInt focalLengthIn35mm
) {

    private static final LensInfo UNKNOWN = new LensInfo(
            Optional.empty(), Optional.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalInt.empty());

    public static LensInfo unknown() {
        return UNKNOWN;
    }

    public boolean isEmpty() {
        return this.equals(UNKNOWN);
    }

    public boolean isZoom() {
        return minFocalLength.isPresent() && maxFocalLength.isPresent()
                && maxFocalLength.getAsDouble() > minFocalLength.getAsDouble();
    }
}
