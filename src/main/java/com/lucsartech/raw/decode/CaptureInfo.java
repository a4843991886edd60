package com.lucsartech.raw.decode;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Exposure settings recorded by the camera. Every field is optional: developed sources
 * and stripped files often carry none of them.
 *
 * @param iso          ISO sensitivity
 * @param shutterSpeed exposure time in seconds
 * @param aperture     f-number
 * @param focalLength  focal length in millimetres
 * @param capturedAt   capture time as recorded, in camera local time
 */
public record CaptureInfo(
        OptionalInt iso,
        OptionalDouble shutterSpeed,
        OptionalDouble aperture,
        OptionalDouble focalLength,
        Optional<LocalDateTime> capturedAt
) {

    private static final CaptureInfo UNKNOWN = new CaptureInfo(
            OptionalInt.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), Optional.empty());

    public static CaptureInfo unknown() {
        return UNKNOWN;
    }

    public boolean isEmpty() {
        return this.equals(UNKNOWN);
    }

    /**
     * Shutter speed the way cameras display it: {@code 1/250s} below one second, {@code 2.5s} above.
     */
    public Optional<String> shutterSpeedLabel() {
        if (shutterSpeed.isEmpty() || shutterSpeed.getAsDouble() <= 0) {
            return Optional.empty();
        }
        double seconds = shutterSpeed.getAsDouble();
        if (seconds < 1.0) {
            return Optional.of("1/" + Math.round(1.0 / seconds) + "s");
        }
        return Optional.of(String.format(Locale.ROOT, "%.1fs", seconds));
    }
}
