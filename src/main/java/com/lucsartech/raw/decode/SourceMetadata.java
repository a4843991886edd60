package com.lucsartech.raw.decode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Header-level information about a loaded source, available before decoding.
 */
public record SourceMetadata(
        String source,
        long sizeBytes,
        ImageDimensions dimensions,
        String formatName,
        Optional<String> make,
        Optional<String> model,
        CaptureInfo capture,
        LensInfo lens
) {

    public static SourceMetadata of(String source, long sizeBytes, ImageDimensions dimensions, String formatName) {
        return new SourceMetadata(source, sizeBytes, dimensions, formatName,
                Optional.empty(), Optional.empty(), CaptureInfo.unknown(), LensInfo.unknown());
    }

    /**
     * "Make Model" as the camera catalog lists it, when both are known.
     */
    public Optional<String> camera() {
        if (make.isEmpty() || model.isEmpty()) {
            return Optional.empty();
        }
        String m = model.get();
        // Most vendors repeat the make in the model tag
        return Optional.of(m.regionMatches(true, 0, make.get(), 0, make.get().length()) ? m : make.get() + " " + m);
    }

    /**
     * One-line shooting summary, e.g. {@code ISO 200, 1/250s, f/2.8, 50mm, lens RF24-70mm (zoom)}.
     */
    public String shootingSummary() {
        if (capture.isEmpty() && lens.isEmpty()) {
            return "no capture data";
        }
        List<String> parts = new ArrayList<>();
        capture.iso().ifPresent(iso -> parts.add("ISO " + iso));
        capture.shutterSpeedLabel().ifPresent(parts::add);
        capture.aperture().ifPresent(f -> parts.add(String.format(Locale.ROOT, "f/%.1f", f)));
        capture.focalLength().ifPresent(mm -> parts.add(Math.round(mm) + "mm"));
        lens.model().ifPresent(model -> parts.add("lens " + model + (lens.isZoom() ? " (zoom)" : "")));
        return String.join(", ", parts);
    }
}
