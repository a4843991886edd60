package com.lucsartech.raw.optimize;

import com.lucsartech.raw.config.UsageHint;
import com.lucsartech.raw.conversion.ConversionRequest;
import com.lucsartech.raw.decode.ImageDimensions;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.session.ConversionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives JPEG settings from image size and intended use.
 * Stateless and thread-safe.
 */
public final class SettingsOptimizer {

    private static final Logger log = LoggerFactory.getLogger(SettingsOptimizer.class);

    public OptimizedSettings recommend(ImageDimensions dimensions, UsageHint usage) {
        Objects.requireNonNull(dimensions, "Dimensions are required");
        Objects.requireNonNull(usage, "Usage is required");

        double megapixels = dimensions.megapixels();
        SizeCategory category = SizeCategory.of(megapixels);
        String context = String.format(Locale.ROOT, "%s usage of a %s image (%.1f MP)",
                usage.label(), category.label(), megapixels);

        var reasoning = new ArrayList<String>();
        reasoning.add("Quality " + usage.quality() + " for " + context);
        reasoning.add((usage.progressive() ? "Progressive" : "Baseline") + " encoding for " + context);
        reasoning.add("Chroma subsampling " + usage.chromaSubsampling().label() + " for " + context);

        var recommended = ConversionRequest.builder(OutputFormat.JPEG)
                .quality(usage.quality())
                .progressive(usage.progressive())
                .chromaSubsampling(usage.chromaSubsampling())
                .build();

        log.debug("Recommended {} for {}", recommended, context);
        return new OptimizedSettings(recommended, usage, category, megapixels, reasoning);
    }

    /**
     * Recommend from a loaded session's header dimensions; does not trigger a decode.
     */
    public OptimizedSettings recommend(ConversionSession session, UsageHint usage) {
        return recommend(session.originalDimensions(), usage);
    }
}
