package com.lucsartech.raw.optimize;

import com.lucsartech.raw.config.UsageHint;
import com.lucsartech.raw.conversion.ConversionRequest;

import java.util.List;

/**
 * Recommended request plus the reasoning that produced each value.
 */
public record OptimizedSettings(
        ConversionRequest recommended,
        UsageHint usage,
        SizeCategory category,
        double megapixels,
        List<String> reasoning
) {

    public OptimizedSettings {
        reasoning = List.copyOf(reasoning);
    }
}
