package com.lucsartech.raw.config;

import com.lucsartech.raw.encode.ChromaSubsampling;
import com.lucsartech.raw.error.InvalidOptionException;

import java.util.Locale;

/**
 * Intended use of a derived image, with the JPEG settings each use calls for.
 */
public enum UsageHint {
    WEB(80, true, ChromaSubsampling.YUV420),
    PRINT(95, false, ChromaSubsampling.YUV422),
    ARCHIVE(98, false, ChromaSubsampling.YUV444);

    private final int quality;
    private final boolean progressive;
    private final ChromaSubsampling chromaSubsampling;

    UsageHint(int quality, boolean progressive, ChromaSubsampling chromaSubsampling) {
        this.quality = quality;
        this.progressive = progressive;
        this.chromaSubsampling = chromaSubsampling;
    }

    public int quality() {
        return quality;
    }

    public boolean progressive() {
        return progressive;
    }

    public ChromaSubsampling chromaSubsampling() {
        return chromaSubsampling;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UsageHint parse(String value) {
        if (value != null) {
            for (UsageHint hint : values()) {
                if (hint.name().equalsIgnoreCase(value.trim())) {
                    return hint;
                }
            }
        }
        throw new InvalidOptionException("Unknown usage: " + value + " (expected web, print or archive)");
    }
}
