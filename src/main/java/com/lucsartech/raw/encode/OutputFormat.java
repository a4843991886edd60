package com.lucsartech.raw.encode;

import com.lucsartech.raw.error.InvalidOptionException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.lucsartech.raw.encode.EncodeOption.*;

/**
 * Output encodings with the options each one accepts and its defaults.
 */
public enum OutputFormat {
    JPEG("jpeg", "jpg", 85, 0, EnumSet.of(QUALITY, RESIZE, PROGRESSIVE, CHROMA_SUBSAMPLING)),
    PNG("png", "png", 0, 0, EnumSet.of(RESIZE, PROGRESSIVE, COMPRESSION_LEVEL)),
    WEBP("webp", "webp", 80, 6, EnumSet.of(QUALITY, RESIZE, EFFORT, LOSSLESS)),
    AVIF("avif", "avif", 50, 9, EnumSet.of(QUALITY, RESIZE, EFFORT, LOSSLESS, CHROMA_SUBSAMPLING)),
    TIFF("tiff", "tiff", 90, 0, EnumSet.of(QUALITY, RESIZE, LOSSLESS));

    public static final int DEFAULT_COMPRESSION_LEVEL = 6;
    public static final int MAX_COMPRESSION_LEVEL = 9;
    public static final int DEFAULT_EFFORT = 4;

    private final String formatName;
    private final String extension;
    private final int defaultQuality;
    private final int maxEffort;
    private final Set<EncodeOption> options;

    OutputFormat(String formatName, String extension, int defaultQuality, int maxEffort, Set<EncodeOption> options) {
        this.formatName = formatName;
        this.extension = extension;
        this.defaultQuality = defaultQuality;
        this.maxEffort = maxEffort;
        this.options = options;
    }

    /** ImageIO format name. */
    public String formatName() {
        return formatName;
    }

    public String extension() {
        return extension;
    }

    public int defaultQuality() {
        return defaultQuality;
    }

    public int maxEffort() {
        return maxEffort;
    }

    public boolean supports(EncodeOption option) {
        return options.contains(option);
    }

    public boolean supports(ChromaSubsampling chroma) {
        if (!supports(CHROMA_SUBSAMPLING)) {
            return false;
        }
        // AVIF has no 4:2:2 profile in common encoders
        return this != AVIF || chroma != ChromaSubsampling.YUV422;
    }

    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidOptionException("Output format is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.formatName.equals(v) || f.extension.equals(v)) {
                return f;
            }
        }
        if (v.equals("tif")) {
            return TIFF;
        }
        throw new InvalidOptionException("Unsupported output format: " + value);
    }
}
