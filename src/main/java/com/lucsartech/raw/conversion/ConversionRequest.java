package com.lucsartech.raw.conversion;

import com.lucsartech.raw.decode.ImageDimensions;
import com.lucsartech.raw.encode.ChromaSubsampling;
import com.lucsartech.raw.encode.EncodeOption;
import com.lucsartech.raw.encode.EncodeSpec;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.InvalidOptionException;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Validated description of one output to derive from a decoded source.
 *
 * <p>Instances are immutable and can only be obtained through {@link #builder(OutputFormat)},
 * which rejects out-of-range values and options the format does not accept.
 * Absent fields fall back to the per-format defaults of {@link OutputFormat}.
 *
 * <p>Sizing rules: with only {@code width} or only {@code height} the other side follows
 * the source aspect ratio; with both the output is exactly that size (non-uniform scaling
 * is allowed); {@code maxEdge} bounds the longest side and never enlarges.
 */
public final class ConversionRequest {

    private final OutputFormat format;
    private final Integer quality;
    private final Integer width;
    private final Integer height;
    private final Integer maxEdge;
    private final Boolean progressive;
    private final ChromaSubsampling chromaSubsampling;
    private final Integer compressionLevel;
    private final Integer effort;
    private final Boolean lossless;

    private ConversionRequest(Builder b) {
        this.format = b.format;
        this.quality = b.quality;
        this.width = b.width;
        this.height = b.height;
        this.maxEdge = b.maxEdge;
        this.progressive = b.progressive;
        this.chromaSubsampling = b.chromaSubsampling;
        this.compressionLevel = b.compressionLevel;
        this.effort = b.effort;
        this.lossless = b.lossless;
    }

    public static Builder builder(OutputFormat format) {
        return new Builder(format);
    }

    public static ConversionRequest of(OutputFormat format) {
        return builder(format).build();
    }

    public Builder toBuilder() {
        var b = new Builder(format);
        b.quality = quality;
        b.width = width;
        b.height = height;
        b.maxEdge = maxEdge;
        b.progressive = progressive;
        b.chromaSubsampling = chromaSubsampling;
        b.compressionLevel = compressionLevel;
        b.effort = effort;
        b.lossless = lossless;
        return b;
    }

    public OutputFormat format() { return format; }
    public OptionalInt quality() { return optional(quality); }
    public OptionalInt width() { return optional(width); }
    public OptionalInt height() { return optional(height); }
    public OptionalInt maxEdge() { return optional(maxEdge); }
    public Optional<Boolean> progressive() { return Optional.ofNullable(progressive); }
    public Optional<ChromaSubsampling> chromaSubsampling() { return Optional.ofNullable(chromaSubsampling); }
    public OptionalInt compressionLevel() { return optional(compressionLevel); }
    public OptionalInt effort() { return optional(effort); }
    public Optional<Boolean> lossless() { return Optional.ofNullable(lossless); }

    private static OptionalInt optional(Integer value) {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    /**
     * Compute the output size for a source of the given dimensions.
     */
    public ImageDimensions resolveTarget(ImageDimensions original) {
        Objects.requireNonNull(original, "Original dimensions are required");
        int w = original.width();
        int h = original.height();

        if (width != null && height != null) {
            return new ImageDimensions(width, height);
        }
        if (width != null) {
            return new ImageDimensions(width, scale(width, h, w));
        }
        if (height != null) {
            return new ImageDimensions(scale(height, w, h), height);
        }
        if (maxEdge != null && original.longestEdge() > maxEdge) {
            return w >= h
                    ? new ImageDimensions(maxEdge, scale(maxEdge, h, w))
                    : new ImageDimensions(scale(maxEdge, w, h), maxEdge);
        }
        return original;
    }

    private static int scale(int given, int otherOriginal, int givenOriginal) {
        return Math.max(1, (int) Math.round((double) given * otherOriginal / givenOriginal));
    }

    /**
     * Resolve every option to a concrete value for the encoder.
     */
    public EncodeSpec toEncodeSpec(ImageDimensions original) {
        boolean resolvedLossless = lossless != null
                ? lossless
                : format == OutputFormat.TIFF && quality == null;

        return new EncodeSpec(
                format,
                resolveTarget(original),
                quality != null ? quality : format.defaultQuality(),
                progressive != null && progressive,
                chromaSubsampling != null ? chromaSubsampling : ChromaSubsampling.YUV420,
                compressionLevel != null ? compressionLevel : OutputFormat.DEFAULT_COMPRESSION_LEVEL,
                effort != null ? effort : OutputFormat.DEFAULT_EFFORT,
                resolvedLossless
        );
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(format.name());
        append(sb, "quality", quality);
        append(sb, "width", width);
        append(sb, "height", height);
        append(sb, "maxEdge", maxEdge);
        append(sb, "progressive", progressive);
        append(sb, "chroma", chromaSubsampling);
        append(sb, "compressionLevel", compressionLevel);
        append(sb, "effort", effort);
        append(sb, "lossless", lossless);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String name, Object value) {
        if (value != null) {
            sb.append(' ').append(name).append('=').append(value);
        }
    }

    /**
     * Collects options and validates them in {@link #build()}.
     */
    public static final class Builder {

        private final OutputFormat format;
        private Integer quality;
        private Integer width;
        private Integer height;
        private Integer maxEdge;
        private Boolean progressive;
        private ChromaSubsampling chromaSubsampling;
        private Integer compressionLevel;
        private Integer effort;
        private Boolean lossless;

        private Builder(OutputFormat format) {
            if (format == null) {
                throw new InvalidOptionException("Output format is required");
            }
            this.format = format;
        }

        public Builder quality(Integer quality) { this.quality = quality; return this; }
        public Builder width(Integer width) { this.width = width; return this; }
        public Builder height(Integer height) { this.height = height; return this; }
        public Builder maxEdge(Integer maxEdge) { this.maxEdge = maxEdge; return this; }
        public Builder progressive(Boolean progressive) { this.progressive = progressive; return this; }
        public Builder chromaSubsampling(ChromaSubsampling chroma) { this.chromaSubsampling = chroma; return this; }
        public Builder chromaSubsampling(String chroma) { this.chromaSubsampling = ChromaSubsampling.parse(chroma); return this; }
        public Builder compressionLevel(Integer level) { this.compressionLevel = level; return this; }
        public Builder effort(Integer effort) { this.effort = effort; return this; }
        public Builder lossless(Boolean lossless) { this.lossless = lossless; return this; }

        public ConversionRequest build() {
            if (quality != null) {
                requireSupported(EncodeOption.QUALITY, "quality");
                requireRange("quality", quality, 1, 100);
            }
            if (width != null || height != null || maxEdge != null) {
                requireSupported(EncodeOption.RESIZE, "resize");
            }
            requirePositive("width", width);
            requirePositive("height", height);
            requirePositive("maxEdge", maxEdge);
            if (maxEdge != null && (width != null || height != null)) {
                throw new InvalidOptionException("maxEdge cannot be combined with width or height");
            }
            if (progressive != null) {
                requireSupported(EncodeOption.PROGRESSIVE, "progressive");
            }
            if (chromaSubsampling != null && !format.supports(chromaSubsampling)) {
                throw new InvalidOptionException(
                        "Chroma subsampling " + chromaSubsampling + " is not supported for " + format);
            }
            if (compressionLevel != null) {
                requireSupported(EncodeOption.COMPRESSION_LEVEL, "compressionLevel");
                requireRange("compressionLevel", compressionLevel, 0, OutputFormat.MAX_COMPRESSION_LEVEL);
            }
            if (effort != null) {
                requireSupported(EncodeOption.EFFORT, "effort");
                requireRange("effort", effort, 0, format.maxEffort());
            }
            if (lossless != null) {
                requireSupported(EncodeOption.LOSSLESS, "lossless");
            }
            return new ConversionRequest(this);
        }

        private void requireSupported(EncodeOption option, String name) {
            if (!format.supports(option)) {
                throw new InvalidOptionException("Option '" + name + "' is not supported for " + format);
            }
        }

        private static void requireRange(String name, int value, int min, int max) {
            if (value < min || value > max) {
                throw new InvalidOptionException(
                        name + " must be between " + min + " and " + max + ", got " + value);
            }
        }

        private static void requirePositive(String name, Integer value) {
            if (value != null && value <= 0) {
                throw new InvalidOptionException(name + " must be a positive integer, got " + value);
            }
        }
    }
}
