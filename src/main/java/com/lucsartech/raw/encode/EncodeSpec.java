package com.lucsartech.raw.encode;

import com.lucsartech.raw.decode.ImageDimensions;

import java.util.Objects;

/**
 * Fully resolved encoder instructions: target size computed, defaults applied.
 */
public record EncodeSpec(
        OutputFormat format,
        ImageDimensions target,
        int quality,
        boolean progressive,
        ChromaSubsampling chromaSubsampling,
        int compressionLevel,
        int effort,
        boolean lossless
) {

    public EncodeSpec {
        Objects.requireNonNull(format, "Format is required");
        Objects.requireNonNull(target, "Target dimensions are required");
        Objects.requireNonNull(chromaSubsampling, "Chroma subsampling is required");
    }
}
