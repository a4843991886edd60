package com.lucsartech.raw.decode;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Decoded raster of a source image.
 *
 * <p>Once handed out by a session the raster is never written to again; encoders
 * that need a different size or pixel layout draw into their own copy. That makes
 * the instance safe to share between concurrent conversions without locking.
 */
public record DecodedImage(BufferedImage raster, ImageDimensions dimensions) {

    public DecodedImage {
        Objects.requireNonNull(raster, "Raster is required");
        Objects.requireNonNull(dimensions, "Dimensions are required");
    }
}
