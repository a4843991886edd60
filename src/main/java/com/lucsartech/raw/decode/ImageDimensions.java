package com.lucsartech.raw.decode;

/**
 * Pixel dimensions of a source or an output image.
 */
public record ImageDimensions(int width, int height) {

    public ImageDimensions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
        }
    }

    public double megapixels() {
        return (double) width * height / 1_000_000.0;
    }

    public int longestEdge() {
        return Math.max(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
