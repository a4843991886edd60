package com.lucsartech.raw.optimize;

/**
 * Resolution buckets by megapixel count.
 */
public enum SizeCategory {
    HIGH_RESOLUTION("high-resolution", 24.0),
    MEDIUM_RESOLUTION("medium-resolution", 8.0),
    LOW_RESOLUTION("low-resolution", 0.0);

    private final String label;
    private final double minMegapixels;

    SizeCategory(String label, double minMegapixels) {
        this.label = label;
        this.minMegapixels = minMegapixels;
    }

    public String label() {
        return label;
    }

    public double minMegapixels() {
        return minMegapixels;
    }

    public static SizeCategory of(double megapixels) {
        for (SizeCategory category : values()) {
            if (megapixels >= category.minMegapixels) {
                return category;
            }
        }
        return LOW_RESOLUTION;
    }

    @Override
    public String toString() {
        return label;
    }
}
