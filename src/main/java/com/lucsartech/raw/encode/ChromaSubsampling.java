package com.lucsartech.raw.encode;

import com.lucsartech.raw.error.InvalidOptionException;

/**
 * Chroma downsampling schemes, with the luma sampling factors they map to.
 */
public enum ChromaSubsampling {
    YUV444("4:4:4", 1, 1),
    YUV422("4:2:2", 2, 1),
    YUV420("4:2:0", 2, 2);

    private final String label;
    private final int horizontalFactor;
    private final int verticalFactor;

    ChromaSubsampling(String label, int horizontalFactor, int verticalFactor) {
        this.label = label;
        this.horizontalFactor = horizontalFactor;
        this.verticalFactor = verticalFactor;
    }

    public String label() {
        return label;
    }

    public int horizontalFactor() {
        return horizontalFactor;
    }

    public int verticalFactor() {
        return verticalFactor;
    }

    /**
     * Accepts both the ratio notation ("4:2:0") and the constant name ("YUV420").
     */
    public static ChromaSubsampling parse(String value) {
        if (value != null) {
            for (ChromaSubsampling c : values()) {
                if (c.label.equals(value.trim()) || c.name().equalsIgnoreCase(value.trim())) {
                    return c;
                }
            }
        }
        throw new InvalidOptionException("Unknown chroma subsampling: " + value + " (expected 4:4:4, 4:2:2 or 4:2:0)");
    }

    @Override
    public String toString() {
        return label;
    }
}
