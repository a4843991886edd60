package com.lucsartech.raw.decode;

import java.util.Locale;

/**
 * Colour space a decoder renders into.
 */
public enum OutputColorSpace {
    RAW,
    SRGB,
    ADOBE_RGB,
    WIDE_GAMUT,
    PROPHOTO,
    XYZ,
    ACES;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
