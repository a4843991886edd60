package com.lucsartech.raw.encode;

import com.lucsartech.raw.decode.ImageDimensions;

/**
 * Bytes produced by an encoder together with the dimensions actually written.
 */
public record EncodedImage(byte[] data, ImageDimensions dimensions) {

    public int size() {
        return data.length;
    }
}
