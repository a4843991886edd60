package com.lucsartech.raw.encode;

import com.lucsartech.raw.decode.DecodedImage;
import com.lucsartech.raw.error.EncodeException;

/**
 * Encoder engine. Must only read the supplied raster; it is shared with concurrent conversions.
 */
public interface ImageEncoder {

    /**
     * @throws EncodeException if the format cannot be produced, including formats
     *                         the running platform has no writer for
     */
    EncodedImage encode(DecodedImage image, EncodeSpec spec);
}
