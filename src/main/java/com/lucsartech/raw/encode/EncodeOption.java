package com.lucsartech.raw.encode;

/**
 * Option groups a format may or may not accept.
 */
public enum EncodeOption {
    QUALITY,
    RESIZE,
    PROGRESSIVE,
    CHROMA_SUBSAMPLING,
    COMPRESSION_LEVEL,
    EFFORT,
    LOSSLESS
}
