package com.lucsartech.raw.decode;

/**
 * Opaque reference to a loaded source inside a {@link RawDecoder}.
 * Owned by exactly one session, which is the only party allowed to release it.
 */
public interface DecoderHandle {

    SourceMetadata metadata();

    default String source() {
        return metadata().source();
    }

    default long sourceBytes() {
        return metadata().sizeBytes();
    }
}
