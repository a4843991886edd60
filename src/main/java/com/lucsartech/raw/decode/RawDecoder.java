package com.lucsartech.raw.decode;

import com.lucsartech.raw.error.DecodeException;
import com.lucsartech.raw.error.LoadException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Decoder engine that turns a photographic source into a raster.
 * Implementations must be thread-safe across distinct handles.
 */
public interface RawDecoder {

    /**
     * Open a source file and read its header, including camera, exposure and lens metadata.
     *
     * @throws LoadException if the file is unreadable, unsupported or corrupt
     */
    DecoderHandle load(Path source);

    /**
     * Open an in-memory source.
     *
     * @param data source bytes
     * @param name name used in logs and results
     * @throws LoadException if the bytes are not a supported, intact image
     */
    DecoderHandle load(byte[] data, String name);

    /**
     * Run the expensive full decode, rendered with {@code params}.
     *
     * @throws DecodeException on any decode failure, including parameters the engine cannot honour
     */
    DecodedImage decode(DecoderHandle handle, OutputParams params);

    default DecodedImage decode(DecoderHandle handle) {
        return decode(handle, OutputParams.defaults());
    }

    /**
     * The preview image the camera embedded in the source, if any. Much cheaper than
     * {@link #decode}: no demosaicing takes place.
     *
     * @throws DecodeException if a preview exists but cannot be read
     */
    Optional<DecodedImage> extractPreview(DecoderHandle handle);

    /**
     * Free everything held for the handle. Safe to call more than once.
     */
    void release(DecoderHandle handle);
}
