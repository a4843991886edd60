package com.lucsartech.raw.conversion;

import com.lucsartech.raw.decode.DecodedImage;
import com.lucsartech.raw.encode.EncodeSpec;
import com.lucsartech.raw.encode.EncodedImage;
import com.lucsartech.raw.encode.ImageEncoder;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.ConversionException;
import com.lucsartech.raw.error.EncodeException;
import com.lucsartech.raw.session.ConversionSession;
import com.lucsartech.raw.session.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a {@link ConversionRequest} into encoded bytes for one session.
 *
 * <p>The first conversion on a session triggers its decode; later ones reuse the cached
 * raster and report {@code fromCache=true}. Processing time covers everything the call
 * waited for, so a conversion that had to decode is measurably slower than one that
 * did not. Thread-safe: the adapter holds no per-call state.
 */
public final class FormatAdapter {

    private static final Logger log = LoggerFactory.getLogger(FormatAdapter.class);

    public static final int DEFAULT_THUMBNAIL_EDGE = 300;
    public static final int DEFAULT_THUMBNAIL_QUALITY = 85;

    private final ImageEncoder encoder;

    public FormatAdapter(ImageEncoder encoder) {
        this.encoder = Objects.requireNonNull(encoder, "Encoder is required");
    }

    /**
     * Convert asynchronously on the session's executor. Lifecycle errors, decode errors and
     * encode errors all complete the returned future exceptionally with their precise type.
     */
    public CompletableFuture<ConversionResult.Success> convertAsync(ConversionSession session, ConversionRequest request) {
        Objects.requireNonNull(session, "Session is required");
        Objects.requireNonNull(request, "Request is required");

        long start = System.nanoTime();
        boolean fromCache = session.isProcessed();
        long originalSize;
        CompletableFuture<DecodedImage> decode;
        try {
            originalSize = session.metadata().sizeBytes();
            decode = session.processAsync();
        } catch (ConversionException e) {
            return CompletableFuture.failedFuture(e);
        }

        return decode.thenApplyAsync(
                image -> encode(image, request, originalSize, start, fromCache),
                session.executor());
    }

    /**
     * Blocking conversion to an in-memory buffer.
     */
    public ConversionResult.Success convert(ConversionSession session, ConversionRequest request) {
        return Futures.await(convertAsync(session, request));
    }

    /**
     * Convert and write the bytes to {@code target}. The parent directory must exist.
     *
     * @throws EncodeException if the file cannot be written
     */
    public ConversionResult.Success convertToFile(ConversionSession session, ConversionRequest request, Path target) {
        Objects.requireNonNull(target, "Target path is required");
        var result = convert(session, request);
        try {
            Files.write(target, result.data());
        } catch (IOException e) {
            throw new EncodeException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} bytes to {}", result.compressedSize(), target);
        return result.withOutput(target);
    }

    /**
     * JPEG thumbnail whose longest edge is at most {@code maxEdge} pixels.
     */
    public ConversionResult.Success thumbnail(ConversionSession session, int maxEdge, int quality) {
        var request = ConversionRequest.builder(OutputFormat.JPEG)
                .maxEdge(maxEdge)
                .quality(quality)
                .build();
        return convert(session, request);
    }

    public ConversionResult.Success thumbnail(ConversionSession session) {
        return thumbnail(session, DEFAULT_THUMBNAIL_EDGE, DEFAULT_THUMBNAIL_QUALITY);
    }

    /**
     * Encode the preview embedded in the source instead of the decoded raster. Runs on the
     * calling thread and never triggers the full decode; resize options apply to the
     * preview's own dimensions.
     *
     * @return empty when the source carries no preview
     */
    public Optional<ConversionResult.Success> convertPreview(ConversionSession session, ConversionRequest request) {
        Objects.requireNonNull(session, "Session is required");
        Objects.requireNonNull(request, "Request is required");

        long start = System.nanoTime();
        long originalSize = session.metadata().sizeBytes();
        return session.extractPreview()
                .map(preview -> encode(preview, request, originalSize, start, false));
    }

    private ConversionResult.Success encode(DecodedImage image, ConversionRequest request,
                                            long originalSize, long start, boolean fromCache) {
        EncodeSpec spec = request.toEncodeSpec(image.dimensions());

        EncodedImage encoded;
        try {
            encoded = encoder.encode(image, spec);
        } catch (EncodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EncodeException("Encoder failed for " + spec.format() + ": " + e.getMessage(), e);
        }
        if (encoded == null || encoded.size() == 0) {
            throw new EncodeException("Encoder produced no bytes for " + spec.format());
        }

        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        var result = new ConversionResult.Success(
                spec.format(),
                encoded.data(),
                image.dimensions(),
                encoded.dimensions(),
                originalSize,
                encoded.size(),
                elapsed,
                fromCache,
                Optional.empty()
        );

        log.debug("Converted to {} {} -> {} in {}ms: {} -> {} bytes ({}x){}",
                spec.format(), image.dimensions(), encoded.dimensions(), elapsed.toMillis(),
                originalSize, encoded.size(), result.compressionRatio(), fromCache ? " [cached decode]" : "");
        return result;
    }
}
