package com.lucsartech.raw.conversion;

import com.lucsartech.raw.session.ConversionSession;
import com.lucsartech.raw.session.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Produces several encodings of one session concurrently.
 *
 * <p>All requests share the session's single decode; each encode only reads the
 * immutable raster, so no coordination is needed between them. A failing request
 * becomes a {@link ConversionResult.Failure} in its slot and does not affect the others.
 */
public final class MultiFormatConverter {

    private static final Logger log = LoggerFactory.getLogger(MultiFormatConverter.class);

    private final FormatAdapter formatAdapter;

    public MultiFormatConverter(FormatAdapter formatAdapter) {
        this.formatAdapter = Objects.requireNonNull(formatAdapter, "Format adapter is required");
    }

    /**
     * @return one result per request, in request order; never fails as a whole
     */
    public CompletableFuture<List<ConversionResult>> convertAllAsync(ConversionSession session,
                                                                   List<ConversionRequest> requests) {
        Objects.requireNonNull(session, "Session is required");
        Objects.requireNonNull(requests, "Requests are required");

        List<CompletableFuture<ConversionResult>> futures = new ArrayList<>(requests.size());
        for (ConversionRequest request : requests) {
            futures.add(formatAdapter.convertAsync(session, request)
                    .handle((success, error) -> error == null
                            ? success
                            : failure(request, error)));
        }

        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<ConversionResult> results = futures.stream().map(CompletableFuture::join).toList();
                    long failed = results.stream().filter(ConversionResult::isFailure).count();
                    log.debug("Fan-out on session {}: {} formats, {} failed", session.id(), results.size(), failed);
                    return results;
                });
    }

    public List<ConversionResult> convertAll(ConversionSession session, List<ConversionRequest> requests) {
        return Futures.await(convertAllAsync(session, requests));
    }

    private ConversionResult failure(ConversionRequest request, Throwable error) {
        Throwable cause = Futures.unwrap(error);
        log.warn("Fan-out {} failed: {}", request.format(), cause.getMessage());
        return ConversionResult.Failure.of(request.format(), cause);
    }
}
