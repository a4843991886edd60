package com.lucsartech.raw.session;

import com.lucsartech.raw.decode.DecodedImage;
import com.lucsartech.raw.decode.DecoderHandle;
import com.lucsartech.raw.decode.ImageDimensions;
import com.lucsartech.raw.decode.OutputParams;
import com.lucsartech.raw.decode.RawDecoder;
import com.lucsartech.raw.decode.SourceMetadata;
import com.lucsartech.raw.error.AlreadyClosedException;
import com.lucsartech.raw.error.ConversionException;
import com.lucsartech.raw.error.DecodeException;
import com.lucsartech.raw.error.InvalidOptionException;
import com.lucsartech.raw.error.LoadException;
import com.lucsartech.raw.error.NotLoadedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One loaded source image and its cached decode.
 *
 * <p>Lifecycle: {@code EMPTY -> LOADED -> PROCESSED -> CLOSED}. The decode runs at most
 * once successfully: concurrent callers of {@link #processAsync()} while a decode is in
 * flight all observe the same outcome, and once it succeeded the raster is returned
 * straight from the cache. A failed decode, whatever the decoder threw, leaves the
 * session {@code LOADED} so it can be retried.
 *
 * <p>The decoder handle is owned exclusively by the session and released by
 * {@link #close()}, which callers must run on every exit path (try-with-resources).
 * A decode or preview extraction still running at close keeps the handle alive until it
 * returns; the release happens then. Thread-safe.
 */
public final class ConversionSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConversionSession.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final RawDecoder decoder;
    private final Executor executor;
    private final AtomicInteger decodeCount = new AtomicInteger();

    private final ReentrantLock lock = new ReentrantLock();
    private SessionState state = SessionState.EMPTY;
    private boolean loading;
    private DecoderHandle handle;
    private OutputParams outputParams = OutputParams.defaults();
    private CompletableFuture<DecodedImage> pendingDecode;
    private volatile DecodedImage decoded;

    // Decoder calls currently using the handle; close defers the release until they return
    private int handleUsers;
    private DecoderHandle deferredRelease;

    /**
     * @param decoder  decoder engine
     * @param executor pool the decode runs on; {@code Runnable::run} decodes on the calling thread
     */
    public ConversionSession(RawDecoder decoder, Executor executor) {
        this.decoder = Objects.requireNonNull(decoder, "Decoder is required");
        this.executor = Objects.requireNonNull(executor, "Executor is required");
    }

    // ========== Loading ==========

    public void load(Path source) {
        Objects.requireNonNull(source, "Source is required");
        acquire(() -> decoder.load(source));
    }

    public void load(byte[] data, String name) {
        acquire(() -> decoder.load(data, name));
    }

    private void acquire(Supplier<DecoderHandle> loader) {
        lock.lock();
        try {
            ensureOpen("load");
            if (state != SessionState.EMPTY || loading) {
                String held = handle != null ? handle.source() : "a source being loaded";
                throw new LoadException("Session " + id + " already holds " + held);
            }
            loading = true;
        } finally {
            lock.unlock();
        }

        // File I/O happens outside the lock so state() and close() never wait on it
        DecoderHandle loaded = null;
        try {
            loaded = loader.get();
            if (loaded == null) {
                throw new LoadException("Decoder returned no handle");
            }
        } finally {
            if (loaded == null) {
                lock.lock();
                try {
                    loading = false;
                } finally {
                    lock.unlock();
                }
            }
        }

        boolean closed;
        lock.lock();
        try {
            loading = false;
            closed = state == SessionState.CLOSED;
            if (!closed) {
                handle = loaded;
                state = SessionState.LOADED;
            }
        } finally {
            lock.unlock();
        }

        if (closed) {
            log.debug("Session {} closed while loading {}, releasing it", id, loaded.source());
            release(loaded);
            throw new AlreadyClosedException("load");
        }
        log.debug("Session {} loaded {} ({})", id, loaded.source(), loaded.metadata().dimensions());
    }

    // ========== Rendering parameters ==========

    /**
     * Set the parameters the decode renders with. Allowed until a decode starts; after a
     * failed decode they may be changed before retrying.
     *
     * @throws InvalidOptionException if a decode is running or has completed
     */
    public void setOutputParams(OutputParams params) {
        Objects.requireNonNull(params, "Output params are required");
        lock.lock();
        try {
            ensureOpen("set output params");
            if (decoded != null || pendingDecode != null) {
                throw new InvalidOptionException("Output params are fixed once session " + id + " has decoded");
            }
            outputParams = params;
        } finally {
            lock.unlock();
        }
    }

    public OutputParams outputParams() {
        lock.lock();
        try {
            return outputParams;
        } finally {
            lock.unlock();
        }
    }

    // ========== Decoding ==========

    /**
     * Decode the source, or join the decode already running, or return the cached raster.
     *
     * @return a future private to the caller; cancelling it does not affect other callers
     * @throws NotLoadedException     before {@code load}
     * @throws AlreadyClosedException after {@code close}
     */
    public CompletableFuture<DecodedImage> processAsync() {
        CompletableFuture<DecodedImage> shared;
        DecoderHandle target = null;
        OutputParams params = null;

        lock.lock();
        try {
            ensureOpen("process");
            ensureLoaded("process");
            if (decoded != null) {
                return CompletableFuture.completedFuture(decoded);
            }
            if (pendingDecode == null) {
                pendingDecode = new CompletableFuture<>();
                target = handle;
                params = outputParams;
                handleUsers++;
            }
            shared = pendingDecode;
        } finally {
            lock.unlock();
        }

        if (target != null) {
            startDecode(target, params, shared);
        }
        return shared.copy();
    }

    /**
     * Blocking form of {@link #processAsync()}.
     *
     * @throws DecodeException if the decode fails; the session stays loaded
     */
    public DecodedImage process() {
        return Futures.await(processAsync());
    }

    private void startDecode(DecoderHandle target, OutputParams params, CompletableFuture<DecodedImage> future) {
        try {
            executor.execute(() -> runDecode(target, params, future));
        } catch (RejectedExecutionException e) {
            endUse();
            decodeFailed(future, new DecodeException("Decode rejected by executor for " + target.source(), e));
        }
    }

    private void runDecode(DecoderHandle target, OutputParams params, CompletableFuture<DecodedImage> future) {
        long start = System.nanoTime();
        decodeCount.incrementAndGet();
        DecodedImage image = null;
        ConversionException failure = null;
        try {
            image = decoder.decode(target, params);
            if (image == null) {
                failure = new DecodeException("Decoder returned no raster for " + target.source());
            }
        } catch (ConversionException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new DecodeException("Decode failed for " + target.source() + ": " + e.getMessage(), e);
        } catch (Error e) {
            // Native link errors and oversized rasters must not leave callers waiting forever
            log.error("Session {} decoder aborted on {}", id, target.source(), e);
            failure = new DecodeException("Decode aborted for " + target.source() + ": " + e, e);
        } finally {
            endUse();
        }

        if (failure != null) {
            decodeFailed(future, failure);
        } else {
            decodeSucceeded(future, image, (System.nanoTime() - start) / 1_000_000);
        }
    }

    private void decodeSucceeded(CompletableFuture<DecodedImage> future, DecodedImage image, long elapsedMs) {
        boolean closed;
        lock.lock();
        try {
            if (pendingDecode == future) {
                pendingDecode = null;
            }
            closed = state == SessionState.CLOSED;
            if (!closed) {
                decoded = image;
                state = SessionState.PROCESSED;
            }
        } finally {
            lock.unlock();
        }

        if (closed) {
            log.debug("Session {} closed during decode, discarding raster", id);
            future.completeExceptionally(new AlreadyClosedException("process"));
        } else {
            log.debug("Session {} decoded {} in {}ms", id, image.dimensions(), elapsedMs);
            future.complete(image);
        }
    }

    private void decodeFailed(CompletableFuture<DecodedImage> future, ConversionException error) {
        lock.lock();
        try {
            if (pendingDecode == future) {
                pendingDecode = null;
            }
        } finally {
            lock.unlock();
        }
        log.warn("Session {} decode failed: {}", id, error.getMessage());
        future.completeExceptionally(error);
    }

    // ========== Embedded preview ==========

    /**
     * The preview the camera embedded in the source, without running the full decode.
     * Does not change the session state or the decode count.
     *
     * @throws DecodeException if a preview exists but cannot be read
     */
    public Optional<DecodedImage> extractPreview() {
        DecoderHandle target = beginUse("extract preview");
        try {
            Optional<DecodedImage> preview = decoder.extractPreview(target);
            log.debug("Session {} preview of {}: {}", id, target.source(),
                    preview != null && preview.isPresent() ? preview.get().dimensions() : "none");
            return preview != null ? preview : Optional.empty();
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodeException("Preview extraction failed for " + target.source() + ": " + e.getMessage(), e);
        } finally {
            endUse();
        }
    }

    // ========== Queries ==========

    public long id() {
        return id;
    }

    public SessionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a decode has completed, i.e. conversions from now on only encode.
     */
    public boolean isProcessed() {
        return decoded != null;
    }

    public SourceMetadata metadata() {
        lock.lock();
        try {
            ensureOpen("read metadata");
            ensureLoaded("read metadata");
            return handle.metadata();
        } finally {
            lock.unlock();
        }
    }

    public ImageDimensions originalDimensions() {
        return metadata().dimensions();
    }

    /**
     * Number of decoder invocations so far, successful or not.
     */
    public int decodeCount() {
        return decodeCount.get();
    }

    /**
     * Pool that decode and encode work for this session runs on.
     */
    public Executor executor() {
        return executor;
    }

    // ========== Release ==========

    /**
     * Release the decoder handle. Further calls are no-ops; every other operation
     * fails with {@link AlreadyClosedException} afterwards. When a decoder call is still
     * running on the handle, the release happens as soon as it returns.
     */
    @Override
    public void close() {
        DecoderHandle toRelease = null;
        boolean deferred = false;
        lock.lock();
        try {
            if (state == SessionState.CLOSED) {
                return;
            }
            state = SessionState.CLOSED;
            if (handle != null) {
                if (handleUsers > 0) {
                    deferredRelease = handle;
                    deferred = true;
                } else {
                    toRelease = handle;
                }
            }
            handle = null;
            decoded = null;
        } finally {
            lock.unlock();
        }

        if (toRelease != null) {
            release(toRelease);
        }
        log.debug("Session {} closed{}", id, deferred ? ", handle release waits for the running decoder call" : "");
    }

    private DecoderHandle beginUse(String operation) {
        lock.lock();
        try {
            ensureOpen(operation);
            ensureLoaded(operation);
            handleUsers++;
            return handle;
        } finally {
            lock.unlock();
        }
    }

    private void endUse() {
        DecoderHandle toRelease = null;
        lock.lock();
        try {
            handleUsers--;
            if (handleUsers == 0 && deferredRelease != null) {
                toRelease = deferredRelease;
                deferredRelease = null;
            }
        } finally {
            lock.unlock();
        }
        if (toRelease != null) {
            release(toRelease);
        }
    }

    private void release(DecoderHandle target) {
        try {
            decoder.release(target);
            log.trace("Session {} released {}", id, target.source());
        } catch (RuntimeException e) {
            log.warn("Session {} failed to release {}: {}", id, target.source(), e.getMessage());
        }
    }

    private void ensureOpen(String operation) {
        if (state == SessionState.CLOSED) {
            throw new AlreadyClosedException(operation);
        }
    }

    private void ensureLoaded(String operation) {
        if (state == SessionState.EMPTY) {
            throw new NotLoadedException(operation);
        }
    }

    @Override
    public String toString() {
        return "ConversionSession[" + id + ", " + state() + "]";
    }
}
