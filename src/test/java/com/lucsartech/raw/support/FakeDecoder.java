package com.lucsartech.raw.support;

import com.lucsartech.raw.decode.DecodedImage;
import com.lucsartech.raw.decode.DecoderHandle;
import com.lucsartech.raw.decode.ImageDimensions;
import com.lucsartech.raw.decode.OutputParams;
import com.lucsartech.raw.decode.RawDecoder;
import com.lucsartech.raw.decode.SourceMetadata;
import com.lucsartech.raw.error.DecodeException;
import com.lucsartech.raw.error.LoadException;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory decoder that reports large dimensions but hands out a small raster.
 *
 * <p>Sources whose name contains {@code corrupt} fail to load; names containing
 * {@code broken} load fine but fail to decode, and {@code oversized} ones run out of
 * memory while decoding. Sources named {@code nopreview} carry no embedded preview.
 */
public final class FakeDecoder implements RawDecoder {

    public static final long SOURCE_BYTES = 25_000_000L;
    public static final ImageDimensions PREVIEW_DIMENSIONS = new ImageDimensions(160, 120);

    private final ImageDimensions dimensions;
    private final ConcurrencyProbe probe;
    private final AtomicInteger loadsStarted = new AtomicInteger();
    private final AtomicInteger loads = new AtomicInteger();
    private final AtomicInteger decodes = new AtomicInteger();
    private final AtomicInteger releases = new AtomicInteger();
    private final AtomicInteger previews = new AtomicInteger();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final AtomicInteger decodesInFlight = new AtomicInteger();
    private final AtomicBoolean releasedDuringDecode = new AtomicBoolean();
    private final AtomicReference<Error> errorToInject = new AtomicReference<>();
    private final AtomicReference<OutputParams> lastParams = new AtomicReference<>();

    private volatile long decodeDelayMillis;
    private volatile CountDownLatch gate;
    private volatile CountDownLatch loadGate;

    public FakeDecoder() {
        this(new ImageDimensions(6000, 4000));
    }

    public FakeDecoder(ImageDimensions dimensions) {
        this(dimensions, new ConcurrencyProbe());
    }

    public FakeDecoder(ImageDimensions dimensions, ConcurrencyProbe probe) {
        this.dimensions = dimensions;
        this.probe = probe;
    }

    /** Every decode sleeps this long. */
    public FakeDecoder withDecodeDelay(long millis) {
        this.decodeDelayMillis = millis;
        return this;
    }

    /** Decodes block until the returned latch is released. */
    public CountDownLatch gateDecodes() {
        var latch = new CountDownLatch(1);
        this.gate = latch;
        return latch;
    }

    /** Loads block until the returned latch is released. */
    public CountDownLatch gateLoads() {
        var latch = new CountDownLatch(1);
        this.loadGate = latch;
        return latch;
    }

    /** The next {@code count} decodes throw. */
    public FakeDecoder failNextDecodes(int count) {
        failuresToInject.set(count);
        return this;
    }

    /** The next decode throws {@code error} instead of returning. */
    public FakeDecoder failNextDecodeWith(Error error) {
        errorToInject.set(error);
        return this;
    }

    @Override
    public DecoderHandle load(Path source) {
        return load(new byte[]{1}, source.getFileName().toString());
    }

    @Override
    public DecoderHandle load(byte[] data, String name) {
        loadsStarted.incrementAndGet();
        await(loadGate, "load");
        if (name.contains("corrupt")) {
            throw new LoadException("Corrupt source " + name);
        }
        loads.incrementAndGet();
        return new FakeHandle(SourceMetadata.of(name, SOURCE_BYTES, dimensions, "fake"));
    }

    @Override
    public DecodedImage decode(DecoderHandle handle, OutputParams params) {
        decodes.incrementAndGet();
        decodesInFlight.incrementAndGet();
        lastParams.set(params);
        probe.enter();
        try {
            await(gate, "decode");
            pause(decodeDelayMillis);
            if (handle.source().contains("broken")) {
                throw new DecodeException("Cannot decode " + handle.source());
            }
            if (handle.source().contains("oversized")) {
                throw new OutOfMemoryError("raster too large for " + handle.source());
            }
            Error injected = errorToInject.getAndSet(null);
            if (injected != null) {
                throw injected;
            }
            if (failuresToInject.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
                throw new DecodeException("Injected decode failure for " + handle.source());
            }
            return new DecodedImage(new BufferedImage(60, 40, BufferedImage.TYPE_INT_RGB), dimensions);
        } finally {
            probe.exit();
            decodesInFlight.decrementAndGet();
        }
    }

    @Override
    public Optional<DecodedImage> extractPreview(DecoderHandle handle) {
        previews.incrementAndGet();
        if (handle.source().contains("nopreview")) {
            return Optional.empty();
        }
        var raster = new BufferedImage(PREVIEW_DIMENSIONS.width(), PREVIEW_DIMENSIONS.height(), BufferedImage.TYPE_INT_RGB);
        return Optional.of(new DecodedImage(raster, PREVIEW_DIMENSIONS));
    }

    @Override
    public void release(DecoderHandle handle) {
        if (decodesInFlight.get() > 0) {
            releasedDuringDecode.set(true);
        }
        releases.incrementAndGet();
    }

    public int loadsStarted() { return loadsStarted.get(); }
    public int loadCount() { return loads.get(); }
    public int decodeCount() { return decodes.get(); }
    public int releaseCount() { return releases.get(); }
    public int previewCount() { return previews.get(); }
    public boolean releasedDuringDecode() { return releasedDuringDecode.get(); }
    public OutputParams lastParams() { return lastParams.get(); }
    public ConcurrencyProbe probe() { return probe; }

    private static void await(CountDownLatch latch, String operation) {
        if (latch == null) {
            return;
        }
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new DecodeException(operation + " gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecodeException("Interrupted at " + operation + " gate", e);
        }
    }

    static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", e);
        }
    }

    private record FakeHandle(SourceMetadata metadata) implements DecoderHandle {}
}
