package com.lucsartech.raw.support;

import com.lucsartech.raw.decode.DecodedImage;
import com.lucsartech.raw.encode.EncodeOption;
import com.lucsartech.raw.encode.EncodeSpec;
import com.lucsartech.raw.encode.EncodedImage;
import com.lucsartech.raw.encode.ImageEncoder;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.EncodeException;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Encoder that writes {@code quality * 1000} zero bytes at the requested target size.
 * Formats marked unavailable fail like a platform without a writer.
 */
public final class FakeEncoder implements ImageEncoder {

    private final ConcurrencyProbe probe;
    private final Set<OutputFormat> unavailable = EnumSet.noneOf(OutputFormat.class);
    private final ConcurrentLinkedQueue<EncodeSpec> specs = new ConcurrentLinkedQueue<>();
    private volatile long encodeDelayMillis;

    public FakeEncoder() {
        this(new ConcurrencyProbe());
    }

    public FakeEncoder(ConcurrencyProbe probe) {
        this.probe = probe;
    }

    public FakeEncoder unavailable(OutputFormat format) {
        unavailable.add(format);
        return this;
    }

    public FakeEncoder withEncodeDelay(long millis) {
        this.encodeDelayMillis = millis;
        return this;
    }

    @Override
    public EncodedImage encode(DecodedImage image, EncodeSpec spec) {
        probe.enter();
        try {
            FakeDecoder.pause(encodeDelayMillis);
            if (unavailable.contains(spec.format())) {
                throw new EncodeException("No " + spec.format() + " encoder available on this platform");
            }
            specs.add(spec);
            return new EncodedImage(new byte[sizeFor(spec)], spec.target());
        } finally {
            probe.exit();
        }
    }

    /** Output size in bytes; formats without a quality setting count as 50. */
    public static int sizeFor(EncodeSpec spec) {
        int quality = spec.format().supports(EncodeOption.QUALITY) ? spec.quality() : 50;
        return quality * 1000;
    }

    public List<EncodeSpec> specs() {
        return List.copyOf(specs);
    }
}
