package com.lucsartech.raw.session;

import com.lucsartech.raw.decode.RawDecoder;
import com.lucsartech.raw.error.ConversionException;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Creates sessions bound to the shared decoder and worker pool.
 */
public final class SessionFactory {

    private final RawDecoder decoder;
    private final Executor executor;

    public SessionFactory(RawDecoder decoder, Executor executor) {
        this.decoder = Objects.requireNonNull(decoder, "Decoder is required");
        this.executor = Objects.requireNonNull(executor, "Executor is required");
    }

    public ConversionSession open() {
        return new ConversionSession(decoder, executor);
    }

    /**
     * Open a session and load the source into it. The session is closed again if loading fails.
     */
    public ConversionSession open(Path source) {
        var session = open();
        try {
            session.load(source);
            return session;
        } catch (ConversionException e) {
            session.close();
            throw e;
        }
    }

    public RawDecoder decoder() {
        return decoder;
    }
}
