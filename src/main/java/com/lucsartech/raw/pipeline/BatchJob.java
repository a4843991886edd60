package com.lucsartech.raw.pipeline;

import com.lucsartech.raw.conversion.ConversionRequest;
import com.lucsartech.raw.decode.OutputParams;
import com.lucsartech.raw.error.InvalidOptionException;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Sources to convert with one shared request, at most {@code concurrencyLimit} at a time.
 * A limit of 1 processes the inputs sequentially in order. Every source is decoded with
 * the same {@code outputParams}.
 */
public record BatchJob(
        List<Path> inputs,
        Path outputDirectory,
        ConversionRequest options,
        int concurrencyLimit,
        OutputParams outputParams
) {

    /** Used when no limit is given. */
    public static final int DEFAULT_CONCURRENCY = 4;

    public BatchJob {
        Objects.requireNonNull(inputs, "Inputs are required");
        Objects.requireNonNull(outputDirectory, "Output directory is required");
        Objects.requireNonNull(options, "Conversion options are required");
        Objects.requireNonNull(outputParams, "Output params are required");
        if (concurrencyLimit < 1) {
            throw new InvalidOptionException("maxConcurrency must be at least 1, got " + concurrencyLimit);
        }
        inputs = List.copyOf(inputs);
    }

    public BatchJob(List<Path> inputs, Path outputDirectory, ConversionRequest options, int concurrencyLimit) {
        this(inputs, outputDirectory, options, concurrencyLimit, OutputParams.defaults());
    }
}
