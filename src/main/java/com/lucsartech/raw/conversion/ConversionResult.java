package com.lucsartech.raw.conversion;

import com.lucsartech.raw.decode.ImageDimensions;
import com.lucsartech.raw.encode.OutputFormat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Result of a single conversion.
 * Sealed interface for type-safe success/failure handling.
 */
public sealed interface ConversionResult {

    OutputFormat format();

    record Success(
            OutputFormat format,
            byte[] data,
            ImageDimensions originalDimensions,
            ImageDimensions outputDimensions,
            long originalSize,
            long compressedSize,
            Duration processingTime,
            boolean fromCache,
            Optional<Path> output
    ) implements ConversionResult {

        public Success {
            if (compressedSize <= 0) {
                throw new IllegalArgumentException("Successful conversion must produce bytes");
            }
        }

        /**
         * Original size divided by output size, rounded to two decimals.
         */
        public double compressionRatio() {
            return Math.round((double) originalSize / compressedSize * 100.0) / 100.0;
        }

        public long savedBytes() {
            return originalSize - compressedSize;
        }

        public long processingTimeMs() {
            return processingTime.toMillis();
        }

        public double throughputMBps() {
            double seconds = Math.max(processingTime.toNanos(), 1L) / 1_000_000_000.0;
            return originalSize / 1024.0 / 1024.0 / seconds;
        }

        public Success withOutput(Path path) {
            return new Success(format, data, originalDimensions, outputDimensions, originalSize,
                    compressedSize, processingTime, fromCache, Optional.of(path));
        }
    }

    record Failure(
            OutputFormat format,
            String errorMessage,
            Optional<Throwable> cause
    ) implements ConversionResult {

        public static Failure of(OutputFormat format, Throwable cause) {
            return new Failure(format, cause.getMessage(), Optional.of(cause));
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default Optional<Success> asSuccess() {
        return this instanceof Success s ? Optional.of(s) : Optional.empty();
    }

    default Optional<Failure> asFailure() {
        return this instanceof Failure f ? Optional.of(f) : Optional.empty();
    }
}
