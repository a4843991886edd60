package com.lucsartech.raw.pipeline;

import com.lucsartech.raw.conversion.ConversionResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Full accounting of a batch: every input appears exactly once, in either list.
 * List order follows completion order, not input order, when more than one worker ran.
 */
public record BatchResult(
        List<Converted> successful,
        List<Failed> failed,
        BatchSummary summary
) {

    public BatchResult {
        successful = List.copyOf(successful);
        failed = List.copyOf(failed);
    }

    public record Converted(Path input, Path output, ConversionResult.Success result) {}

    public record Failed(Path input, String error, Optional<Throwable> cause) {

        public static Failed of(Path input, Throwable cause) {
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return new Failed(input, message, Optional.of(cause));
        }
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
