package com.lucsartech.raw.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a preview extraction run. Every input is counted once: extracted, skipped
 * (not a RAW source, or no embedded preview) or failed.
 */
public record PreviewReport(
        int total,
        List<Path> extracted,
        List<Path> skipped,
        List<BatchResult.Failed> failed
) {

    public PreviewReport {
        extracted = List.copyOf(extracted);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public double successPercent() {
        return total > 0 ? extracted.size() * 100.0 / total : 0.0;
    }
}
