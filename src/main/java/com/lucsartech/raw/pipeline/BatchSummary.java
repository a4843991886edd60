package com.lucsartech.raw.pipeline;

import java.time.Duration;
import java.util.Collection;

/**
 * Aggregate statistics of a batch, reduced over the successful conversions only.
 * Independent of completion order.
 */
public record BatchSummary(
        int total,
        int processed,
        int errors,
        long totalProcessingTimeMs,
        double averageCompressionRatio,
        long totalOriginalBytes,
        long totalCompressedBytes,
        long averageProcessingTimePerFile,
        Duration elapsed
) {

    public static BatchSummary of(int total, Collection<BatchResult.Converted> successes, int errors, Duration elapsed) {
        long timeMs = 0;
        long original = 0;
        long compressed = 0;
        double ratioSum = 0;

        for (var converted : successes) {
            var result = converted.result();
            timeMs += result.processingTimeMs();
            original += result.originalSize();
            compressed += result.compressedSize();
            ratioSum += result.compressionRatio();
        }

        int processed = successes.size();
        double averageRatio = processed > 0 ? Math.round(ratioSum / processed * 100.0) / 100.0 : 0.0;
        long averageTime = processed > 0 ? timeMs / processed : 0;

        return new BatchSummary(total, processed, errors, timeMs, averageRatio,
                original, compressed, averageTime, elapsed);
    }

    public long savedBytes() {
        return totalOriginalBytes - totalCompressedBytes;
    }

    public double successPercent() {
        return total > 0 ? processed * 100.0 / total : 0.0;
    }

    public double originalMb() { return totalOriginalBytes / 1024.0 / 1024.0; }
    public double compressedMb() { return totalCompressedBytes / 1024.0 / 1024.0; }
}
