package com.lucsartech.raw.pipeline;

import com.lucsartech.raw.conversion.ConversionResult;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe live progress of a batch run.
 * Uses LongAdder for high-throughput counters and atomic operations for state.
 */
public final class BatchProgress {

    // Processing counters
    private final LongAdder started = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();

    // Size tracking
    private final LongAdder originalBytes = new LongAdder();
    private final LongAdder compressedBytes = new LongAdder();

    // Concurrency instrumentation
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();

    private volatile int total;
    private volatile Instant startTime;
    private volatile Instant endTime;

    // Recent activity log (circular buffer)
    private static final int MAX_RECENT_ACTIVITY = 50;
    private final LinkedList<ActivityEntry> recentActivity = new LinkedList<>();
    private final ReentrantLock activityLock = new ReentrantLock();

    /**
     * Record for tracking recent activity.
     */
    public record ActivityEntry(Path input, String status, long originalSize, long compressedSize, long timeMs) {
        public static ActivityEntry converted(Path input, ConversionResult.Success result) {
            return new ActivityEntry(input, "CONVERTED", result.originalSize(), result.compressedSize(),
                    result.processingTimeMs());
        }
        public static ActivityEntry failed(Path input) {
            return new ActivityEntry(input, "FAILED", 0, 0, 0);
        }
    }

    // ========== Recording Methods ==========

    void markStarted(int totalInputs) {
        total = totalInputs;
        startTime = Instant.now();
    }

    void markCompleted() {
        endTime = Instant.now();
    }

    void recordStart() {
        started.increment();
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);
    }

    void recordSuccess(Path input, ConversionResult.Success result) {
        succeeded.increment();
        originalBytes.add(result.originalSize());
        compressedBytes.add(result.compressedSize());
        addActivity(ActivityEntry.converted(input, result));
    }

    void recordFailure(Path input) {
        failed.increment();
        addActivity(ActivityEntry.failed(input));
    }

    void recordEnd() {
        active.decrementAndGet();
    }

    private void addActivity(ActivityEntry entry) {
        activityLock.lock();
        try {
            recentActivity.addFirst(entry);
            while (recentActivity.size() > MAX_RECENT_ACTIVITY) {
                recentActivity.removeLast();
            }
        } finally {
            activityLock.unlock();
        }
    }

    public List<ActivityEntry> recentActivity() {
        activityLock.lock();
        try {
            return List.copyOf(recentActivity);
        } finally {
            activityLock.unlock();
        }
    }

    // ========== Computed Metrics ==========

    public Duration elapsedTime() {
        if (startTime == null) return Duration.ZERO;
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end);
    }

    public double progressPercent() {
        int t = total;
        return t > 0 ? (double) (succeeded.sum() + failed.sum()) / t * 100.0 : 0.0;
    }

    public double mbPerSecond() {
        double seconds = elapsedTime().toMillis() / 1000.0;
        double origMb = originalBytes.sum() / 1024.0 / 1024.0;
        return seconds > 0 ? origMb / seconds : 0.0;
    }

    // ========== Getters ==========

    public int activeCount() { return active.get(); }
    public int peakActive() { return peakActive.get(); }
    public boolean isCompleted() { return endTime != null; }

    /**
     * Create a snapshot of current metrics.
     */
    public Snapshot snapshot() {
        return new Snapshot(
                total,
                started.sum(),
                succeeded.sum(),
                failed.sum(),
                active.get(),
                peakActive.get(),
                originalBytes.sum(),
                compressedBytes.sum(),
                progressPercent(),
                elapsedTime().toMillis(),
                mbPerSecond(),
                isCompleted()
        );
    }

    /**
     * Immutable snapshot of progress metrics.
     */
    public record Snapshot(
            int total,
            long started,
            long succeeded,
            long failed,
            int active,
            int peakActive,
            long originalBytes,
            long compressedBytes,
            double progressPercent,
            long elapsedMs,
            double mbPerSecond,
            boolean completed
    ) {}
}
