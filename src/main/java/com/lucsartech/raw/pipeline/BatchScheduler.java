package com.lucsartech.raw.pipeline;

import com.lucsartech.raw.conversion.FormatAdapter;
import com.lucsartech.raw.decode.RawDecoder;
import com.lucsartech.raw.error.BatchSetupException;
import com.lucsartech.raw.error.ConversionException;
import com.lucsartech.raw.session.ConversionSession;
import com.lucsartech.raw.session.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts many sources with a bounded worker pool.
 *
 * Architecture:
 * <pre>
 * BlockingQueue&lt;BatchTask&gt; (inputs + one poison pill per worker)
 *     ↓
 * Worker Pool (min(concurrencyLimit, inputs) threads)
 *     each: load → process → convert → write → close, on its own thread
 *     ↓
 * Converted / Failed lists → BatchSummary
 * </pre>
 *
 * <p>Every session runs its decode and encode on the worker's own thread, so the number of
 * active decoder/encoder calls never exceeds the concurrency limit. Per-input failures,
 * errors such as {@link OutOfMemoryError} included, are recorded and never stop the other
 * inputs; only a setup fault fails the batch itself.
 */
public final class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private static final Executor SAME_THREAD = Runnable::run;
    private static final AtomicInteger RUNS = new AtomicInteger();

    private final RawDecoder decoder;
    private final FormatAdapter formatAdapter;

    public BatchScheduler(RawDecoder decoder, FormatAdapter formatAdapter) {
        this.decoder = Objects.requireNonNull(decoder, "Decoder is required");
        this.formatAdapter = Objects.requireNonNull(formatAdapter, "Format adapter is required");
    }

    /**
     * Run the batch to completion.
     *
     * @throws BatchSetupException if the output directory cannot be prepared
     */
    public BatchResult run(BatchJob job) {
        return run(job, new BatchProgress());
    }

    public BatchResult run(BatchJob job, BatchProgress progress) {
        return Futures.await(runAsync(job, progress));
    }

    /**
     * Run the batch against a deadline. On timeout no further inputs are started;
     * sessions already in progress still finish and close on their worker threads.
     *
     * @throws TimeoutException if the batch did not finish in time
     */
    public BatchResult run(BatchJob job, Duration timeout) throws TimeoutException {
        return run(job, new BatchProgress(), timeout);
    }

    public BatchResult run(BatchJob job, BatchProgress progress, Duration timeout) throws TimeoutException {
        Objects.requireNonNull(timeout, "Timeout is required");
        var execution = start(job, progress);
        try {
            return execution.result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Batch {} timed out after {}, abandoning remaining inputs", execution.runId, timeout);
            execution.cancel();
            throw e;
        } catch (InterruptedException e) {
            execution.cancel();
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted while waiting for batch " + execution.runId, e);
        } catch (ExecutionException e) {
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new ConversionException("Batch " + execution.runId + " failed: " + cause.getMessage(), cause);
        }
    }

    public CompletableFuture<BatchResult> runAsync(BatchJob job) {
        return runAsync(job, new BatchProgress());
    }

    public CompletableFuture<BatchResult> runAsync(BatchJob job, BatchProgress progress) {
        try {
            return start(job, progress).result;
        } catch (BatchSetupException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Execution start(BatchJob job, BatchProgress progress) {
        Objects.requireNonNull(job, "Batch job is required");
        Objects.requireNonNull(progress, "Progress is required");
        prepareOutputDirectory(job.outputDirectory());

        var execution = new Execution(RUNS.incrementAndGet(), job, progress);
        execution.launch();
        return execution;
    }

    static void prepareOutputDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Failed to create output directory: {}", directory, e);
            throw new BatchSetupException("Cannot create output directory " + directory, e);
        }
    }

    /**
     * Output files are named after the source; clashing base names get a numeric suffix.
     */
    static List<Path> assignOutputs(List<Path> inputs, Path directory, String extension) {
        return assignOutputs(inputs, directory, "", extension);
    }

    static List<Path> assignOutputs(List<Path> inputs, Path directory, String suffix, String extension) {
        Set<String> used = new HashSet<>();
        List<Path> outputs = new ArrayList<>(inputs.size());
        for (Path input : inputs) {
            String base = baseName(input) + suffix;
            String candidate = base;
            for (int n = 2; !used.add(candidate.toLowerCase(Locale.ROOT)); n++) {
                candidate = base + "_" + n;
            }
            outputs.add(directory.resolve(candidate + "." + extension));
        }
        return outputs;
    }

    private static String baseName(Path input) {
        Path fileName = input.getFileName();
        String name = fileName != null ? fileName.toString() : "output";
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * State of one batch run.
     */
    private final class Execution {

        private final int runId;
        private final BatchJob job;
        private final BatchProgress progress;
        private final BlockingQueue<BatchTask> taskQueue = new LinkedBlockingQueue<>();
        private final ConcurrentLinkedQueue<BatchResult.Converted> successful = new ConcurrentLinkedQueue<>();
        private final ConcurrentLinkedQueue<BatchResult.Failed> failed = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final int workerCount;
        private final ExecutorService executor;
        private CompletableFuture<BatchResult> result;

        private Execution(int runId, BatchJob job, BatchProgress progress) {
            this.runId = runId;
            this.job = job;
            this.progress = progress;
            this.workerCount = Math.max(1, Math.min(job.concurrencyLimit(), job.inputs().size()));
            this.executor = Executors.newFixedThreadPool(workerCount, workerThreadFactory(runId));
        }

        private void launch() {
            var inputs = job.inputs();
            var outputs = assignOutputs(inputs, job.outputDirectory(), job.options().format().extension());
            for (int i = 0; i < inputs.size(); i++) {
                taskQueue.add(new BatchTask.Input(i, inputs.get(i), outputs.get(i)));
            }
            // Poison pills to stop the workers once the queue drains
            for (int i = 0; i < workerCount; i++) {
                taskQueue.add(BatchTask.Poison.INSTANCE);
            }

            progress.markStarted(inputs.size());
            log.info("Batch {} started: {} inputs, {} workers, options: {}",
                    runId, inputs.size(), workerCount, job.options());

            var workers = new CompletableFuture<?>[workerCount];
            for (int i = 0; i < workerCount; i++) {
                workers[i] = CompletableFuture.runAsync(this::runWorker, executor);
            }

            result = CompletableFuture.allOf(workers)
                    .thenApply(ignored -> complete())
                    .whenComplete((r, e) -> shutdown());
        }

        private void runWorker() {
            String threadName = Thread.currentThread().getName();
            try {
                while (true) {
                    BatchTask task = taskQueue.take();

                    if (task.isPoison()) {
                        log.debug("[{}] Received poison pill, stopping", threadName);
                        break;
                    }
                    if (cancelled.get()) {
                        log.debug("[{}] Batch cancelled, stopping", threadName);
                        break;
                    }
                    if (task instanceof BatchTask.Input input) {
                        convert(input, threadName);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[{}] Worker interrupted", threadName);
            }
        }

        private void convert(BatchTask.Input input, String threadName) {
            progress.recordStart();
            try (var session = new ConversionSession(decoder, SAME_THREAD)) {
                log.trace("[{}] Converting #{} {}", threadName, input.index(), input.source());

                session.load(input.source());
                session.setOutputParams(job.outputParams());
                session.process();
                var converted = formatAdapter.convertToFile(session, job.options(), input.output());

                successful.add(new BatchResult.Converted(input.source(), input.output(), converted));
                progress.recordSuccess(input.source(), converted);
            } catch (RuntimeException | Error e) {
                // One oversized or unreadable input must not take the worker down with it
                log.warn("[{}] Failed to convert {}: {}", threadName, input.source(), e.toString());
                failed.add(BatchResult.Failed.of(input.source(), e));
                progress.recordFailure(input.source());
            } finally {
                progress.recordEnd();
            }
        }

        private BatchResult complete() {
            progress.markCompleted();
            var converted = List.copyOf(successful);
            var failures = List.copyOf(failed);
            var summary = BatchSummary.of(job.inputs().size(), converted, failures.size(), progress.elapsedTime());

            log.info("Batch {} completed in {}ms: {}/{} converted, {} failed, avg ratio {}x, peak workers {}",
                    runId, summary.elapsed().toMillis(), summary.processed(), summary.total(),
                    summary.errors(), summary.averageCompressionRatio(), progress.peakActive());
            return new BatchResult(converted, failures, summary);
        }

        private void cancel() {
            cancelled.set(true);
            shutdown();
        }

        private void shutdown() {
            executor.shutdown();
        }
    }

    private static ThreadFactory workerThreadFactory(int runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "batch-" + runId + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
