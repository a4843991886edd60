package com.lucsartech.raw;

import com.lucsartech.raw.config.ConverterProperties;
import com.lucsartech.raw.decode.CameraCatalog;
import com.lucsartech.raw.pipeline.BatchProgress;
import com.lucsartech.raw.pipeline.BatchResult;
import com.lucsartech.raw.pipeline.BatchScheduler;
import com.lucsartech.raw.pipeline.PreviewExtractor;
import com.lucsartech.raw.pipeline.PreviewReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.nio.file.Path;
import java.util.concurrent.TimeoutException;

/**
 * RAW Converter - Spring Boot Application.
 *
 * <p>Runs one batch at startup when {@code converter.batch.inputs} is set, e.g.
 * <pre>
 * java -jar raw-converter.jar --converter.batch.inputs=a.dng,b.nef --converter.batch.format=webp
 * </pre>
 * and extracts embedded previews when {@code converter.preview.inputs} is set.
 * Otherwise the context just starts and exposes the conversion beans.
 */
@SpringBootApplication
@EnableConfigurationProperties(ConverterProperties.class)
public class RawConverterApplication implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RawConverterApplication.class);

    private static final String BANNER = """

            ╔═══════════════════════════════════════════════════════════════╗
            ║                                                               ║
            ║              RAW Converter - decode once, encode many         ║
            ║                   Powered by Spring Boot                      ║
            ║                                                               ║
            ╚═══════════════════════════════════════════════════════════════╝
            """;

    private final ConverterProperties properties;
    private final BatchScheduler scheduler;
    private final PreviewExtractor previewExtractor;

    public RawConverterApplication(ConverterProperties properties, BatchScheduler scheduler,
                                   PreviewExtractor previewExtractor) {
        this.properties = properties;
        this.scheduler = scheduler;
        this.previewExtractor = previewExtractor;
    }

    public static void main(String[] args) {
        System.out.println(BANNER);
        SpringApplication.run(RawConverterApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        var batch = properties.getBatch();
        var preview = properties.getPreview();
        if (!batch.hasInputs() && !preview.hasInputs()) {
            log.info("No inputs configured (converter.batch.inputs, converter.preview.inputs), nothing to do");
            return;
        }

        log.info("Starting RAW Converter ({} supported camera models)", CameraCatalog.count());
        if (preview.hasInputs()) {
            printPreviewReport(previewExtractor.extractAll(preview.inputPaths(), Path.of(preview.getOutputDirectory())));
        }
        if (batch.hasInputs()) {
            runBatch();
        }
    }

    private void runBatch() throws TimeoutException {
        var batch = properties.getBatch();
        log.info("Format: {} | Concurrency: {} | Output: {} | Timeout: {}",
                batch.getFormat(),
                batch.getMaxConcurrency(),
                batch.getOutputDirectory(),
                batch.hasTimeout() ? batch.getTimeoutSeconds() + "s" : "none");

        var job = batch.toJob(properties.getDecode().toOutputParams());
        var progress = new BatchProgress();
        BatchResult result = batch.hasTimeout()
                ? scheduler.run(job, progress, batch.timeout())
                : scheduler.run(job, progress);

        printSummary(result, progress);
        log.info("RAW Converter completed: {}/{} converted", result.summary().processed(), result.summary().total());
    }

    private void printSummary(BatchResult result, BatchProgress progress) {
        var summary = result.summary();

        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════════");
        System.out.println("                      CONVERSION SUMMARY                        ");
        System.out.println("═══════════════════════════════════════════════════════════════");
        System.out.printf("  Format:           %s%n", properties.getBatch().getFormat());
        System.out.printf("  Duration:         %s%n", formatElapsed(summary.elapsed().toSeconds()));
        System.out.printf("  Files:            %,d of %,d converted%n", summary.processed(), summary.total());
        System.out.printf("  Errors:           %,d%n", summary.errors());
        System.out.println("───────────────────────────────────────────────────────────────");
        System.out.printf("  Original:         %.2f MB%n", summary.originalMb());
        System.out.printf("  Converted:        %.2f MB%n", summary.compressedMb());
        System.out.printf("  Avg Ratio:        %.2fx%n", summary.averageCompressionRatio());
        System.out.println("───────────────────────────────────────────────────────────────");
        System.out.printf("  Avg Time/File:    %d ms%n", summary.averageProcessingTimePerFile());
        if (progress.isCompleted()) {
            System.out.printf("  Throughput:       %.2f MB/sec | peak %d workers%n",
                    progress.mbPerSecond(), progress.peakActive());
        }
        System.out.println("═══════════════════════════════════════════════════════════════");

        if (result.hasFailures()) {
            System.out.println();
            System.out.println("  Failed inputs:");
            result.failed().forEach(f -> System.out.printf("    %s: %s%n", f.input(), f.error()));
        }

        System.out.println();
    }

    private void printPreviewReport(PreviewReport report) {
        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════════");
        System.out.println("                   PREVIEW EXTRACTION REPORT                    ");
        System.out.println("═══════════════════════════════════════════════════════════════");
        System.out.printf("  Inputs:           %,d%n", report.total());
        System.out.printf("  Extracted:        %,d (%.1f%%)%n", report.extracted().size(), report.successPercent());
        System.out.printf("  Skipped:          %,d%n", report.skipped().size());
        System.out.printf("  Failed:           %,d%n", report.failed().size());
        System.out.println("═══════════════════════════════════════════════════════════════");
        report.failed().forEach(f -> System.out.printf("    %s: %s%n", f.input(), f.error()));
        System.out.println();
    }

    private String formatElapsed(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        return h > 0
                ? String.format("%d:%02d:%02d", h, m, s)
                : String.format("%d:%02d", m, s);
    }
}
