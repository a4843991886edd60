package com.lucsartech.raw.pipeline;

import com.lucsartech.raw.conversion.ConversionRequest;
import com.lucsartech.raw.conversion.FormatAdapter;
import com.lucsartech.raw.decode.RawDecoder;
import com.lucsartech.raw.decode.SourceFormats;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.BatchSetupException;
import com.lucsartech.raw.error.EncodeException;
import com.lucsartech.raw.session.ConversionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Saves the preview each camera embedded in its RAW files as {@code <name>_thumb.jpg},
 * one source after another on the calling thread. No full decode ever runs.
 */
public final class PreviewExtractor {

    private static final Logger log = LoggerFactory.getLogger(PreviewExtractor.class);

    private static final Executor SAME_THREAD = Runnable::run;
    static final String SUFFIX = "_thumb";

    private final RawDecoder decoder;
    private final FormatAdapter formatAdapter;

    public PreviewExtractor(RawDecoder decoder, FormatAdapter formatAdapter) {
        this.decoder = Objects.requireNonNull(decoder, "Decoder is required");
        this.formatAdapter = Objects.requireNonNull(formatAdapter, "Format adapter is required");
    }

    /**
     * @throws BatchSetupException if the output directory cannot be prepared
     */
    public PreviewReport extractAll(List<Path> inputs, Path outputDirectory) {
        Objects.requireNonNull(inputs, "Inputs are required");
        Objects.requireNonNull(outputDirectory, "Output directory is required");
        BatchScheduler.prepareOutputDirectory(outputDirectory);

        var request = ConversionRequest.builder(OutputFormat.JPEG)
                .quality(FormatAdapter.DEFAULT_THUMBNAIL_QUALITY)
                .build();
        var outputs = BatchScheduler.assignOutputs(inputs, outputDirectory, SUFFIX, OutputFormat.JPEG.extension());

        List<Path> extracted = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        List<BatchResult.Failed> failed = new ArrayList<>();

        for (int i = 0; i < inputs.size(); i++) {
            Path input = inputs.get(i);
            Path target = outputs.get(i);
            String name = input.getFileName() != null ? input.getFileName().toString() : input.toString();
            if (!SourceFormats.isRaw(name)) {
                log.debug("Skipping {}: not a RAW source", input);
                skipped.add(input);
                continue;
            }

            try (var session = new ConversionSession(decoder, SAME_THREAD)) {
                session.load(input);
                var preview = formatAdapter.convertPreview(session, request);
                if (preview.isEmpty()) {
                    log.warn("No embedded preview in {}", input);
                    skipped.add(input);
                    continue;
                }
                write(target, preview.get().data());
                log.info("Extracted {} ({}, {} bytes)", target.getFileName(),
                        preview.get().outputDimensions(), preview.get().compressedSize());
                extracted.add(target);
            } catch (RuntimeException | Error e) {
                log.warn("Failed to extract preview from {}: {}", input, e.getMessage());
                failed.add(BatchResult.Failed.of(input, e));
            }
        }

        log.info("Preview extraction: {} extracted, {} skipped, {} failed of {}",
                extracted.size(), skipped.size(), failed.size(), inputs.size());
        return new PreviewReport(inputs.size(), extracted, skipped, failed);
    }

    private static void write(Path target, byte[] data) {
        try {
            Files.write(target, data);
        } catch (IOException e) {
            throw new EncodeException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }
}
