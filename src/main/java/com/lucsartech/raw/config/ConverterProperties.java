package com.lucsartech.raw.config;

import com.lucsartech.raw.conversion.ConversionRequest;
import com.lucsartech.raw.decode.OutputColorSpace;
import com.lucsartech.raw.decode.OutputParams;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.InvalidOptionException;
import com.lucsartech.raw.pipeline.BatchJob;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the RAW converter.
 * Mapped from application.yml under the "converter" prefix.
 */
@ConfigurationProperties(prefix = "converter")
@Validated
public class ConverterProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final Decode decode = new Decode();
    @Valid
    private final Batch batch = new Batch();
    @Valid
    private final Preview preview = new Preview();

    public Engine getEngine() { return engine; }
    public Decode getDecode() { return decode; }
    public Batch getBatch() { return batch; }
    public Preview getPreview() { return preview; }

    /**
     * Shared decode/encode pool used by interactive sessions.
     */
    public static class Engine {
        @Min(1)
        private int workerThreads = Runtime.getRuntime().availableProcessors();

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Rendering parameters every batch decode uses.
     */
    public static class Decode {
        @DecimalMin("0.25") @DecimalMax("8.0")
        private double brightness = 1.0;
        private boolean autoBrightness = true;
        @NotNull
        private OutputColorSpace colorSpace = OutputColorSpace.SRGB;
        private int bitsPerSample = 8;
        @Min(0) @Max(9)
        private int highlightMode = 0;
        // R, G, B, G2 multipliers; empty = camera white balance
        private List<Double> whiteBalance = new ArrayList<>();

        public double getBrightness() { return brightness; }
        public void setBrightness(double brightness) { this.brightness = brightness; }

        public boolean isAutoBrightness() { return autoBrightness; }
        public void setAutoBrightness(boolean autoBrightness) { this.autoBrightness = autoBrightness; }

        public OutputColorSpace getColorSpace() { return colorSpace; }
        public void setColorSpace(OutputColorSpace colorSpace) { this.colorSpace = colorSpace; }

        public int getBitsPerSample() { return bitsPerSample; }
        public void setBitsPerSample(int bitsPerSample) { this.bitsPerSample = bitsPerSample; }

        public int getHighlightMode() { return highlightMode; }
        public void setHighlightMode(int highlightMode) { this.highlightMode = highlightMode; }

        public List<Double> getWhiteBalance() { return whiteBalance; }
        public void setWhiteBalance(List<Double> whiteBalance) { this.whiteBalance = whiteBalance; }

        /**
         * @throws InvalidOptionException for values the decoder rejects
         */
        public OutputParams toOutputParams() {
            var builder = OutputParams.builder()
                    .brightness(brightness)
                    .autoBrightness(autoBrightness)
                    .colorSpace(colorSpace)
                    .bitsPerSample(bitsPerSample)
                    .highlightMode(highlightMode);
            if (whiteBalance != null && !whiteBalance.isEmpty()) {
                if (whiteBalance.size() != 4) {
                    throw new InvalidOptionException(
                            "white-balance needs 4 multipliers (R, G, B, G2), got " + whiteBalance.size());
                }
                builder.whiteBalance(whiteBalance.get(0), whiteBalance.get(1), whiteBalance.get(2), whiteBalance.get(3));
            }
            return builder.build();
        }
    }

    /**
     * Embedded-preview extraction executed at startup when inputs are configured.
     */
    public static class Preview {
        private List<String> inputs = new ArrayList<>();
        @NotBlank
        private String outputDirectory = "thumbnails";

        public List<String> getInputs() { return inputs; }
        public void setInputs(List<String> inputs) { this.inputs = inputs; }

        public String getOutputDirectory() { return outputDirectory; }
        public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

        public boolean hasInputs() {
            return inputs != null && !inputs.isEmpty();
        }

        public List<Path> inputPaths() {
            return inputs.stream().map(Path::of).toList();
        }
    }

    /**
     * Batch run executed at startup when inputs are configured.
     */
    public static class Batch {
        private List<String> inputs = new ArrayList<>();
        @NotBlank
        private String outputDirectory = "converted";
        @NotNull
        private OutputFormat format = OutputFormat.JPEG;
        // null = format default
        @Min(1) @Max(100)
        private Integer quality;
        @Positive
        private Integer width;
        @Positive
        private Integer height;
        @Min(1)
        private int maxConcurrency = BatchJob.DEFAULT_CONCURRENCY;
        @Min(0)
        private long timeoutSeconds = 0; // 0 = no limit

        public List<String> getInputs() { return inputs; }
        public void setInputs(List<String> inputs) { this.inputs = inputs; }

        public String getOutputDirectory() { return outputDirectory; }
        public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

        public OutputFormat getFormat() { return format; }
        public void setFormat(OutputFormat format) { this.format = format; }

        public Integer getQuality() { return quality; }
        public void setQuality(Integer quality) { this.quality = quality; }

        public Integer getWidth() { return width; }
        public void setWidth(Integer width) { this.width = width; }

        public Integer getHeight() { return height; }
        public void setHeight(Integer height) { this.height = height; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public boolean hasInputs() {
            return inputs != null && !inputs.isEmpty();
        }

        public boolean hasTimeout() {
            return timeoutSeconds > 0;
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }

        /**
         * Build the shared request; throws {@code InvalidOptionException} for combinations
         * the format rejects.
         */
        public ConversionRequest toRequest() {
            return ConversionRequest.builder(format)
                    .quality(quality)
                    .width(width)
                    .height(height)
                    .build();
        }

        public BatchJob toJob(OutputParams outputParams) {
            List<Path> paths = inputs.stream().map(Path::of).toList();
            return new BatchJob(paths, Path.of(outputDirectory), toRequest(), maxConcurrency, outputParams);
        }

        public BatchJob toJob() {
            return toJob(OutputParams.defaults());
        }
    }
}
