package com.lucsartech.raw.config;

import com.lucsartech.raw.decode.OutputColorSpace;
import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.InvalidOptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConverterProperties")
class ConverterPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Configuration
    @EnableConfigurationProperties(ConverterProperties.class)
    static class PropertiesConfig {

        @Bean
        @ConfigurationPropertiesBinding
        static OutputFormatConverter outputFormatConverter() {
            return new OutputFormatConverter();
        }
    }

    @Test
    @DisplayName("binds the batch section")
    void binds() {
        runner.withPropertyValues(
                "converter.batch.inputs=shoot/a.cr2,shoot/b.nef",
                "converter.batch.output-directory=out",
                "converter.batch.format=webp",
                "converter.batch.quality=70",
                "converter.batch.width=1600",
                "converter.batch.max-concurrency=2",
                "converter.batch.timeout-seconds=30"
        ).run(context -> {
            var batch = context.getBean(ConverterProperties.class).getBatch();

            assertThat(batch.getFormat()).isEqualTo(OutputFormat.WEBP);
            assertThat(batch.hasTimeout()).isTrue();
            assertThat(batch.timeout()).isEqualTo(Duration.ofSeconds(30));

            var job = batch.toJob();
            assertThat(job.inputs()).containsExactly(Path.of("shoot/a.cr2"), Path.of("shoot/b.nef"));
            assertThat(job.outputDirectory()).isEqualTo(Path.of("out"));
            assertThat(job.concurrencyLimit()).isEqualTo(2);
            assertThat(job.options().quality()).hasValue(70);
            assertThat(job.options().width()).hasValue(1600);
        });
    }

    @Test
    @DisplayName("rejects a concurrency limit below one at startup")
    void invalidConcurrency() {
        runner.withPropertyValues("converter.batch.max-concurrency=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("rejects quality outside 1..100 at startup")
    void invalidQuality() {
        runner.withPropertyValues("converter.batch.quality=150")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("uses the format default when no quality is configured")
    void defaultQuality() {
        var batch = new ConverterProperties().getBatch();
        batch.setFormat(OutputFormat.PNG);
        batch.setInputs(List.of("a.cr2"));

        var request = batch.toRequest();

        assertThat(request.quality()).isEmpty();
        assertThat(batch.hasTimeout()).isFalse();
    }

    @Test
    @DisplayName("rejects options the configured format does not accept")
    void incompatibleOptions() {
        var batch = new ConverterProperties().getBatch();
        batch.setFormat(OutputFormat.PNG);
        batch.setQuality(80);

        assertThatThrownBy(batch::toRequest).isInstanceOf(InvalidOptionException.class);
    }

    @Test
    @DisplayName("accepts format aliases")
    void formatAlias() {
        runner.withPropertyValues("converter.batch.format=JPG")
                .run(context -> assertThat(context.getBean(ConverterProperties.class).getBatch().getFormat())
                        .isEqualTo(OutputFormat.JPEG));
        runner.withPropertyValues("converter.batch.format=tif")
                .run(context -> assertThat(context.getBean(ConverterProperties.class).getBatch().getFormat())
                        .isEqualTo(OutputFormat.TIFF));
    }

    @Test
    @DisplayName("rejects an unknown format at startup")
    void unknownFormat() {
        runner.withPropertyValues("converter.batch.format=bmp")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("binds the decode section into output params")
    void bindsDecode() {
        runner.withPropertyValues(
                "converter.decode.brightness=1.5",
                "converter.decode.auto-brightness=false",
                "converter.decode.color-space=adobe-rgb",
                "converter.decode.highlight-mode=2",
                "converter.decode.white-balance=2.0,1.0,1.5,1.0"
        ).run(context -> {
            var params = context.getBean(ConverterProperties.class).getDecode().toOutputParams();

            assertThat(params.brightness()).isEqualTo(1.5);
            assertThat(params.autoBrightness()).isFalse();
            assertThat(params.colorSpace()).isEqualTo(OutputColorSpace.ADOBE_RGB);
            assertThat(params.highlightMode()).isEqualTo(2);
            assertThat(params.whiteBalance()).hasValueSatisfying(wb -> assertThat(wb.redGain()).isEqualTo(2.0));

            var job = context.getBean(ConverterProperties.class).getBatch().toJob(params);
            assertThat(job.outputParams()).isEqualTo(params);
        });
    }

    @Test
    @DisplayName("defaults the decode section to the decoder defaults")
    void defaultDecode() {
        assertThat(new ConverterProperties().getDecode().toOutputParams().isDefault()).isTrue();
        assertThat(new ConverterProperties().getBatch().toJob().outputParams().isDefault()).isTrue();
    }

    @Test
    @DisplayName("rejects brightness outside 0.25..8 at startup")
    void invalidBrightness() {
        runner.withPropertyValues("converter.decode.brightness=10")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("needs exactly four white balance multipliers")
    void whiteBalanceArity() {
        var decode = new ConverterProperties().getDecode();
        decode.setWhiteBalance(List.of(2.0, 1.0, 1.5));

        assertThatThrownBy(decode::toOutputParams)
                .isInstanceOf(InvalidOptionException.class)
                .hasMessageContaining("4 multipliers");
    }

    @Test
    @DisplayName("binds the preview section")
    void bindsPreview() {
        runner.withPropertyValues(
                "converter.preview.inputs=shoot/a.cr2,shoot/b.nef",
                "converter.preview.output-directory=thumbs"
        ).run(context -> {
            var preview = context.getBean(ConverterProperties.class).getPreview();

            assertThat(preview.hasInputs()).isTrue();
            assertThat(preview.inputPaths()).containsExactly(Path.of("shoot/a.cr2"), Path.of("shoot/b.nef"));
            assertThat(preview.getOutputDirectory()).isEqualTo("thumbs");
        });
        assertThat(new ConverterProperties().getPreview().hasInputs()).isFalse();
    }
}
