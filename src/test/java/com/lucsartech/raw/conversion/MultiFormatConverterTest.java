package com.lucsartech.raw.conversion;

import com.lucsartech.raw.encode.OutputFormat;
import com.lucsartech.raw.error.DecodeException;
import com.lucsartech.raw.error.EncodeException;
import com.lucsartech.raw.session.ConversionSession;
import com.lucsartech.raw.support.FakeDecoder;
import com.lucsartech.raw.support.FakeEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MultiFormatConverter")
class MultiFormatConverterTest {

    private FakeDecoder decoder;
    private FakeEncoder encoder;
    private MultiFormatConverter converter;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        decoder = new FakeDecoder();
        encoder = new FakeEncoder();
        converter = new MultiFormatConverter(new FormatAdapter(encoder));
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private ConversionSession loadedSession(String name) {
        var session = new ConversionSession(decoder, executor);
        session.load(Path.of(name));
        return session;
    }

    @Test
    @DisplayName("returns one result per request in request order from a single decode")
    void fanOut() {
        var requests = List.of(
                ConversionRequest.builder(OutputFormat.JPEG).quality(90).build(),
                ConversionRequest.builder(OutputFormat.PNG).compressionLevel(9).build(),
                ConversionRequest.builder(OutputFormat.WEBP).lossless(true).build(),
                ConversionRequest.builder(OutputFormat.JPEG).maxEdge(300).build()
        );

        try (var session = loadedSession("IMG_0042.NEF")) {
            var results = converter.convertAll(session, requests);

            assertThat(results).hasSize(4).allMatch(ConversionResult::isSuccess);
            assertThat(results).extracting(ConversionResult::format)
                    .containsExactly(OutputFormat.JPEG, OutputFormat.PNG, OutputFormat.WEBP, OutputFormat.JPEG);
            assertThat(results.get(3).asSuccess().orElseThrow().outputDimensions().longestEdge()).isEqualTo(300);
            assertThat(decoder.decodeCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("concurrent requests wait for one shared decode")
    void sharedInFlightDecode() {
        decoder.withDecodeDelay(100);
        var requests = List.of(
                ConversionRequest.of(OutputFormat.JPEG),
                ConversionRequest.of(OutputFormat.PNG),
                ConversionRequest.of(OutputFormat.TIFF),
                ConversionRequest.of(OutputFormat.WEBP),
                ConversionRequest.of(OutputFormat.AVIF)
        );

        try (var session = loadedSession("IMG_0043.ARW")) {
            var results = converter.convertAll(session, requests);

            assertThat(results).allMatch(ConversionResult::isSuccess);
            assertThat(decoder.decodeCount()).isEqualTo(1);
            assertThat(session.isProcessed()).isTrue();
        }
    }

    @Test
    @DisplayName("isolates a failing format in its own slot")
    void partialFailure() {
        encoder.unavailable(OutputFormat.AVIF);
        var requests = List.of(
                ConversionRequest.of(OutputFormat.JPEG),
                ConversionRequest.of(OutputFormat.AVIF),
                ConversionRequest.of(OutputFormat.PNG)
        );

        try (var session = loadedSession("IMG_0044.DNG")) {
            var results = converter.convertAll(session, requests);

            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(2).isSuccess()).isTrue();

            var failure = results.get(1).asFailure().orElseThrow();
            assertThat(failure.format()).isEqualTo(OutputFormat.AVIF);
            assertThat(failure.cause()).containsInstanceOf(EncodeException.class);
            assertThat(failure.errorMessage()).contains("AVIF");
        }
    }

    @Test
    @DisplayName("reports a decode failure in every slot")
    void decodeFailure() {
        var requests = List.of(ConversionRequest.of(OutputFormat.JPEG), ConversionRequest.of(OutputFormat.PNG));

        try (var session = loadedSession("broken.cr3")) {
            var results = converter.convertAll(session, requests);

            assertThat(results).hasSize(2).allMatch(ConversionResult::isFailure);
            assertThat(results.get(0).asFailure().orElseThrow().cause()).containsInstanceOf(DecodeException.class);
        }
    }

    @Test
    @DisplayName("returns an empty list for no requests")
    void noRequests() {
        try (var session = loadedSession("IMG_0045.RAF")) {
            assertThat(converter.convertAll(session, List.of())).isEmpty();
            assertThat(decoder.decodeCount()).isZero();
        }
    }
}
