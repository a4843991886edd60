package com.lucsartech.raw.decode;

import com.lucsartech.raw.error.InvalidOptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("OutputParams")
class OutputParamsTest {

    @Test
    @DisplayName("defaults to BT.709 gamma, camera white balance and 8-bit sRGB")
    void defaults() {
        var params = OutputParams.defaults();

        assertThat(params.gamma()).isEqualTo(OutputParams.Gamma.BT709);
        assertThat(params.brightness()).isEqualTo(1.0);
        assertThat(params.autoBrightness()).isTrue();
        assertThat(params.whiteBalance()).isEmpty();
        assertThat(params.colorSpace()).isEqualTo(OutputColorSpace.SRGB);
        assertThat(params.bitsPerSample()).isEqualTo(8);
        assertThat(params.isDefault()).isTrue();
        assertThat(OutputParams.builder().build()).isEqualTo(params);
    }

    @Test
    @DisplayName("toBuilder keeps every value")
    void toBuilder() {
        var params = OutputParams.builder()
                .gamma(0.5, 3.0)
                .brightness(2.0)
                .autoBrightness(false)
                .whiteBalance(2.1, 1.0, 1.5, 1.0)
                .colorSpace(OutputColorSpace.PROPHOTO)
                .bitsPerSample(16)
                .highlightMode(2)
                .build();

        assertThat(params.toBuilder().build()).isEqualTo(params);
        assertThat(params.isDefault()).isFalse();
    }

    @Test
    @DisplayName("white balance gains are relative to green")
    void whiteBalanceGains() {
        var wb = new OutputParams.WhiteBalance(2.0, 1.6, 1.2, 1.6);

        assertThat(wb.redGain()).isCloseTo(1.25, within(1e-9));
        assertThat(wb.blueGain()).isCloseTo(0.75, within(1e-9));
    }

    @ParameterizedTest(name = "brightness {0}")
    @ValueSource(doubles = {0.1, 0.24, 8.01, 10.0, Double.NaN})
    @DisplayName("rejects brightness outside 0.25-8")
    void brightnessRange(double brightness) {
        assertThatThrownBy(() -> OutputParams.builder().brightness(brightness).build())
                .isInstanceOf(InvalidOptionException.class)
                .hasMessageContaining("brightness");
    }

    @Test
    @DisplayName("rejects unsupported bit depths, highlight modes and multipliers")
    void otherRanges() {
        assertThatThrownBy(() -> OutputParams.builder().bitsPerSample(12).build())
                .isInstanceOf(InvalidOptionException.class);
        assertThatThrownBy(() -> OutputParams.builder().highlightMode(10).build())
                .isInstanceOf(InvalidOptionException.class);
        assertThatThrownBy(() -> new OutputParams.WhiteBalance(1.0, 0.0, 1.0, 1.0))
                .isInstanceOf(InvalidOptionException.class);
        assertThatThrownBy(() -> new OutputParams.Gamma(-1, 4.5))
                .isInstanceOf(InvalidOptionException.class);
    }

    @Test
    @DisplayName("colour spaces have readable labels")
    void colorSpaceLabels() {
        assertThat(OutputColorSpace.ADOBE_RGB.label()).isEqualTo("adobe-rgb");
        assertThat(OutputColorSpace.SRGB.label()).isEqualTo("srgb");
    }
}
