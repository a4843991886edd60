package com.lucsartech.raw.decode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CameraCatalog")
class CameraCatalogTest {

    @Test
    @DisplayName("lists the bundled models without comments")
    void listsCameras() {
        assertThat(CameraCatalog.count()).isEqualTo(CameraCatalog.cameras().size()).isGreaterThan(50);
        assertThat(CameraCatalog.cameras()).contains("Canon EOS R5", "Nikon Z 9", "Sony ILCE-7M4");
        assertThat(CameraCatalog.cameras()).noneMatch(c -> c.startsWith("#") || c.isBlank());
    }

    @Test
    @DisplayName("the list cannot be modified")
    void immutable() {
        assertThatThrownBy(() -> CameraCatalog.cameras().add("Acme One"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("matches models ignoring case and extra spaces")
    void isSupported() {
        assertThat(CameraCatalog.isSupported("canon eos r5")).isTrue();
        assertThat(CameraCatalog.isSupported("  Nikon   Z 9 ")).isTrue();
        assertThat(CameraCatalog.isSupported("Acme Pocket 3000")).isFalse();
        assertThat(CameraCatalog.isSupported((String) null)).isFalse();
    }

    @Test
    @DisplayName("matches metadata whose model repeats the make")
    void supportedMetadata() {
        var plain = SourceMetadata.of("IMG_0001.CR3", 1, new ImageDimensions(10, 10), "tif");
        var canon = new SourceMetadata(plain.source(), 1, plain.dimensions(), "tif",
                Optional.of("Canon"), Optional.of("Canon EOS R5"), CaptureInfo.unknown(), LensInfo.unknown());
        var sony = new SourceMetadata(plain.source(), 1, plain.dimensions(), "tif",
                Optional.of("SONY"), Optional.of("ILCE-7M4"), CaptureInfo.unknown(), LensInfo.unknown());

        assertThat(canon.camera()).contains("Canon EOS R5");
        assertThat(CameraCatalog.isSupported(canon)).isTrue();
        assertThat(sony.camera()).contains("SONY ILCE-7M4");
        assertThat(CameraCatalog.isSupported(sony)).isTrue();
        assertThat(CameraCatalog.isSupported(plain)).isFalse();
    }

    @Test
    @DisplayName("lists the models of one maker")
    void byMake() {
        assertThat(CameraCatalog.byMake("CANON")).isNotEmpty().allMatch(c -> c.startsWith("Canon "));
        assertThat(CameraCatalog.byMake("Sony")).contains("Sony ILCE-1").doesNotContain("Canon EOS R5");
        assertThat(CameraCatalog.byMake("Acme")).isEmpty();
        assertThat(CameraCatalog.byMake(" ")).isEmpty();
    }
}
