package com.lucsartech.raw.decode;

import com.lucsartech.raw.error.DecodeException;
import com.lucsartech.raw.error.LoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoder backed by the ImageIO readers present on the running JVM.
 * Handles developed sources (JPEG, PNG, TIFF and friends) and any RAW family for
 * which a reader plugin is registered; everything else is rejected at load time.
 * Thread-safe: each handle carries its own bytes.
 */
public final class ImageIoDecoder implements RawDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageIoDecoder.class);

    @Override
    public DecoderHandle load(Path source) {
        Objects.requireNonNull(source, "Source path is required");
        String name = source.getFileName() != null ? source.getFileName().toString() : source.toString();

        if (!SourceFormats.isKnown(name)) {
            throw new LoadException("Unsupported source type: " + name);
        }
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new LoadException("Source is not a readable file: " + source);
        }

        byte[] data;
        try {
            data = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new LoadException("Failed to read source " + source + ": " + e.getMessage(), e);
        }
        return open(data, name);
    }

    @Override
    public DecoderHandle load(byte[] data, String name) {
        if (data == null || data.length == 0) {
            throw new LoadException("Source buffer is empty: " + name);
        }
        return open(data, name);
    }

    private Handle open(byte[] data, String name) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            var readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new LoadException("Unsupported or corrupt source: " + name);
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, false);
                var dimensions = new ImageDimensions(reader.getWidth(0), reader.getHeight(0));
                var metadata = describe(name, data.length, dimensions, reader);
                log.debug("Loaded {} ({}, {} bytes, {}, camera {}, {})", name, metadata.formatName(), data.length,
                        dimensions, metadata.camera().orElse("unknown"), metadata.shootingSummary());
                if (SourceFormats.isRaw(name) && metadata.camera().isPresent() && !CameraCatalog.isSupported(metadata)) {
                    log.info("{} comes from {}, which is not in the camera catalog ({} models listed for {})",
                            name, metadata.camera().get(), CameraCatalog.byMake(metadata.make().orElse("")).size(),
                            metadata.make().orElse("its maker"));
                }
                return new Handle(metadata, data);
            } finally {
                reader.dispose();
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new LoadException("Corrupt source " + name + ": " + e.getMessage(), e);
        }
    }

    private SourceMetadata describe(String name, long size, ImageDimensions dimensions, ImageReader reader) throws IOException {
        try {
            return TiffMetadataReader.describe(name, size, dimensions, reader);
        } catch (IOException | RuntimeException e) {
            log.debug("No tag metadata for {}: {}", name, e.getMessage());
            return SourceMetadata.of(name, size, dimensions, reader.getFormatName());
        }
    }

    /**
     * Sources read through ImageIO are already rendered, so only brightness and white
     * balance gains are applied; gamma, auto brightness and highlight mode act on linear
     * sensor data and have no effect here. Output is always 8-bit sRGB.
     */
    @Override
    public DecodedImage decode(DecoderHandle handle, OutputParams params) {
        Handle h = asHandle(handle);
        Objects.requireNonNull(params, "Output params are required");
        if (params.colorSpace() != OutputColorSpace.SRGB || params.bitsPerSample() != 8) {
            throw new DecodeException("ImageIO decoder renders 8-bit sRGB only, requested "
                    + params.bitsPerSample() + "-bit " + params.colorSpace().label() + " for " + h.source());
        }
        byte[] data = h.data;
        if (data == null) {
            throw new DecodeException("Handle for " + h.source() + " has been released");
        }

        try {
            BufferedImage raster = ImageIO.read(new ByteArrayInputStream(data));
            if (raster == null) {
                throw new DecodeException("No decoder produced a raster for " + h.source());
            }
            raster = applyGains(raster, params);
            return new DecodedImage(raster, new ImageDimensions(raster.getWidth(), raster.getHeight()));
        } catch (DecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Decode failed for " + h.source() + ": " + e.getMessage(), e);
        }
    }

    static BufferedImage applyGains(BufferedImage source, OutputParams params) {
        double brightness = params.brightness();
        double red = brightness * params.whiteBalance().map(OutputParams.WhiteBalance::redGain).orElse(1.0);
        double blue = brightness * params.whiteBalance().map(OutputParams.WhiteBalance::blueGain).orElse(1.0);
        if (red == 1.0 && brightness == 1.0 && blue == 1.0) {
            return source;
        }

        int w = source.getWidth();
        int h = source.getHeight();
        int[] pixels = source.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            pixels[i] = (p & 0xFF000000)
                    | scale((p >> 16) & 0xFF, red) << 16
                    | scale((p >> 8) & 0xFF, brightness) << 8
                    | scale(p & 0xFF, blue);
        }
        var result = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        result.setRGB(0, 0, w, h, pixels, 0, w);
        return result;
    }

    private static int scale(int channel, double gain) {
        return (int) Math.min(255, Math.round(channel * gain));
    }

    /**
     * The first thumbnail the ImageIO reader exposes (JFIF/EXIF thumbnails in JPEG sources).
     */
    @Override
    public Optional<DecodedImage> extractPreview(DecoderHandle handle) {
        Handle h = asHandle(handle);
        byte[] data = h.data;
        if (data == null) {
            throw new DecodeException("Handle for " + h.source() + " has been released");
        }

        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            var readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, false);
                if (!reader.readerSupportsThumbnails() || reader.getNumThumbnails(0) == 0) {
                    log.debug("{} carries no embedded preview", h.source());
                    return Optional.empty();
                }
                BufferedImage preview = reader.readThumbnail(0, 0);
                return Optional.of(new DecodedImage(preview, new ImageDimensions(preview.getWidth(), preview.getHeight())));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Failed to read embedded preview of " + h.source() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void release(DecoderHandle handle) {
        asHandle(handle).data = null;
    }

    private Handle asHandle(DecoderHandle handle) {
        if (handle instanceof Handle h) {
            return h;
        }
        throw new IllegalArgumentException("Handle was not issued by this decoder: " + handle);
    }

    private static final class Handle implements DecoderHandle {

        private final SourceMetadata metadata;
        private volatile byte[] data;

        private Handle(SourceMetadata metadata, byte[] data) {
            this.metadata = metadata;
            this.data = data;
        }

        @Override
        public SourceMetadata metadata() {
            return metadata;
        }

        @Override
        public String toString() {
            return "Handle[" + metadata.source() + "]";
        }
    }
}
