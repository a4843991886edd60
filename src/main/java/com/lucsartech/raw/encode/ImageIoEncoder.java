package com.lucsartech.raw.encode;

import com.lucsartech.raw.decode.DecodedImage;
import com.lucsartech.raw.decode.ImageDimensions;
import com.lucsartech.raw.error.EncodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Encoder backed by the ImageIO writers present on the running JVM.
 * Stock JDKs write JPEG, PNG and TIFF; WebP and AVIF need a writer plugin
 * on the classpath and fail with {@link EncodeException} otherwise.
 * Thread-safe: a fresh writer is obtained per call.
 */
public final class ImageIoEncoder implements ImageEncoder {

    private static final Logger log = LoggerFactory.getLogger(ImageIoEncoder.class);

    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";

    @Override
    public EncodedImage encode(DecodedImage image, EncodeSpec spec) {
        Objects.requireNonNull(image, "Decoded image is required");
        Objects.requireNonNull(spec, "Encode spec is required");

        try {
            return switch (spec.format()) {
                case JPEG -> encodeJpeg(image, spec);
                case PNG -> encodePng(image, spec);
                case TIFF -> encodeTiff(image, spec);
                case WEBP, AVIF -> encodeWithPlugin(image, spec);
            };
        } catch (IOException e) {
            throw new EncodeException("Failed to encode " + spec.format() + ": " + e.getMessage(), e);
        }
    }

    private EncodedImage encodeJpeg(DecodedImage image, EncodeSpec spec) throws IOException {
        BufferedImage prepared = prepare(image.raster(), spec.target(), BufferedImage.TYPE_INT_RGB);
        ImageWriter writer = writerFor(spec.format());
        try {
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(spec.quality() / 100f);
            if (spec.progressive()) {
                params.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
            }

            // the writer defaults to 4:2:0, anything else needs explicit sampling factors
            IIOMetadata metadata = spec.chromaSubsampling() == ChromaSubsampling.YUV420
                    ? null
                    : jpegSamplingMetadata(writer, prepared, params, spec.chromaSubsampling());

            return write(writer, prepared, params, metadata);
        } finally {
            writer.dispose();
        }
    }

    private IIOMetadata jpegSamplingMetadata(ImageWriter writer, BufferedImage image, ImageWriteParam params,
                                             ChromaSubsampling chroma) throws IOException {
        IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), params);
        var root = (IIOMetadataNode) metadata.getAsTree(JPEG_METADATA_FORMAT);
        var components = root.getElementsByTagName("componentSpec");

        for (int i = 0; i < components.getLength(); i++) {
            var component = (IIOMetadataNode) components.item(i);
            boolean luma = i == 0;
            component.setAttribute("HsamplingFactor", String.valueOf(luma ? chroma.horizontalFactor() : 1));
            component.setAttribute("VsamplingFactor", String.valueOf(luma ? chroma.verticalFactor() : 1));
        }

        metadata.setFromTree(JPEG_METADATA_FORMAT, root);
        return metadata;
    }

    private EncodedImage encodePng(DecodedImage image, EncodeSpec spec) throws IOException {
        BufferedImage prepared = prepare(image.raster(), spec.target(), layoutFor(image.raster()));
        ImageWriter writer = writerFor(spec.format());
        try {
            ImageWriteParam params = writer.getDefaultWriteParam();
            if (params.canWriteCompressed()) {
                // ImageIO expresses deflate effort inversely: 1.0 = fastest, 0.0 = smallest
                params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                params.setCompressionQuality(1f - spec.compressionLevel() / (float) OutputFormat.MAX_COMPRESSION_LEVEL);
            }
            if (spec.progressive() && params.canWriteProgressive()) {
                params.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
            }
            return write(writer, prepared, params, null);
        } finally {
            writer.dispose();
        }
    }

    private EncodedImage encodeTiff(DecodedImage image, EncodeSpec spec) throws IOException {
        int layout = spec.lossless() ? layoutFor(image.raster()) : BufferedImage.TYPE_3BYTE_BGR;
        BufferedImage prepared = prepare(image.raster(), spec.target(), layout);
        ImageWriter writer = writerFor(spec.format());
        try {
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            if (spec.lossless()) {
                params.setCompressionType("Deflate");
            } else {
                params.setCompressionType("JPEG");
                params.setCompressionQuality(spec.quality() / 100f);
            }
            return write(writer, prepared, params, null);
        } finally {
            writer.dispose();
        }
    }

    private EncodedImage encodeWithPlugin(DecodedImage image, EncodeSpec spec) throws IOException {
        ImageWriter writer = writerFor(spec.format());
        try {
            BufferedImage prepared = prepare(image.raster(), spec.target(), layoutFor(image.raster()));
            ImageWriteParam params = writer.getDefaultWriteParam();
            if (params.canWriteCompressed()) {
                params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                String[] types = params.getCompressionTypes();
                if (types != null && types.length > 0) {
                    params.setCompressionType(pickCompressionType(types, spec.lossless()));
                }
                params.setCompressionQuality(spec.quality() / 100f);
            }
            log.trace("{} writer {} has no effort control, effort={} ignored",
                    spec.format(), writer.getClass().getSimpleName(), spec.effort());
            return write(writer, prepared, params, null);
        } finally {
            writer.dispose();
        }
    }

    private String pickCompressionType(String[] types, boolean lossless) {
        for (String type : types) {
            if (type.toLowerCase(Locale.ROOT).contains("lossless") == lossless) {
                return type;
            }
        }
        return types[0];
    }

    private EncodedImage write(ImageWriter writer, BufferedImage image, ImageWriteParam params,
                               IIOMetadata metadata) throws IOException {
        try (var outputStream = new ByteArrayOutputStream();
             var imageOutputStream = new MemoryCacheImageOutputStream(outputStream)) {

            writer.setOutput(imageOutputStream);
            writer.write(null, new IIOImage(image, null, metadata), params);
            imageOutputStream.flush();

            return new EncodedImage(outputStream.toByteArray(),
                    new ImageDimensions(image.getWidth(), image.getHeight()));
        }
    }

    private ImageWriter writerFor(OutputFormat format) {
        var writers = ImageIO.getImageWritersByFormatName(format.formatName());
        if (!writers.hasNext()) {
            throw new EncodeException("No " + format + " encoder available on this platform");
        }
        return writers.next();
    }

    private static int layoutFor(BufferedImage raster) {
        return raster.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    /**
     * Return a raster of the target size and pixel layout, drawing into a new image when needed.
     * The source raster is never modified.
     */
    private BufferedImage prepare(BufferedImage original, ImageDimensions target, int imageType) {
        int newWidth = target.width();
        int newHeight = target.height();

        if (newWidth == original.getWidth() && newHeight == original.getHeight()
                && original.getType() == imageType) {
            return original;
        }

        BufferedImage scaled = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(original, 0, 0, newWidth, newHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }
}
