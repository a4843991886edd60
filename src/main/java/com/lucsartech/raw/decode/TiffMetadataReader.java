package com.lucsartech.raw.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.ExifParentTIFFTagSet;
import javax.imageio.plugins.tiff.ExifTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Reads camera, exposure and lens tags from TIFF-structured sources. Most RAW families
 * (CR2, NEF, ARW, DNG, PEF) are TIFF containers, so the JDK TIFF reader sees their IFD0
 * and EXIF sub-directory.
 */
final class TiffMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(TiffMetadataReader.class);

    static final String NATIVE_FORMAT = "javax_imageio_tiff_image_1.0";

    // EXIF 2.3 tags the JDK tag sets do not name
    static final int TAG_LENS_SPECIFICATION = 42034;
    static final int TAG_LENS_MAKE = 42035;
    static final int TAG_LENS_MODEL = 42036;

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private TiffMetadataReader() {}

    /**
     * Header metadata for {@code reader}'s first image; tags are filled in when the
     * source is TIFF-structured and left unknown otherwise.
     */
    static SourceMetadata describe(String name, long sizeBytes, ImageDimensions dimensions, ImageReader reader)
            throws IOException {
        var plain = SourceMetadata.of(name, sizeBytes, dimensions, reader.getFormatName());
        IIOMetadata imageMetadata = reader.getImageMetadata(0);
        if (imageMetadata == null || !NATIVE_FORMAT.equals(imageMetadata.getNativeMetadataFormatName())) {
            return plain;
        }
        return describe(plain, TIFFDirectory.createFromMetadata(imageMetadata));
    }

    static SourceMetadata describe(SourceMetadata plain, TIFFDirectory root) {
        TIFFDirectory exif = exifDirectory(root).orElse(root);
        return new SourceMetadata(
                plain.source(),
                plain.sizeBytes(),
                plain.dimensions(),
                plain.formatName(),
                ascii(root, BaselineTIFFTagSet.TAG_MAKE),
                ascii(root, BaselineTIFFTagSet.TAG_MODEL),
                capture(root, exif),
                lens(exif)
        );
    }

    static CaptureInfo capture(TIFFDirectory root, TIFFDirectory exif) {
        Optional<LocalDateTime> capturedAt = ascii(exif, ExifTIFFTagSet.TAG_DATE_TIME_ORIGINAL)
                .or(() -> ascii(root, BaselineTIFFTagSet.TAG_DATE_TIME))
                .flatMap(TiffMetadataReader::parseDate);
        return new CaptureInfo(
                integer(exif, ExifTIFFTagSet.TAG_ISO_SPEED_RATINGS),
                number(exif, ExifTIFFTagSet.TAG_EXPOSURE_TIME, 0),
                number(exif, ExifTIFFTagSet.TAG_F_NUMBER, 0),
                number(exif, ExifTIFFTagSet.TAG_FOCAL_LENGTH, 0),
                capturedAt
        );
    }

    static LensInfo lens(TIFFDirectory exif) {
        return new LensInfo(
                ascii(exif, TAG_LENS_MAKE),
                ascii(exif, TAG_LENS_MODEL),
                number(exif, TAG_LENS_SPECIFICATION, 0),
                number(exif, TAG_LENS_SPECIFICATION, 1),
                integer(exif, ExifTIFFTagSet.TAG_FOCAL_LENGTH_IN_35MM_FILM)
        );
    }

    private static Optional<TIFFDirectory> exifDirectory(TIFFDirectory root) {
        TIFFField pointer = root.getTIFFField(ExifParentTIFFTagSet.TAG_EXIF_IFD_POINTER);
        if (pointer == null || !pointer.hasDirectory()) {
            return Optional.empty();
        }
        return Optional.of(pointer.getDirectory());
    }

    private static Optional<String> ascii(TIFFDirectory dir, int tag) {
        TIFFField field = dir.getTIFFField(tag);
        if (field == null || field.getType() != TIFFTag.TIFF_ASCII || field.getCount() == 0) {
            return Optional.empty();
        }
        String value = field.getAsString(0).replace("\0", "").strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static OptionalInt integer(TIFFDirectory dir, int tag) {
        TIFFField field = dir.getTIFFField(tag);
        if (field == null || field.getCount() == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(field.getAsInt(0));
    }

    private static OptionalDouble number(TIFFDirectory dir, int tag, int index) {
        TIFFField field = dir.getTIFFField(tag);
        if (field == null || field.getCount() <= index) {
            return OptionalDouble.empty();
        }
        double value = field.getAsDouble(index);
        return Double.isFinite(value) && value > 0 ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static Optional<LocalDateTime> parseDate(String value) {
        try {
            return Optional.of(LocalDateTime.parse(value, EXIF_DATE));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable capture date '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }
}
