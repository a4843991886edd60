package com.lucsartech.raw.decode;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-wide table of source formats the converter recognises.
 * Built once at class initialisation and never modified.
 */
public final class SourceFormats {

    /**
     * One known source type.
     */
    public record SourceFormat(String extension, String description, boolean raw) {}

    private static final Map<String, SourceFormat> FORMATS = build();

    private SourceFormats() {}

    private static Map<String, SourceFormat> build() {
        var table = new TreeMap<String, SourceFormat>();
        raw(table, "cr2", "Canon RAW 2");
        raw(table, "cr3", "Canon RAW 3");
        raw(table, "nef", "Nikon Electronic Format");
        raw(table, "arw", "Sony Alpha RAW");
        raw(table, "dng", "Adobe Digital Negative");
        raw(table, "raf", "Fujifilm RAW");
        raw(table, "rw2", "Panasonic RAW 2");
        raw(table, "pef", "Pentax Electronic File");
        raw(table, "orf", "Olympus RAW Format");
        developed(table, "jpg", "JPEG");
        developed(table, "jpeg", "JPEG");
        developed(table, "png", "Portable Network Graphics");
        developed(table, "tif", "Tagged Image File Format");
        developed(table, "tiff", "Tagged Image File Format");
        developed(table, "bmp", "Windows Bitmap");
        developed(table, "gif", "Graphics Interchange Format");
        return Map.copyOf(table);
    }

    private static void raw(Map<String, SourceFormat> table, String ext, String description) {
        table.put(ext, new SourceFormat(ext, description, true));
    }

    private static void developed(Map<String, SourceFormat> table, String ext, String description) {
        table.put(ext, new SourceFormat(ext, description, false));
    }

    public static boolean isKnown(String filename) {
        return lookup(filename).isPresent();
    }

    public static boolean isRaw(String filename) {
        return lookup(filename).map(SourceFormat::raw).orElse(false);
    }

    public static Optional<SourceFormat> lookup(String filename) {
        return extensionOf(filename).map(FORMATS::get);
    }

    public static String describe(String filename) {
        return lookup(filename).map(SourceFormat::description).orElse("unknown");
    }

    public static Set<String> extensions() {
        return FORMATS.keySet();
    }

    static Optional<String> extensionOf(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
