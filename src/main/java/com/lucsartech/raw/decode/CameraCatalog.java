package com.lucsartech.raw.decode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide list of camera models whose RAW files are supported, one
 * {@code "Make Model"} entry per line in {@code camera-list.txt}.
 * Loaded once on first use and never modified.
 */
public final class CameraCatalog {

    static final String RESOURCE = "/camera-list.txt";

    private CameraCatalog() {}

    private static final class Holder {
        private static final List<String> CAMERAS = load();
        private static final Set<String> LOOKUP = normalised(CAMERAS);
    }

    public static List<String> cameras() {
        return Holder.CAMERAS;
    }

    public static int count() {
        return Holder.CAMERAS.size();
    }

    public static boolean isSupported(String camera) {
        return camera != null && Holder.LOOKUP.contains(normalise(camera));
    }

    public static boolean isSupported(SourceMetadata metadata) {
        return metadata.camera().map(CameraCatalog::isSupported).orElse(false);
    }

    /**
     * Models of one manufacturer, case-insensitive on the make.
     */
    public static List<String> byMake(String make) {
        if (make == null || make.isBlank()) {
            return List.of();
        }
        String prefix = normalise(make) + " ";
        return Holder.CAMERAS.stream()
                .filter(camera -> normalise(camera).startsWith(prefix))
                .toList();
    }

    private static List<String> load() {
        try (InputStream in = CameraCatalog.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Camera list resource missing: " + RESOURCE);
            }
            var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            List<String> cameras = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                String entry = line.strip();
                if (!entry.isEmpty() && !entry.startsWith("#")) {
                    cameras.add(entry);
                }
            }
            return List.copyOf(cameras);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    private static Set<String> normalised(List<String> cameras) {
        var set = new TreeSet<String>();
        cameras.forEach(camera -> set.add(normalise(camera)));
        return Set.copyOf(set);
    }

    private static String normalise(String camera) {
        return camera.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
