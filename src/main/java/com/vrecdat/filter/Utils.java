package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for file naming and configuration lookups.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Sanitizes a filename by collapsing each run of characters other than word characters, dots and hyphens into
     * one underscore, then trimming underscores at both ends.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        if (name == null) return "";
        String sanitized = name.replaceAll("[^\\w.-]+", "_");
        return sanitized.replaceAll("^_+|_+$", "");
    }

    /**
     * Derives a report file base name from a source URL: path segments other than {@code wiki}, joined with
     * underscores and sanitized. Falls back to {@code url_<n>}.
     * @param url Source URL
     * @param sourceNumber 1-based source position
     * @return File base name without extension
     */
    public static String reportBaseName(String url, int sourceNumber) {
        String fallback = "url_" + sourceNumber;
        String path;
        try {
            path = URI.create(url).getRawPath();
        } catch (IllegalArgumentException | NullPointerException e) {
            logger.debug("Could not parse URL '{}' for report naming: {}", url, e.getMessage());
            return fallback;
        }
        if (path == null) return fallback;
        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty() && !part.toLowerCase(Locale.ROOT).equals("wiki")) parts.add(part);
        }
        if (parts.isEmpty()) return fallback;
        String sanitized = sanitizeFilename(String.join("_", parts));
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    /**
     * Default output path: {@code <input base>_filtered<input extension>} next to the input ({@code .dat} when the
     * input has no extension).
     * @param input Input DAT path
     * @return Output DAT path
     */
    public static Path defaultOutputPath(Path input) {
        Path absolute = input.toAbsolutePath();
        String fileName = absolute.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : ".dat";
        return absolute.resolveSibling(base + "_filtered" + extension);
    }

    /**
     * Reads a setting from the environment, then from system properties.
     * @param key Variable / property name
     * @param defaultVal Value when neither is set
     * @return Configured value
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    /**
     * Reads an integer setting via {@link #envOrProp(String, String)}, logging and ignoring malformed values.
     */
    public static int envOrPropInt(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}.", raw, key, defaultVal);
            return defaultVal;
        }
    }
}
