package com.github.stormino.videoconverter.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Utility class for formatting sizes, ETAs and percentages for display.
 */
@UtilityClass
public class FormatUtils {

    private static final String[] BINARY_UNITS = {"B", "KB", "MB", "GB"};

    /**
     * Format bytes with 1024-based units.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.5 GB", "256.0 MB", or "0 B"
     */
    public static String formatBinarySize(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }

        double size = bytes;
        for (String unit : BINARY_UNITS) {
            if (Math.abs(size) < 1024.0) {
                return String.format(Locale.ROOT, "%.1f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.1f TB", size);
    }

    /**
     * Format an ETA in seconds.
     *
     * @param seconds Remaining seconds, possibly infinite
     * @return "calculating..." while unknown, otherwise "1h 30m", "5m 30s" or "12s"
     */
    public static String formatEta(double seconds) {
        if (Double.isInfinite(seconds) || Double.isNaN(seconds)) {
            return "calculating...";
        }
        if (seconds <= 0) {
            return "0s";
        }

        long totalSeconds = (long) seconds;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long secs = totalSeconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }

    /**
     * Format percentage with specified decimal places.
     *
     * @param percentage Percentage value (0-100)
     * @param decimalPlaces Number of decimal places (0-2)
     * @return Formatted percentage string like "45.67%"
     */
    public static String formatPercentage(double percentage, int decimalPlaces) {
        if (decimalPlaces < 0 || decimalPlaces > 2) {
            decimalPlaces = 1;
        }
        String format = String.format("%%.%df%%%%", decimalPlaces);
        return String.format(Locale.ROOT, format, percentage);
    }

    /**
     * Format percentage with 1 decimal place.
     *
     * @param percentage Percentage value (0-100)
     * @return Formatted percentage string like "45.6%"
     */
    public static String formatPercentage(double percentage) {
        return formatPercentage(percentage, 1);
    }

    /**
     * Keep only the last {@code maxChars} characters of a diagnostic text.
     *
     * @param text Text to shorten, may be null
     * @param maxChars Maximum characters to keep
     * @return Trimmed tail, empty for null input
     */
    public static String tail(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (maxChars <= 0) {
            return "";
        }
        if (trimmed.length() <= maxChars) {
            return trimmed;
        }
        return trimmed.substring(trimmed.length() - maxChars);
    }
}
