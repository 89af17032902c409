package com.github.stormino.videoconverter.util;

/**
 * Constants used throughout the conversion system.
 */
public final class ConversionConstants {

    private ConversionConstants() {
        // Utility class, no instantiation
    }

    // ========== Progress Tracking ==========

    /**
     * Default minimum interval between progress callbacks in milliseconds.
     */
    public static final long DEFAULT_MIN_CALLBACK_INTERVAL_MS = 100;

    /**
     * Number of trailing encoder output characters kept as failure diagnostics.
     */
    public static final int DIAGNOSTIC_TAIL_CHARS = 500;

    // ========== Scheduling ==========

    /**
     * Default number of jobs running at once.
     */
    public static final int DEFAULT_MAX_CONCURRENT = 2;

    /**
     * Upper bound for the CPU-derived base concurrency.
     */
    public static final int MAX_BASE_CONCURRENCY = 4;

    /**
     * Concurrency recommended when resource sampling is unavailable.
     */
    public static final int FALLBACK_CONCURRENCY = 2;

    // ========== Resource Levels ==========

    /**
     * Utilization below this percentage is classified LOW.
     */
    public static final double LOW_LEVEL_THRESHOLD = 30.0;

    public static final double CPU_HIGH_THRESHOLD = 80.0;
    public static final double CPU_CRITICAL_THRESHOLD = 95.0;
    public static final double MEMORY_HIGH_THRESHOLD = 75.0;
    public static final double MEMORY_CRITICAL_THRESHOLD = 90.0;

    /**
     * Default CPU sampling window in milliseconds.
     */
    public static final long DEFAULT_SAMPLE_WINDOW_MS = 100;

    /**
     * Longest allowed CPU sampling window in milliseconds.
     */
    public static final long MAX_SAMPLE_WINDOW_MS = 150;

    // ========== FFmpeg ==========

    public static final String FFMPEG_BINARY = "ffmpeg";

    public static final String FFMPEG_LOG_LEVEL = "info";

    public static final String CANCELLED_MESSAGE = "Conversion cancelled";
}
