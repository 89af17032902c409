package com.github.stormino.videoconverter.config;

import com.github.stormino.videoconverter.util.ConversionConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "converter")
public class ConverterProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Resources resources = new Resources();

    @Data
    public static class Scheduler {
        @Min(1)
        private int maxConcurrent = ConversionConstants.DEFAULT_MAX_CONCURRENT;

        // take the resource monitor's recommendation into account at batch start
        private boolean adaptiveConcurrency = false;

        private boolean resourceMonitoring = true;

        @Min(1)
        private int threadPoolSize = 4;
    }

    @Data
    public static class Executor {
        @Min(0)
        private long minCallbackIntervalMs = ConversionConstants.DEFAULT_MIN_CALLBACK_INTERVAL_MS;

        @Min(1)
        private int diagnosticTailChars = ConversionConstants.DIAGNOSTIC_TAIL_CHARS;

        @NotBlank
        private String ffmpegPath = ConversionConstants.FFMPEG_BINARY;

        public Duration getMinCallbackInterval() {
            return Duration.ofMillis(minCallbackIntervalMs);
        }
    }

    @Data
    public static class Resources {
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double cpuHighThreshold = ConversionConstants.CPU_HIGH_THRESHOLD;

        @DecimalMin("0.0") @DecimalMax("100.0")
        private double cpuCriticalThreshold = ConversionConstants.CPU_CRITICAL_THRESHOLD;

        @DecimalMin("0.0") @DecimalMax("100.0")
        private double memoryHighThreshold = ConversionConstants.MEMORY_HIGH_THRESHOLD;

        @DecimalMin("0.0") @DecimalMax("100.0")
        private double memoryCriticalThreshold = ConversionConstants.MEMORY_CRITICAL_THRESHOLD;

        @Min(0)
        @Max(ConversionConstants.MAX_SAMPLE_WINDOW_MS)
        private long sampleWindowMs = ConversionConstants.DEFAULT_SAMPLE_WINDOW_MS;

        @Min(1)
        private int maxBaseConcurrency = ConversionConstants.MAX_BASE_CONCURRENCY;

        @Min(1)
        private int fallbackConcurrency = ConversionConstants.FALLBACK_CONCURRENCY;
    }
}
