package com.github.stormino.videoconverter.service.resource;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.model.ResourceLevel;
import com.github.stormino.videoconverter.model.ResourceStatus;
import com.github.stormino.videoconverter.util.ConversionConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Classifies CPU and memory utilization and recommends how many conversions
 * to run at once. Never throws: when sampling fails it reports a NORMAL
 * fallback status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourceMonitor {

    private final ResourceSampler sampler;
    private final ConverterProperties properties;

    /**
     * Sample current utilization.
     *
     * @return Fresh status, or the fallback status if sampling is unavailable or fails
     */
    public ResourceStatus getStatus() {
        ConverterProperties.Resources config = properties.getResources();

        if (!sampler.isAvailable()) {
            return ResourceStatus.fallback(config.getFallbackConcurrency());
        }

        try {
            long windowMs = Math.min(config.getSampleWindowMs(), ConversionConstants.MAX_SAMPLE_WINDOW_MS);
            double cpuPercent = sampler.sampleCpuPercent(Duration.ofMillis(windowMs));
            double memoryPercent = sampler.sampleMemoryPercent();

            ResourceLevel cpuLevel = categorize(cpuPercent,
                    config.getCpuHighThreshold(), config.getCpuCriticalThreshold());
            ResourceLevel memoryLevel = categorize(memoryPercent,
                    config.getMemoryHighThreshold(), config.getMemoryCriticalThreshold());

            int recommended = recommendConcurrency(cpuLevel, memoryLevel, baseConcurrency());

            log.debug("Resource status: cpu={}% ({}), memory={}% ({}), recommended concurrency={}",
                    String.format("%.1f", cpuPercent), cpuLevel,
                    String.format("%.1f", memoryPercent), memoryLevel, recommended);

            return ResourceStatus.builder()
                    .cpuPercent(cpuPercent)
                    .memoryPercent(memoryPercent)
                    .cpuLevel(cpuLevel)
                    .memoryLevel(memoryLevel)
                    .recommendedConcurrency(recommended)
                    .sampled(true)
                    .build();
        } catch (RuntimeException e) {
            log.debug("Error getting resource status: {}", e.getMessage());
            return ResourceStatus.fallback(config.getFallbackConcurrency());
        }
    }

    /**
     * Categorize a utilization percentage.
     *
     * @param value Utilization percentage
     * @param highThreshold Lowest value classified HIGH
     * @param criticalThreshold Lowest value classified CRITICAL
     * @return Matching level
     */
    public static ResourceLevel categorize(double value, double highThreshold, double criticalThreshold) {
        if (value >= criticalThreshold) {
            return ResourceLevel.CRITICAL;
        }
        if (value >= highThreshold) {
            return ResourceLevel.HIGH;
        }
        if (value < ConversionConstants.LOW_LEVEL_THRESHOLD) {
            return ResourceLevel.LOW;
        }
        return ResourceLevel.NORMAL;
    }

    /**
     * Recommend a concurrency level for the given resource levels.
     *
     * @param cpuLevel CPU level
     * @param memoryLevel Memory level
     * @param baseConcurrency Concurrency when neither resource is under pressure
     * @return 1 if either level is CRITICAL, half the base if either is HIGH, otherwise the base
     */
    public static int recommendConcurrency(@NonNull ResourceLevel cpuLevel, @NonNull ResourceLevel memoryLevel,
                                           int baseConcurrency) {
        if (cpuLevel == ResourceLevel.CRITICAL || memoryLevel == ResourceLevel.CRITICAL) {
            return 1;
        }
        if (cpuLevel == ResourceLevel.HIGH || memoryLevel == ResourceLevel.HIGH) {
            return Math.max(1, baseConcurrency / 2);
        }
        return Math.max(1, baseConcurrency);
    }

    private int baseConcurrency() {
        int cpuCount = sampler.availableProcessors();
        if (cpuCount <= 0) {
            cpuCount = ConversionConstants.FALLBACK_CONCURRENCY;
        }
        return Math.min(cpuCount, properties.getResources().getMaxBaseConcurrency());
    }
}
