package com.github.stormino.videoconverter.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time CPU and memory utilization with the concurrency it allows.
 */
@Value
@Builder
public class ResourceStatus {

    @Builder.Default
    double cpuPercent = 0.0;

    @Builder.Default
    double memoryPercent = 0.0;

    @Builder.Default
    ResourceLevel cpuLevel = ResourceLevel.NORMAL;

    @Builder.Default
    ResourceLevel memoryLevel = ResourceLevel.NORMAL;

    @Builder.Default
    int recommendedConcurrency = 2;

    // false when the values are the fallback rather than a real sample
    @Builder.Default
    boolean sampled = false;

    public static ResourceStatus fallback(int recommendedConcurrency) {
        return ResourceStatus.builder()
                .recommendedConcurrency(Math.max(1, recommendedConcurrency))
                .build();
    }
}
