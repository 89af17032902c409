package com.github.stormino.videoconverter.service.resource;

import java.time.Duration;

/**
 * Source of raw system utilization figures for the {@link ResourceMonitor}.
 */
public interface ResourceSampler {

    /**
     * Whether utilization can be sampled on this platform at all.
     */
    boolean isAvailable();

    /**
     * Sample system-wide CPU utilization over the given window.
     *
     * @param window How long to measure, kept short by callers
     * @return CPU utilization percentage in [0, 100]
     * @throws IllegalStateException if no value could be obtained
     */
    double sampleCpuPercent(Duration window);

    /**
     * Sample physical memory utilization.
     *
     * @return Memory utilization percentage in [0, 100]
     * @throws IllegalStateException if no value could be obtained
     */
    double sampleMemoryPercent();

    /**
     * Number of processors visible to this JVM.
     */
    default int availableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }
}
