package com.github.stormino.videoconverter.service.resource;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Duration;

/**
 * Samples utilization through the platform {@link OperatingSystemMXBean}.
 * Needs the {@code com.sun.management} extension; without it the sampler reports unavailable.
 */
@Slf4j
@Component
public class OperatingSystemResourceSampler implements ResourceSampler {

    private final com.sun.management.OperatingSystemMXBean osBean;

    public OperatingSystemResourceSampler() {
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            this.osBean = sunBean;
        } else {
            log.debug("Extended OperatingSystemMXBean not available, resource monitoring disabled");
            this.osBean = null;
        }
    }

    @Override
    public boolean isAvailable() {
        return osBean != null;
    }

    @Override
    public double sampleCpuPercent(Duration window) {
        requireAvailable();

        // The first reading after start-up is often 0 or negative; read again after the window
        double load = osBean.getCpuLoad();
        if (!window.isZero() && !window.isNegative()) {
            try {
                Thread.sleep(window.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            load = osBean.getCpuLoad();
        }

        if (load < 0 || Double.isNaN(load)) {
            throw new IllegalStateException("CPU load not available");
        }
        return load * 100.0;
    }

    @Override
    public double sampleMemoryPercent() {
        requireAvailable();

        long total = osBean.getTotalMemorySize();
        long free = osBean.getFreeMemorySize();
        if (total <= 0) {
            throw new IllegalStateException("Total memory size not available");
        }
        return (double) (total - free) / total * 100.0;
    }

    private void requireAvailable() {
        if (osBean == null) {
            throw new IllegalStateException("Resource sampling not supported on this platform");
        }
    }
}
