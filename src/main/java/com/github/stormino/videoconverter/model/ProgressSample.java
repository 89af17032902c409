package com.github.stormino.videoconverter.model;

import com.github.stormino.videoconverter.util.FormatUtils;
import lombok.Builder;
import lombok.Value;

/**
 * One parsed snapshot of encoder status. Fields the status line did not carry stay at zero.
 */
@Value
@Builder(toBuilder = true)
public class ProgressSample {

    long frame;
    double fps;
    double currentTimeSeconds;
    double totalTimeSeconds;
    long currentSizeBytes;
    double bitrateKbps;
    double speedMultiplier;
    double quality;

    /**
     * Completion percentage in [0, 100], or 0 when the total duration is unknown.
     */
    public double getPercentage() {
        if (totalTimeSeconds <= 0) {
            return 0.0;
        }
        double percentage = (currentTimeSeconds / totalTimeSeconds) * 100.0;
        return Math.max(0.0, Math.min(100.0, percentage));
    }

    /**
     * Estimated seconds remaining at the current encoding speed.
     *
     * @return remaining seconds, 0 once the current position reaches the total,
     *         or {@link Double#POSITIVE_INFINITY} while the speed is unknown
     */
    public double getEtaSeconds() {
        if (speedMultiplier <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        double remaining = totalTimeSeconds - currentTimeSeconds;
        if (remaining <= 0) {
            return 0.0;
        }
        return remaining / speedMultiplier;
    }

    public String getFormattedEta() {
        return FormatUtils.formatEta(getEtaSeconds());
    }

    public String getFormattedSize() {
        return FormatUtils.formatBinarySize(currentSizeBytes);
    }
}
