package com.github.stormino.videoconverter.service.parser;

import com.github.stormino.videoconverter.model.ProgressSample;

import java.util.Optional;

/**
 * Interface for parsing progress information from encoder status output.
 * Allows for different implementations for other encoders than ffmpeg.
 */
public interface ProgressParser {

    /**
     * Parse a single line of output and extract progress information.
     *
     * @param line Output line to parse
     * @return Sample if the line carried progress information, empty otherwise
     */
    Optional<ProgressSample> parseLine(String line);

    /**
     * Get the most recently parsed sample.
     *
     * @return Last sample, or empty if no line has parsed yet
     */
    Optional<ProgressSample> getLastSample();

    /**
     * Forget the last sample (e.g., for a new run).
     */
    void reset();

    /**
     * Get the total duration used for percentage and ETA.
     *
     * @return Total duration in seconds, 0 if unknown
     */
    double getTotalDuration();
}
