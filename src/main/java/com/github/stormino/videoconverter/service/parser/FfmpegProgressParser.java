package com.github.stormino.videoconverter.service.parser;

import com.github.stormino.videoconverter.model.ProgressSample;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for FFmpeg status output.
 * Turns lines like
 * {@code frame=  720 fps=180 q=32.0 size=   15360kB time=00:00:24.00 bitrate=5242.9kbits/s speed=6.0x}
 * into {@link ProgressSample}s. Each field is matched on its own so a line
 * missing some of them still yields the rest.
 */
@Slf4j
public class FfmpegProgressParser implements ProgressParser {

    private static final String FRAME_MARKER = "frame=";
    private static final String TIME_MARKER = "time=";

    // Regex patterns for FFmpeg output
    private static final Pattern FRAME_PATTERN = Pattern.compile("frame=\\s*(\\d+)");
    private static final Pattern FPS_PATTERN = Pattern.compile("fps=\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern QUALITY_PATTERN = Pattern.compile("\\bq=\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern SIZE_PATTERN = Pattern.compile("size=\\s*(\\d+)kB");
    private static final Pattern TIME_PATTERN = Pattern.compile("time=(\\d{1,6}):(\\d{2}):(\\d{2})\\.(\\d{1,2})");
    private static final Pattern BITRATE_PATTERN = Pattern.compile("bitrate=\\s*(\\d+(?:\\.\\d+)?)kbits/s");
    private static final Pattern SPEED_PATTERN = Pattern.compile("speed=\\s*(\\d+(?:\\.\\d+)?)x");
    private static final Pattern TIME_VALUE_PATTERN = Pattern.compile("(\\d{1,6}):(\\d{1,2}):(\\d{1,2})\\.?(\\d{0,2})");

    private final double totalDuration;
    private volatile ProgressSample lastSample;

    public FfmpegProgressParser() {
        this(0.0);
    }

    /**
     * @param totalDuration Total duration of the input in seconds, 0 if unknown
     */
    public FfmpegProgressParser(double totalDuration) {
        this.totalDuration = Math.max(0.0, totalDuration);
    }

    @Override
    public Optional<ProgressSample> parseLine(String line) {
        if (line == null || !line.contains(FRAME_MARKER) || !line.contains(TIME_MARKER)) {
            return Optional.empty();
        }

        ProgressSample.ProgressSampleBuilder sample = ProgressSample.builder()
                .totalTimeSeconds(totalDuration);

        Matcher matcher = FRAME_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.frame(parseLong(matcher.group(1)));
        }

        matcher = FPS_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.fps(parseDouble(matcher.group(1)));
        }

        matcher = QUALITY_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.quality(parseDouble(matcher.group(1)));
        }

        // Size is reported in kilobytes
        matcher = SIZE_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.currentSizeBytes(parseLong(matcher.group(1)) * 1024);
        }

        matcher = TIME_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.currentTimeSeconds(toSeconds(
                    matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)));
        }

        matcher = BITRATE_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.bitrateKbps(parseDouble(matcher.group(1)));
        }

        matcher = SPEED_PATTERN.matcher(line);
        if (matcher.find()) {
            sample.speedMultiplier(parseDouble(matcher.group(1)));
        }

        ProgressSample parsed = sample.build();
        lastSample = parsed;
        return Optional.of(parsed);
    }

    @Override
    public Optional<ProgressSample> getLastSample() {
        return Optional.ofNullable(lastSample);
    }

    @Override
    public void reset() {
        lastSample = null;
    }

    @Override
    public double getTotalDuration() {
        return totalDuration;
    }

    /**
     * Parse an FFmpeg time value such as {@code 01:02:03.45} or {@code 0:00:10}.
     *
     * @param time Time string in H:MM:SS[.hh] form
     * @return Time in seconds, or 0 if the value does not match
     */
    public static double parseTimeToSeconds(String time) {
        if (time == null) {
            return 0.0;
        }
        Matcher matcher = TIME_VALUE_PATTERN.matcher(time.trim());
        if (!matcher.matches()) {
            return 0.0;
        }
        String fraction = matcher.group(4);
        return toSeconds(matcher.group(1), matcher.group(2), matcher.group(3),
                fraction.isEmpty() ? "0" : fraction);
    }

    private static double toSeconds(String hours, String minutes, String seconds, String hundredths) {
        return Integer.parseInt(hours) * 3600
                + Integer.parseInt(minutes) * 60
                + Integer.parseInt(seconds)
                + Integer.parseInt(hundredths) / 100.0;
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.debug("Failed to parse integer value: {}", value);
            return 0L;
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Failed to parse decimal value: {}", value);
            return 0.0;
        }
    }
}
