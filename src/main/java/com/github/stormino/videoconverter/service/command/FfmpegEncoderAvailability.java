package com.github.stormino.videoconverter.service.command;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.model.ConversionRequest;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Checks the encoder list of the configured ffmpeg binary.
 * The answer per encoder name is cached for the lifetime of the bean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegEncoderAvailability implements EncoderAvailability {

    private final ConverterProperties properties;

    private final Map<String, Boolean> cache = new ConcurrentHashMap<>();

    @Override
    public boolean isAvailable(@NonNull ConversionRequest request) {
        String encoder = request.getEncoder();
        if (encoder == null || encoder.isBlank()) {
            return false;
        }
        return cache.computeIfAbsent(encoder, this::probe);
    }

    private boolean probe(String encoder) {
        List<String> command = List.of(properties.getExecutor().getFfmpegPath(), "-hide_banner", "-encoders");
        Pattern encoderLine = Pattern.compile("^\\s*\\S{6}\\s+" + Pattern.quote(encoder) + "\\s");

        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            Process process = processBuilder.start();

            boolean found = false;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!found && encoderLine.matcher(line).find()) {
                        found = true;
                    }
                }
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Encoder probe exited with code {} for {}", exitCode, encoder);
                return false;
            }
            log.debug("Encoder {} available: {}", encoder, found);
            return found;

        } catch (IOException e) {
            log.warn("Could not run ffmpeg to probe encoder {}: {}", encoder, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while probing encoder {}", encoder);
            return false;
        }
    }
}
