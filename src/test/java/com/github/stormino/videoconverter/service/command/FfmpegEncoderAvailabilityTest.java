package com.github.stormino.videoconverter.service.command;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.model.ConversionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
@DisplayName("FfmpegEncoderAvailability")
class FfmpegEncoderAvailabilityTest {

    @TempDir
    Path tempDir;

    private ConversionRequest request(String encoder) {
        return ConversionRequest.builder()
                .inputPath(Path.of("a.mov"))
                .outputPath(Path.of("a.mp4"))
                .encoder(encoder)
                .build();
    }

    private FfmpegEncoderAvailability availabilityWith(String ffmpegPath) {
        ConverterProperties properties = new ConverterProperties();
        properties.getExecutor().setFfmpegPath(ffmpegPath);
        return new FfmpegEncoderAvailability(properties);
    }

    @Test
    @DisplayName("should find encoders listed by ffmpeg")
    void shouldFindListedEncoders() throws IOException {
        Path fakeFfmpeg = tempDir.resolve("ffmpeg");
        Files.writeString(fakeFfmpeg, String.join("\n",
                "#!/bin/sh",
                "echo 'Encoders:'",
                "echo ' V..... = Video'",
                "echo ' ------'",
                "echo ' V....D libx265              libx265 H.265 / HEVC (codec hevc)'",
                "echo ' A....D aac                  AAC (Advanced Audio Coding)'",
                ""));
        Files.setPosixFilePermissions(fakeFfmpeg, PosixFilePermissions.fromString("rwxr-xr-x"));

        FfmpegEncoderAvailability availability = availabilityWith(fakeFfmpeg.toString());

        assertTrue(availability.isAvailable(request("libx265")));
        assertTrue(availability.isAvailable(request("aac")));
        assertFalse(availability.isAvailable(request("libx26")));
        assertFalse(availability.isAvailable(request("hevc_nvenc")));
    }

    @Test
    @DisplayName("should report unavailable when ffmpeg cannot run")
    void shouldReportUnavailableWithoutFfmpeg() {
        FfmpegEncoderAvailability availability = availabilityWith(tempDir.resolve("missing-ffmpeg").toString());

        assertFalse(availability.isAvailable(request("libx265")));
    }

    @Test
    @DisplayName("should reject a blank encoder name")
    void shouldRejectBlankEncoder() {
        assertFalse(availabilityWith("ffmpeg").isAvailable(request(" ")));
    }
}
