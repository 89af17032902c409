package com.github.stormino.videoconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoConverterApplication.class, args);
    }
}
