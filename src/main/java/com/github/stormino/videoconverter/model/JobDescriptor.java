package com.github.stormino.videoconverter.model;

import java.nio.file.Path;

/**
 * Anything the scheduler can run as a job and show by file name.
 */
public interface JobDescriptor {

    Path getInputPath();

    default String getDisplayName() {
        Path fileName = getInputPath().getFileName();
        return fileName != null ? fileName.toString() : getInputPath().toString();
    }
}
