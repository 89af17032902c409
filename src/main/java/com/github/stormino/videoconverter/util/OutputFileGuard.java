package com.github.stormino.videoconverter.util;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deletes guarded output files on close unless they were committed.
 * Use with try-with-resources around an encoder run so every exit path that
 * does not commit leaves no partial output behind.
 * Thread-safe using CopyOnWriteArrayList.
 */
@Slf4j
public class OutputFileGuard implements Closeable {

    private final List<Path> guardedFiles = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    /**
     * Guard a file: it is deleted on close unless committed first.
     *
     * @param file Output file path
     */
    public void guard(Path file) {
        if (closed) {
            log.warn("OutputFileGuard is already closed, cannot guard file: {}", file);
            return;
        }
        guardedFiles.add(file);
        log.debug("Guarding output file: {}", file);
    }

    /**
     * Keep a guarded file: it survives close.
     *
     * @param file File to keep
     * @return true if the file was guarded
     */
    public boolean commit(Path file) {
        boolean removed = guardedFiles.remove(file);
        if (removed) {
            log.debug("Committed output file: {}", file);
        }
        return removed;
    }

    /**
     * Delete every guarded file that was not committed.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        if (!guardedFiles.isEmpty()) {
            log.debug("Removing {} uncommitted output files", guardedFiles.size());
        }

        List<Path> filesToDelete = new ArrayList<>(guardedFiles);
        for (Path file : filesToDelete) {
            deleteFile(file);
        }
        guardedFiles.clear();
    }

    private void deleteFile(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted partial output: {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to delete partial output: {}", file, e);
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
