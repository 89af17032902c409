package com.github.stormino.videoconverter.service;

import java.util.function.DoubleConsumer;

/**
 * Work the {@link JobScheduler} runs for one batch item.
 *
 * @param <T> item type
 * @param <R> result type
 */
@FunctionalInterface
public interface BatchJob<T, R> {

    /**
     * Process one item.
     *
     * @param item Item to process
     * @param progressCallback Accepts this job's progress as a fraction in [0, 1];
     *                         values should not decrease
     * @return Result stored at the item's index
     * @throws Exception to mark the job failed; other jobs keep running
     */
    R run(T item, DoubleConsumer progressCallback) throws Exception;
}
