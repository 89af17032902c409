package com.github.stormino.videoconverter.service;

import com.github.stormino.videoconverter.exception.ConversionFailedException;
import com.github.stormino.videoconverter.model.AggregatedProgress;
import com.github.stormino.videoconverter.model.BatchReport;
import com.github.stormino.videoconverter.model.ConversionRequest;
import com.github.stormino.videoconverter.model.ExecutionResult;
import com.github.stormino.videoconverter.model.FailureReason;
import com.github.stormino.videoconverter.model.JobDescriptor;
import com.github.stormino.videoconverter.model.JobSnapshot;
import com.github.stormino.videoconverter.model.JobStatus;
import com.github.stormino.videoconverter.model.ProgressSample;
import com.github.stormino.videoconverter.util.FormatUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.stream.IntStream;

/**
 * Converts a list of files through the {@link JobScheduler}, one
 * {@link ConversionExecutor} per file, and summarizes the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchConversionService {

    private final JobScheduler scheduler;
    private final ConversionExecutorFactory executorFactory;

    // State of the batch in flight, null when idle
    private final AtomicReference<ActiveBatch> activeBatch = new AtomicReference<>();

    /**
     * Convert all requests and block until every job has finished.
     *
     * @param requests Files to convert
     * @param onProgress Aggregate progress listener; may be null
     * @return Report with one result per request, in request order
     * @throws IllegalStateException if a batch is already running on this service
     */
    public BatchReport convertAll(@NonNull List<ConversionRequest> requests, Consumer<AggregatedProgress> onProgress) {
        ActiveBatch batch = new ActiveBatch();
        if (!activeBatch.compareAndSet(null, batch)) {
            throw new IllegalStateException("A conversion batch is already running");
        }

        try {
            return runBatch(batch, requests, onProgress);
        } finally {
            activeBatch.compareAndSet(batch, null);
        }
    }

    /**
     * Stop the current batch now: jobs not yet started are skipped and running encoders are killed.
     * <p>
     * A killed encoder ends its job with an exception, so the scheduler's
     * {@link AggregatedProgress} counts that job in {@code failedJobs} with the
     * message "Conversion cancelled". The {@link BatchReport} is built from the
     * executor results and counts the same job as cancelled.
     */
    public void cancelAll() {
        scheduler.cancel();
        ActiveBatch batch = activeBatch.get();
        if (batch != null) {
            batch.cancel();
        }
    }

    public AggregatedProgress getProgress() {
        return scheduler.getAggregatedProgress();
    }

    public boolean isBatchRunning() {
        return activeBatch.get() != null;
    }

    private BatchReport runBatch(ActiveBatch batch, List<ConversionRequest> requests,
                                 Consumer<AggregatedProgress> onProgress) {
        LocalDateTime startedAt = LocalDateTime.now();
        AtomicReferenceArray<ExecutionResult> results = new AtomicReferenceArray<>(requests.size());
        List<IndexedRequest> items = IntStream.range(0, requests.size())
                .mapToObj(i -> new IndexedRequest(i, requests.get(i)))
                .toList();

        log.info("Converting {} files", requests.size());
        scheduler.processBatch(items, (item, progress) -> convert(batch, item, progress, results), onProgress);

        List<JobSnapshot> snapshots = scheduler.getAggregatedProgress().getJobSnapshots();
        List<ExecutionResult> ordered = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ExecutionResult result = results.get(i);
            if (result == null) {
                result = unstartedResult(requests.get(i), i < snapshots.size() ? snapshots.get(i) : null);
            }
            ordered.add(result);
        }

        BatchReport report = BatchReport.of(ordered, startedAt);
        log.info("Batch report: {} converted, {} failed, {} cancelled, {} saved",
                report.getSuccessful(), report.getFailed(), report.getCancelled(),
                FormatUtils.formatBinarySize(Math.max(0, report.getTotalSizeSaved())));
        return report;
    }

    private ExecutionResult convert(ActiveBatch batch, IndexedRequest item, DoubleConsumer progress,
                                    AtomicReferenceArray<ExecutionResult> results) {
        ConversionExecutor executor = executorFactory.create();
        batch.register(item.getIndex(), executor);
        try {

            ExecutionResult result = executor.execute(item.getRequest(),
                    new MonotonicProgress(progress), executorFactory.getMinCallbackInterval());
            results.set(item.getIndex(), result);

            if (!result.isSuccess()) {
                throw new ConversionFailedException(result);
            }
            return result;
        } finally {
            batch.unregister(item.getIndex());
        }
    }

    private static ExecutionResult unstartedResult(ConversionRequest request, JobSnapshot snapshot) {
        if (snapshot != null && snapshot.getStatus() == JobStatus.FAILED) {
            return ExecutionResult.failure(request, FailureReason.PROCESS_EXECUTION_FAILED, snapshot.getMessage());
        }
        String message = snapshot != null && !snapshot.getMessage().isEmpty()
                ? snapshot.getMessage()
                : "Batch processing cancelled";
        return ExecutionResult.cancelled(request, message);
    }

    /**
     * Executors and cancel flag of one {@link #convertAll} call.
     */
    private static final class ActiveBatch {

        private final Map<Integer, ConversionExecutor> runningExecutors = new ConcurrentHashMap<>();
        private volatile boolean cancelRequested = false;

        void register(int index, ConversionExecutor executor) {
            runningExecutors.put(index, executor);
            // cancelAll may have run between the scheduler starting this job and the put
            if (cancelRequested) {
                executor.cancel();
            }
        }

        void unregister(int index) {
            runningExecutors.remove(index);
        }

        void cancel() {
            cancelRequested = true;
            runningExecutors.values().forEach(ConversionExecutor::cancel);
            log.info("Cancelled batch with {} running conversions", runningExecutors.size());
        }
    }

    /**
     * Batch item carrying its position so results can be stored by index.
     */
    @Value
    static class IndexedRequest implements JobDescriptor {
        int index;
        ConversionRequest request;

        @Override
        public Path getInputPath() {
            return request.getInputPath();
        }
    }

    /**
     * Forwards sample percentages as fractions and never lets them go backwards.
     */
    private static final class MonotonicProgress implements Consumer<ProgressSample> {

        private final DoubleConsumer delegate;
        private double last = 0.0;

        private MonotonicProgress(DoubleConsumer delegate) {
            this.delegate = delegate;
        }

        @Override
        public void accept(ProgressSample sample) {
            double fraction = sample.getPercentage() / 100.0;
            if (fraction > last) {
                last = fraction;
                delegate.accept(fraction);
            }
        }
    }
}
