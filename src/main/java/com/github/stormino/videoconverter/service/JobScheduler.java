package com.github.stormino.videoconverter.service;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.exception.ConfigurationException;
import com.github.stormino.videoconverter.model.AggregatedProgress;
import com.github.stormino.videoconverter.model.JobDescriptor;
import com.github.stormino.videoconverter.model.JobStatus;
import com.github.stormino.videoconverter.model.ResourceStatus;
import com.github.stormino.videoconverter.service.resource.ResourceMonitor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs a batch of jobs with bounded parallelism and keeps an aggregate view of their progress.
 * <p>
 * A fair semaphore sized to the effective concurrency is the only limit on
 * running jobs. The effective concurrency is fixed when a batch starts. One
 * job failing never affects the others. {@link #cancel()} only stops jobs that
 * have not started yet; running jobs have to be stopped through their own
 * cancellation path.
 */
@Slf4j
@Service
public class JobScheduler {

    private final ResourceMonitor resourceMonitor;
    private final Executor jobExecutor;
    private final boolean adaptiveConcurrency;
    private volatile int maxConcurrent;

    // Guards the job table and the counters
    private final Object lock = new Object();
    private final Map<Integer, ScheduledJob> jobs = new TreeMap<>();
    private int completedCount = 0;
    private int totalJobs = 0;

    private volatile boolean cancelled = false;
    private volatile int effectiveConcurrency;
    private final AtomicBoolean batchRunning = new AtomicBoolean(false);

    @Autowired
    public JobScheduler(ConverterProperties properties,
                        ResourceMonitor resourceMonitor,
                        @Qualifier("conversionJobExecutor") Executor jobExecutor) {
        this(properties.getScheduler().getMaxConcurrent(),
                properties.getScheduler().isAdaptiveConcurrency(),
                properties.getScheduler().isResourceMonitoring() ? resourceMonitor : null,
                jobExecutor);
    }

    /**
     * @param maxConcurrent Upper bound on running jobs, at least 1
     * @param adaptiveConcurrency Lower the bound to the resource monitor's recommendation at batch start
     * @param resourceMonitor Monitor to consult, or null to disable monitoring
     * @param jobExecutor Executor the jobs run on
     * @throws ConfigurationException if maxConcurrent is below 1
     */
    public JobScheduler(int maxConcurrent, boolean adaptiveConcurrency,
                        ResourceMonitor resourceMonitor, @NonNull Executor jobExecutor) {
        this.maxConcurrent = requireValidConcurrency(maxConcurrent);
        this.adaptiveConcurrency = adaptiveConcurrency;
        this.resourceMonitor = resourceMonitor;
        this.jobExecutor = jobExecutor;
        this.effectiveConcurrency = this.maxConcurrent;
    }

    /**
     * Process all items, at most the effective concurrency at a time.
     *
     * @param items Items to process
     * @param jobFn Work per item
     * @param onProgress Receives a fresh snapshot on every job state or progress change; may be null
     * @return One entry per item in input order, empty where the job failed or was cancelled
     * @throws IllegalStateException if another batch is running on this scheduler
     */
    public <T, R> List<Optional<R>> processBatch(@NonNull List<T> items,
                                                 @NonNull BatchJob<T, R> jobFn,
                                                 Consumer<AggregatedProgress> onProgress) {
        if (!batchRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("A batch is already running on this scheduler");
        }

        try {
            reset();
            synchronized (lock) {
                totalJobs = items.size();
            }

            if (items.isEmpty()) {
                return new ArrayList<>();
            }

            int concurrency = determineConcurrency();
            effectiveConcurrency = concurrency;
            Semaphore semaphore = new Semaphore(concurrency, true);

            log.info("Starting batch processing: {} jobs, max concurrent: {}", items.size(), concurrency);

            for (int i = 0; i < items.size(); i++) {
                createJob(i, items.get(i));
            }

            List<CompletableFuture<Optional<R>>> futures = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                final int jobId = i;
                final T item = items.get(i);
                try {
                    futures.add(CompletableFuture.supplyAsync(
                            () -> runJob(jobId, item, jobFn, semaphore, onProgress), jobExecutor));
                } catch (RejectedExecutionException e) {
                    log.error("Job {} could not be scheduled: {}", jobId, e.getMessage());
                    markFailed(jobId, "Could not be scheduled: " + e.getMessage());
                    emit(onProgress);
                    futures.add(CompletableFuture.completedFuture(Optional.empty()));
                }
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<Optional<R>> results = new ArrayList<>(items.size());
            for (CompletableFuture<Optional<R>> future : futures) {
                results.add(future.join());
            }

            AggregatedProgress summary = getAggregatedProgress();
            log.info("Batch finished: {} succeeded, {} failed, {} cancelled of {} jobs",
                    summary.getSuccessfulJobs(), summary.getFailedJobs(),
                    summary.getCancelledJobs(), summary.getTotalJobs());

            return results;
        } finally {
            batchRunning.set(false);
        }
    }

    /**
     * Stop jobs that have not started yet. Running jobs are not interrupted.
     */
    public void cancel() {
        if (!cancelled) {
            log.info("Batch cancellation requested");
        }
        cancelled = true;
    }

    /**
     * Clear the job table, the counters and the cancel flag.
     */
    public void reset() {
        synchronized (lock) {
            jobs.clear();
            completedCount = 0;
            totalJobs = 0;
            cancelled = false;
        }
    }

    /**
     * Snapshot of the whole job table, taken atomically.
     */
    public AggregatedProgress getAggregatedProgress() {
        synchronized (lock) {
            AggregatedProgress.AggregatedProgressBuilder builder = AggregatedProgress.builder()
                    .totalJobs(totalJobs)
                    .completedJobs(completedCount);

            int inProgress = 0;
            int pending = 0;
            int failed = 0;
            int cancelledJobs = 0;
            double inProgressSum = 0.0;

            for (ScheduledJob job : jobs.values()) {
                builder.jobSnapshot(job.toSnapshot());
                switch (job.getStatus()) {
                    case IN_PROGRESS -> {
                        inProgress++;
                        inProgressSum += job.getProgress();
                        builder.activeFileName(job.getDisplayName());
                    }
                    case PENDING -> pending++;
                    case FAILED -> failed++;
                    case CANCELLED -> cancelledJobs++;
                    default -> {
                        // COMPLETED is covered by completedCount
                    }
                }
            }

            double overall = totalJobs > 0 ? (completedCount + inProgressSum) / totalJobs : 0.0;

            return builder
                    .inProgressJobs(inProgress)
                    .pendingJobs(pending)
                    .failedJobs(failed)
                    .cancelledJobs(cancelledJobs)
                    .overallProgress(Math.min(1.0, overall))
                    .build();
        }
    }

    /**
     * Current resource status, empty when resource monitoring is disabled.
     */
    public Optional<ResourceStatus> getResourceStatus() {
        return resourceMonitor != null ? Optional.of(resourceMonitor.getStatus()) : Optional.empty();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Change the upper bound for batches started from now on.
     *
     * @throws ConfigurationException if the value is below 1
     */
    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = requireValidConcurrency(maxConcurrent);
    }

    /**
     * Bound used by the current or most recent batch.
     */
    public int getEffectiveConcurrency() {
        return effectiveConcurrency;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isBatchRunning() {
        return batchRunning.get();
    }

    private int determineConcurrency() {
        int concurrency = maxConcurrent;
        if (adaptiveConcurrency && resourceMonitor != null) {
            ResourceStatus status = resourceMonitor.getStatus();
            concurrency = Math.min(maxConcurrent, status.getRecommendedConcurrency());
            log.info("Adaptive concurrency: cpu {}, memory {}, using {} of max {}",
                    status.getCpuLevel(), status.getMemoryLevel(), concurrency, maxConcurrent);
        }
        return Math.max(1, concurrency);
    }

    private <T, R> Optional<R> runJob(int jobId, T item, BatchJob<T, R> jobFn,
                                      Semaphore semaphore, Consumer<AggregatedProgress> onProgress) {
        if (cancelled) {
            markCancelled(jobId, "Batch processing cancelled");
            emit(onProgress);
            return Optional.empty();
        }

        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markCancelled(jobId, "Interrupted while waiting to start");
            emit(onProgress);
            return Optional.empty();
        }

        try {
            // The batch may have been cancelled while this job waited for a permit
            if (cancelled) {
                markCancelled(jobId, "Batch processing cancelled");
                emit(onProgress);
                return Optional.empty();
            }

            markStarted(jobId);
            emit(onProgress);

            try {
                R result = jobFn.run(item, progress -> updateProgress(jobId, progress, onProgress));
                markCompleted(jobId);
                emit(onProgress);
                return Optional.ofNullable(result);
            } catch (Exception e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Job {} failed: {}", jobId, message);
                markFailed(jobId, message);
                emit(onProgress);
                return Optional.empty();
            }
        } finally {
            semaphore.release();
        }
    }

    private void createJob(int jobId, Object item) {
        ScheduledJob job = new ScheduledJob(jobId, describe(item));
        synchronized (lock) {
            jobs.put(jobId, job);
        }
    }

    private void markStarted(int jobId) {
        synchronized (lock) {
            ScheduledJob job = jobs.get(jobId);
            if (job != null && job.getStatus() == JobStatus.PENDING) {
                job.setStatus(JobStatus.IN_PROGRESS);
                job.setStartedAt(LocalDateTime.now());
            }
        }
    }

    private void updateProgress(int jobId, double progress, Consumer<AggregatedProgress> onProgress) {
        if (Double.isNaN(progress)) {
            return;
        }
        synchronized (lock) {
            ScheduledJob job = jobs.get(jobId);
            if (job == null || job.getStatus() != JobStatus.IN_PROGRESS) {
                return;
            }
            job.setProgress(Math.max(0.0, Math.min(1.0, progress)));
        }
        emit(onProgress);
    }

    private void markCompleted(int jobId) {
        synchronized (lock) {
            ScheduledJob job = jobs.get(jobId);
            if (job != null && !job.getStatus().isTerminal()) {
                job.setStatus(JobStatus.COMPLETED);
                job.setProgress(1.0);
                completedCount++;
            }
        }
    }

    private void markFailed(int jobId, String message) {
        synchronized (lock) {
            ScheduledJob job = jobs.get(jobId);
            if (job != null && !job.getStatus().isTerminal()) {
                job.setStatus(JobStatus.FAILED);
                job.setMessage(message);
                completedCount++;
            }
        }
    }

    private void markCancelled(int jobId, String message) {
        synchronized (lock) {
            ScheduledJob job = jobs.get(jobId);
            if (job != null && job.getStatus() == JobStatus.PENDING) {
                job.setStatus(JobStatus.CANCELLED);
                job.setMessage(message);
            }
        }
    }

    private void emit(Consumer<AggregatedProgress> onProgress) {
        if (onProgress == null) {
            return;
        }
        AggregatedProgress snapshot = getAggregatedProgress();
        try {
            onProgress.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Aggregate progress callback failed: {}", e.getMessage(), e);
        }
    }

    private static String describe(Object item) {
        if (item instanceof JobDescriptor descriptor) {
            return descriptor.getDisplayName();
        }
        if (item instanceof Path path) {
            Path fileName = path.getFileName();
            return fileName != null ? fileName.toString() : path.toString();
        }
        return String.valueOf(item);
    }

    private static int requireValidConcurrency(int value) {
        if (value < 1) {
            throw new ConfigurationException("Maximum concurrency must be at least 1",
                    "converter.scheduler.max-concurrent", value);
        }
        return value;
    }
}
