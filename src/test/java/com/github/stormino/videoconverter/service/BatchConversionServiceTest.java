package com.github.stormino.videoconverter.service;

import com.github.stormino.videoconverter.config.ConverterProperties;
import com.github.stormino.videoconverter.model.AggregatedProgress;
import com.github.stormino.videoconverter.model.BatchReport;
import com.github.stormino.videoconverter.model.ConversionRequest;
import com.github.stormino.videoconverter.model.ExecutionResult;
import com.github.stormino.videoconverter.model.FailureReason;
import com.github.stormino.videoconverter.model.JobSnapshot;
import com.github.stormino.videoconverter.model.JobStatus;
import com.github.stormino.videoconverter.service.command.ArgvBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
@Timeout(value = 30, unit = TimeUnit.SECONDS)
@DisplayName("BatchConversionService")
class BatchConversionServiceTest {

    // Fails for inputs named bad.*, sleeps for inputs named slow.*, otherwise converts
    private static final String ENCODER_SCRIPT = String.join("\n",
            "#!/bin/sh",
            "case \"$(basename \"$1\")\" in",
            "  bad.*) echo 'Error while decoding stream #0:0' ; exit 1 ;;",
            "  slow.*) printf 'partial' > \"$2\"; echo 'frame=  720 time=00:00:24.00 speed=6.0x'; sleep 30 ;;",
            "esac",
            "echo 'frame=  720 time=00:00:24.00 speed=6.0x'",
            "echo 'frame=  360 time=00:00:12.00 speed=6.0x'",
            "echo 'frame= 1800 time=00:01:00.00 speed=6.0x'",
            "printf 'converted' > \"$2\"",
            "");

    @TempDir
    Path tempDir;

    private ExecutorService pool;
    private ConverterProperties properties;
    private ArgvBuilder argvBuilder;

    @BeforeEach
    void setUp() throws IOException {
        pool = Executors.newFixedThreadPool(4);
        properties = new ConverterProperties();
        properties.getExecutor().setMinCallbackIntervalMs(0);

        Path script = tempDir.resolve("encoder.sh");
        Files.writeString(script, ENCODER_SCRIPT);
        argvBuilder = request -> List.of("sh", script.toString(),
                request.getInputPath().toString(), request.getOutputPath().toString());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private BatchConversionService service(int maxConcurrent) {
        JobScheduler scheduler = new JobScheduler(maxConcurrent, false, null, pool);
        ConversionExecutorFactory factory = new ConversionExecutorFactory(argvBuilder, request -> true, properties);
        return new BatchConversionService(scheduler, factory);
    }

    private List<ConversionRequest> requests(String... names) throws IOException {
        List<ConversionRequest> requests = new ArrayList<>();
        for (String name : names) {
            Path input = tempDir.resolve(name);
            Files.write(input, new byte[100]);
            requests.add(ConversionRequest.builder()
                    .inputPath(input)
                    .outputPath(tempDir.resolve("converted").resolve(name + ".mp4"))
                    .totalDurationSeconds(120.0)
                    .build());
        }
        return requests;
    }

    @Test
    @DisplayName("should convert every file and report totals")
    void shouldConvertAll() throws IOException {
        List<ConversionRequest> requests = requests("a.mov", "b.mov", "c.mov");
        List<AggregatedProgress> snapshots = new CopyOnWriteArrayList<>();

        BatchReport report = service(2).convertAll(requests, snapshots::add);

        assertEquals(3, report.getTotalFiles());
        assertEquals(3, report.getSuccessful());
        assertEquals(0, report.getFailed());
        assertEquals(300L, report.getTotalOriginalSize());
        assertEquals(27L, report.getTotalConvertedSize());
        assertEquals(1.0, report.getSuccessRate());
        assertTrue(report.getErrors().isEmpty());
        for (int i = 0; i < requests.size(); i++) {
            assertEquals(requests.get(i), report.getResults().get(i).getRequest());
            assertTrue(Files.exists(requests.get(i).getOutputPath()));
        }
        assertTrue(snapshots.stream().allMatch(s -> s.getInProgressJobs() <= 2));
        assertEquals(3, snapshots.stream().mapToInt(AggregatedProgress::getCompletedJobs).max().orElse(0));
    }

    @Test
    @DisplayName("should report failures without stopping the other conversions")
    void shouldIsolateFailures() throws IOException {
        List<ConversionRequest> requests = requests("a.mov", "bad.mov", "c.mov");
        BatchConversionService service = service(2);

        BatchReport report = service.convertAll(requests, null);

        assertEquals(2, report.getSuccessful());
        assertEquals(1, report.getFailed());
        ExecutionResult failed = report.getResults().get(1);
        assertEquals(FailureReason.PROCESS_EXECUTION_FAILED, failed.getFailureReason());
        assertEquals(1, report.getErrors().size());
        assertTrue(report.getErrors().get(0).startsWith("bad.mov: "), report.getErrors().get(0));
        assertFalse(Files.exists(requests.get(1).getOutputPath()));

        JobSnapshot job = service.getProgress().getJobSnapshots().get(1);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("bad.mov", job.getDisplayName());
    }

    @Test
    @DisplayName("should forward encoder progress without going backwards")
    void shouldForwardMonotonicProgress() throws IOException {
        List<Double> progress = new CopyOnWriteArrayList<>();

        service(1).convertAll(requests("a.mov"), snapshot -> {
            JobSnapshot job = snapshot.getJobSnapshots().get(0);
            if (job.getStatus() == JobStatus.IN_PROGRESS) {
                progress.add(job.getProgress());
            }
        });

        // start at 0, 24s -> 0.2, 12s is dropped, 60s -> 0.5
        assertEquals(3, progress.size(), progress::toString);
        assertEquals(0.0, progress.get(0), 0.0001);
        assertEquals(0.2, progress.get(1), 0.0001);
        assertEquals(0.5, progress.get(2), 0.0001);
    }

    @Test
    @DisplayName("cancelAll should stop running and pending conversions and leave no output")
    void shouldCancelAll() throws Exception {
        List<ConversionRequest> requests = requests("slow.mov", "b.mov", "c.mov");
        BatchConversionService service = service(1);
        CountDownLatch encoding = new CountDownLatch(1);

        CompletableFuture<BatchReport> batch = CompletableFuture.supplyAsync(() ->
                service.convertAll(requests, snapshot -> {
                    if (snapshot.getJobSnapshots().stream().anyMatch(job -> job.isActive() && job.getProgress() > 0)) {
                        encoding.countDown();
                    }
                }));

        assertTrue(encoding.await(10, TimeUnit.SECONDS), "slow conversion never reported progress");
        assertTrue(service.isBatchRunning());
        service.cancelAll();
        BatchReport report = batch.get(15, TimeUnit.SECONDS);

        assertEquals(0, report.getSuccessful());
        assertEquals(3, report.getCancelled());
        assertTrue(report.wasCancelled());
        assertFalse(service.isBatchRunning());

        // The scheduler saw the killed encoder as a failed job
        JobSnapshot running = service.getProgress().getJobSnapshots().get(0);
        assertEquals(JobStatus.FAILED, running.getStatus());
        assertTrue(running.getMessage().contains("Conversion cancelled"), running.getMessage());
        assertEquals(2, service.getProgress().getCancelledJobs());
        for (ConversionRequest request : requests) {
            assertFalse(Files.exists(request.getOutputPath()), request.getOutputPath() + " was left behind");
        }
    }

    @Test
    @DisplayName("a rejected overlapping batch should not stop cancelAll from reaching the running encoder")
    void shouldKeepRunningBatchCancellableAfterRejectedOverlap() throws Exception {
        List<ConversionRequest> slow = requests("slow.mov");
        List<ConversionRequest> other = requests("other.mov");
        BatchConversionService service = service(2);
        CountDownLatch encoding = new CountDownLatch(1);

        CompletableFuture<BatchReport> batch = CompletableFuture.supplyAsync(() ->
                service.convertAll(slow, snapshot -> {
                    if (snapshot.getJobSnapshots().stream().anyMatch(job -> job.isActive() && job.getProgress() > 0)) {
                        encoding.countDown();
                    }
                }));

        assertTrue(encoding.await(10, TimeUnit.SECONDS), "slow conversion never reported progress");
        assertThrows(IllegalStateException.class, () -> service.convertAll(other, null));
        assertTrue(service.isBatchRunning());

        long cancelledAt = System.nanoTime();
        service.cancelAll();
        BatchReport report = batch.get(15, TimeUnit.SECONDS);
        long stopMillis = (System.nanoTime() - cancelledAt) / 1_000_000;

        assertEquals(0, report.getSuccessful());
        assertEquals(1, report.getCancelled());
        assertTrue(stopMillis < 10_000, "encoder kept running for " + stopMillis + "ms after cancelAll");
        assertFalse(Files.exists(slow.get(0).getOutputPath()));
        assertFalse(Files.exists(other.get(0).getOutputPath()));
    }

    @Test
    @DisplayName("an empty list should produce an empty report")
    void shouldHandleEmptyList() {
        BatchReport report = service(2).convertAll(List.of(), null);

        assertEquals(0, report.getTotalFiles());
        assertTrue(report.getResults().isEmpty());
        assertFalse(report.wasCancelled());
    }
}
