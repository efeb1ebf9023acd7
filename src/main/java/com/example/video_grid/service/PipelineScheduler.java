package com.example.video_grid.service;

import com.example.video_grid.config.PipelineProperties;
import com.example.video_grid.exception.JobCancelledException;
import com.example.video_grid.model.ExtractionResult;
import com.example.video_grid.model.GridConfig;
import com.example.video_grid.model.JobSnapshot;
import com.example.video_grid.model.RunSummary;
import com.example.video_grid.model.VideoJob;
import com.example.video_grid.service.compose.GridComposer;
import com.example.video_grid.util.ExtractionPhase;
import com.example.video_grid.util.JobStatus;
import com.example.video_grid.util.VideoFileCollector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one extract/select/compose pipeline per job on the worker pool, at most
 * {@code pipeline.max-concurrency} past admission at a time.
 *
 * <p>Job state lives in a {@link JobTable}; workers only reach it through phase transitions, which
 * fail once cancellation was requested. A job waiting for admission stays {@code Queued}.
 */
@Service
public class PipelineScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineScheduler.class);

    static final double LOADING_PROGRESS = 0.1;
    static final double EXTRACTION_SHARE = 0.4;
    static final double SELECTION_START = 0.5;
    static final double SELECTION_SHARE = 0.3;
    static final double COMPOSING_PROGRESS = 0.8;

    private final FrameExtractionService extractionService;
    private final GridComposer composer;
    private final Executor executor;
    private final Clock clock;
    private final AdmissionGate gate;
    private final JobTable jobs = new JobTable();
    private final List<JobProgressListener> listeners = new CopyOnWriteArrayList<>();

    public PipelineScheduler(FrameExtractionService extractionService,
                             GridComposer composer,
                             @Qualifier("pipelineTaskExecutor") Executor executor,
                             PipelineProperties properties,
                             Clock clock) {
        this.extractionService = extractionService;
        this.composer = composer;
        this.executor = executor;
        this.clock = clock;
        this.gate = new AdmissionGate(properties.effectiveConcurrency());
        LOGGER.info("Pipeline scheduler ready maxConcurrency={}", gate.permits());
    }

    public UUID submit(Path source, GridConfig config, @Nullable Path outputFolder) {
        VideoJob job = new VideoJob(UUID.randomUUID(), source, config, outputFolder, clock.instant());
        JobSnapshot snapshot = jobs.add(job);
        LOGGER.info("JOB QUEUED jobId={} source={} grid={}x{}", job.getId(), source, config.rows(), config.columns());
        notifyProgress(snapshot);
        return job.getId();
    }

    /**
     * Expands directories and drops unsupported files before submitting.
     */
    public List<UUID> addVideos(Collection<Path> inputs, GridConfig config, @Nullable Path outputFolder) {
        List<Path> files = VideoFileCollector.collect(inputs);
        if (files.isEmpty()) {
            LOGGER.warn("No supported videos in inputs={}", inputs);
        }
        List<UUID> ids = new ArrayList<>(files.size());
        for (Path file : files) {
            ids.add(submit(file, config, outputFolder));
        }
        return ids;
    }

    /**
     * Starts every queued job. The future completes once all of them are terminal and never
     * completes exceptionally.
     */
    public CompletableFuture<RunSummary> runAll() {
        gate.reopen();
        List<VideoJob> claimed = jobs.claimQueued();
        LOGGER.info("RUN START jobs={} maxConcurrency={}", claimed.size(), gate.permits());
        long t0 = System.nanoTime();

        List<CompletableFuture<JobSnapshot>> futures = new ArrayList<>(claimed.size());
        for (VideoJob job : claimed) {
            futures.add(launch(job));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> {
                    RunSummary summary = summarize(futures.stream().map(CompletableFuture::join).toList());
                    LOGGER.info("RUN DONE completed={} cancelled={} failed={} in={}ms",
                            summary.completed(), summary.cancelled(), summary.failed(), (System.nanoTime() - t0) / 1_000_000);
                    return summary;
                });
    }

    /**
     * @return {@code true} if the job existed and was not yet terminal.
     */
    public boolean cancel(UUID jobId) {
        Optional<JobSnapshot> before = jobs.snapshot(jobId);
        if (before.isEmpty() || before.get().isComplete()) {
            return false;
        }
        LOGGER.info("JOB CANCEL requested jobId={}", jobId);
        jobs.requestCancel(jobId).ifPresent(this::notifyFinished);
        gate.wakeWaiters();
        return true;
    }

    public void cancelAll() {
        List<JobSnapshot> cancelled = jobs.requestCancelAll();
        gate.cancelAll();
        LOGGER.info("CANCEL ALL queuedCancelled={} inUse={} waiting={}", cancelled.size(), gate.inUse(), gate.waiting());
        cancelled.forEach(this::notifyFinished);
    }

    public List<JobSnapshot> jobs() {
        return jobs.snapshots();
    }

    public Optional<JobSnapshot> job(UUID jobId) {
        return jobs.snapshot(jobId);
    }

    public int clearCompleted() {
        return jobs.removeTerminal();
    }

    /** Cancels whatever is still running and forgets every job. */
    public int clearAll() {
        cancelAll();
        return jobs.clear();
    }

    public void addProgressListener(JobProgressListener listener) {
        listeners.add(listener);
    }

    public void removeProgressListener(JobProgressListener listener) {
        listeners.remove(listener);
    }

    AdmissionGate gate() {
        return gate;
    }

    @PreDestroy
    public void shutdown() {
        LOGGER.info("Pipeline scheduler shutting down");
        cancelAll();
    }

    private CompletableFuture<JobSnapshot> launch(VideoJob job) {
        try {
            return CompletableFuture.supplyAsync(() -> runJob(job), executor)
                    .exceptionally(ex -> {
                        LOGGER.error("JOB ABORTED jobId={}: {}", job.getId(), ex.toString(), ex);
                        jobs.markFailed(job.getId(), errorMessage(ex)).ifPresent(this::notifyFinished);
                        return finalSnapshot(job);
                    });
        } catch (RejectedExecutionException e) {
            LOGGER.error("JOB REJECTED jobId={} err={}", job.getId(), e.toString());
            jobs.markFailed(job.getId(), "worker pool rejected the job").ifPresent(this::notifyFinished);
            return CompletableFuture.completedFuture(finalSnapshot(job));
        }
    }

    private JobSnapshot runJob(VideoJob job) {
        UUID id = job.getId();
        CancellationToken token = new CancellationToken(id, () -> jobs.isCancelRequested(id));
        boolean acquired = false;
        long t0 = System.nanoTime();
        try {
            acquired = gate.acquire(token);
            if (!acquired) {
                LOGGER.info("JOB CANCELLED before admission jobId={}", id);
                jobs.markCancelled(id).ifPresent(this::notifyFinished);
                return finalSnapshot(job);
            }

            update(id, JobStatus.LOADING, LOADING_PROGRESS);
            LOGGER.info("JOB START jobId={} source={}", id, job.getSourcePath());

            GridConfig config = job.getConfig();
            ExtractionResult result = extractionService.extract(job.getSourcePath(), config.frameCount(), token,
                    (phase, fraction) -> onExtractionProgress(id, phase, fraction));

            update(id, JobStatus.COMPOSING, COMPOSING_PROGRESS);
            Path output = composer.compose(result.frames(), job.getSourcePath(), config, job.getOutputFolder());

            jobs.markComplete(id, output).ifPresent(this::notifyFinished);
            LOGGER.info("JOB DONE jobId={} output={} cached={} in={}ms", id, output, result.fromCache(), (System.nanoTime() - t0) / 1_000_000);
        } catch (JobCancelledException e) {
            LOGGER.info("JOB CANCELLED jobId={} in={}ms", id, (System.nanoTime() - t0) / 1_000_000);
            jobs.markCancelled(id).ifPresent(this::notifyFinished);
        } catch (Exception e) {
            LOGGER.error("JOB FAILED jobId={} source={}: {}", id, job.getSourcePath(), e.toString(), e);
            jobs.markFailed(id, errorMessage(e)).ifPresent(this::notifyFinished);
        } finally {
            if (acquired) {
                gate.release();
            }
        }
        return finalSnapshot(job);
    }

    private void onExtractionProgress(UUID id, ExtractionPhase phase, double fraction) {
        if (phase == ExtractionPhase.EXTRACTING) {
            update(id, JobStatus.EXTRACTING, LOADING_PROGRESS + EXTRACTION_SHARE * fraction);
        } else {
            update(id, JobStatus.SELECTING, SELECTION_START + SELECTION_SHARE * fraction);
        }
    }

    private void update(UUID id, JobStatus status, double progress) {
        notifyProgress(jobs.transition(id, status, progress));
    }

    private JobSnapshot finalSnapshot(VideoJob job) {
        return jobs.snapshot(job.getId()).orElseGet(() -> new JobSnapshot(job.getId(), job.getSourcePath(),
                JobStatus.CANCELLED, JobStatus.CANCELLED.label(), 0.0, null, true, true, null));
    }

    static RunSummary summarize(List<JobSnapshot> results) {
        int completed = 0;
        int cancelled = 0;
        int failed = 0;
        Path last = null;
        for (JobSnapshot s : results) {
            switch (s.status()) {
                case COMPLETE -> {
                    completed++;
                    if (s.outputPath() != null) {
                        last = s.outputPath();
                    }
                }
                case FAILED -> failed++;
                default -> cancelled++;
            }
        }
        return new RunSummary(completed, cancelled, failed, last);
    }

    private static String errorMessage(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private void notifyProgress(JobSnapshot snapshot) {
        for (JobProgressListener listener : listeners) {
            try {
                listener.onProgress(snapshot.id(), snapshot.progress(), snapshot.statusText());
            } catch (RuntimeException e) {
                LOGGER.warn("Progress listener failed jobId={} err={}", snapshot.id(), e.toString());
            }
        }
    }

    private void notifyFinished(JobSnapshot snapshot) {
        notifyProgress(snapshot);
        for (JobProgressListener listener : listeners) {
            try {
                listener.onFinished(snapshot);
            } catch (RuntimeException e) {
                LOGGER.warn("Finish listener failed jobId={} err={}", snapshot.id(), e.toString());
            }
        }
    }
}
