package com.example.video_grid.runner;

import com.example.video_grid.config.GridProperties;
import com.example.video_grid.model.GridConfig;
import com.example.video_grid.model.JobSnapshot;
import com.example.video_grid.model.RunSummary;
import com.example.video_grid.service.PipelineScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Treats every non-option argument as a video file or folder and builds one grid per video.
 */
@Component
public class GridGenerationRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GridGenerationRunner.class);

    private final PipelineScheduler scheduler;
    private final GridProperties gridProperties;
    private volatile int exitCode;

    public GridGenerationRunner(PipelineScheduler scheduler, GridProperties gridProperties) {
        this.scheduler = scheduler;
        this.gridProperties = gridProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Path> inputs = args.getNonOptionArgs().stream().map(Path::of).toList();
        if (inputs.isEmpty()) {
            LOGGER.info("No inputs given. Usage: video-grid [--grid.rows=N --grid.columns=N ...] <video or folder>...");
            return;
        }

        GridConfig config = gridProperties.toGridConfig();
        List<UUID> ids = scheduler.addVideos(inputs, config, gridProperties.getOutputFolder());
        if (ids.isEmpty()) {
            exitCode = 2;
            return;
        }
        scheduler.addProgressListener((jobId, fraction, label) ->
                LOGGER.debug("PROGRESS jobId={} {}% {}", jobId, Math.round(fraction * 100), label));

        RunSummary summary = scheduler.runAll().join();
        for (JobSnapshot job : scheduler.jobs()) {
            if (job.outputPath() != null) {
                LOGGER.info("{} -> {}", job.sourcePath().getFileName(), job.outputPath());
            } else {
                LOGGER.info("{} -> {}", job.sourcePath().getFileName(), job.statusText());
            }
        }
        LOGGER.info("Finished {} video(s): completed={} cancelled={} failed={}",
                summary.total(), summary.completed(), summary.cancelled(), summary.failed());
        exitCode = summary.failed() > 0 ? 1 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
