package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.dto.AnalysisRequestDto;
import com.motaz.pipeline.dto.AnalysisResultDto;
import com.motaz.pipeline.exception.AnalysisAlreadyRunningException;
import com.motaz.pipeline.model.JobState;
import com.motaz.pipeline.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the single analysis slot. A start request while a run is active is rejected, never queued.
 * All state transitions happen under one monitor and publish a new immutable {@link JobStatus}.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final AnalysisRunner analysisRunner;
    private final AnalysisConfigService analysisConfigService;
    private final ExecutorService analysisExecutor;

    private final Object lock = new Object();
    private JobStatus status = JobStatus.idle();
    private AnalysisResultDto results;
    private CompletableFuture<AnalysisResultDto> currentRun;

    public PipelineOrchestrator(AnalysisRunner analysisRunner,
                                AnalysisConfigService analysisConfigService,
                                @Qualifier("analysisExecutor") ExecutorService analysisExecutor) {
        this.analysisRunner = analysisRunner;
        this.analysisConfigService = analysisConfigService;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Validates the configuration, claims the slot and submits the run.
     *
     * @throws com.motaz.pipeline.analysis.exception.ConfigurationException before the slot is claimed
     * @throws AnalysisAlreadyRunningException                             when a run is in flight
     */
    public JobStatus start(AnalysisRequestDto request) {
        AnalysisConfig config = analysisConfigService.resolve(request);
        Long seed = request != null ? request.getSeed() : null;
        synchronized (lock) {
            if (status.isRunning()) {
                throw new AnalysisAlreadyRunningException(status.getJobId());
            }
            String jobId = UUID.randomUUID().toString();
            status = JobStatus.builder()
                    .jobId(jobId)
                    .state(JobState.RUNNING)
                    .progress(0)
                    .currentStep("Initializing")
                    .startedAt(Instant.now())
                    .build();
            results = null;
            try {
                currentRun = CompletableFuture.supplyAsync(() -> execute(jobId, config, seed), analysisExecutor);
            } catch (RejectedExecutionException e) {
                status = failed(status, "Initializing", "Analysis executor rejected the run");
                throw e;
            }
            log.info("Analysis {} started", jobId);
            return status;
        }
    }

    public JobStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public Optional<AnalysisResultDto> results() {
        synchronized (lock) {
            return Optional.ofNullable(results);
        }
    }

    /**
     * The future of the latest run. It completes with null when that run failed with an exception
     * and exceptionally when it failed with an {@link Error}; the status is ERROR in both cases.
     */
    public Optional<CompletableFuture<AnalysisResultDto>> currentRun() {
        synchronized (lock) {
            return Optional.ofNullable(currentRun);
        }
    }

    private AnalysisResultDto execute(String jobId, AnalysisConfig config, Long seed) {
        try {
            AnalysisResultDto result = analysisRunner.run(jobId, config, seed,
                    (stage, progress) -> checkpoint(jobId, stage, progress));
            synchronized (lock) {
                results = result;
                status = status.toBuilder()
                        .state(JobState.COMPLETED)
                        .progress(100)
                        .currentStep("Analysis Complete")
                        .finishedAt(Instant.now())
                        .build();
            }
            log.info("Analysis {} completed", jobId);
            return result;
        } catch (Exception e) {
            fail(jobId, e);
            return null;
        } catch (Error e) {
            fail(jobId, e);
            throw e;
        }
    }

    private void fail(String jobId, Throwable cause) {
        synchronized (lock) {
            String stage = status.getCurrentStep();
            log.error("Analysis {} failed in stage '{}'", jobId, stage, cause);
            results = null;
            status = failed(status, stage, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        }
    }

    private void checkpoint(String jobId, String stage, int progress) {
        synchronized (lock) {
            if (!jobId.equals(status.getJobId()) || !status.isRunning()) {
                return;
            }
            status = status.toBuilder()
                    .currentStep(stage)
                    .progress(Math.max(status.getProgress(), progress))
                    .build();
        }
        log.debug("Analysis {}: {} ({}%)", jobId, stage, progress);
    }

    private static JobStatus failed(JobStatus current, String stage, String message) {
        return current.toBuilder()
                .state(JobState.ERROR)
                .progress(0)
                .failedStage(stage)
                .error(message)
                .finishedAt(Instant.now())
                .build();
    }
}
