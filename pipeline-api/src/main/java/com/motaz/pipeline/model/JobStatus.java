package com.motaz.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of the orchestrator's job. Every transition replaces the snapshot.
 */
@Value
@Builder(toBuilder = true)
public class JobStatus {
    String jobId;
    JobState state;
    int progress;
    String currentStep;
    String failedStage;
    String error;
    Instant startedAt;
    Instant finishedAt;

    public static JobStatus idle() {
        return JobStatus.builder()
                .state(JobState.IDLE)
                .progress(0)
                .currentStep("")
                .build();
    }

    public boolean isRunning() {
        return state == JobState.RUNNING;
    }
}
