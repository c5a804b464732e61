package com.motaz.pipeline;

import com.motaz.pipeline.dto.AnalysisResultDto;
import com.motaz.pipeline.model.JobState;
import com.motaz.pipeline.model.JobStatus;
import com.motaz.pipeline.services.ModelRegistryService;
import com.motaz.pipeline.services.PipelineOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PipelineApiApplicationTest {

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private ModelRegistryService modelRegistryService;

    @Test
    void fullRunCompletesAndRegistersTheModel() throws Exception {
        JobStatus started = orchestrator.start(null);
        orchestrator.currentRun().orElseThrow().get(2, TimeUnit.MINUTES);

        JobStatus status = orchestrator.status();
        assertThat(status.getState()).as("error: %s", status.getError()).isEqualTo(JobState.COMPLETED);
        assertThat(status.getJobId()).isEqualTo(started.getJobId());
        AnalysisResultDto result = orchestrator.results().orElseThrow();
        assertThat(result.getDataSummary().getAssets()).isEqualTo(2);
        assertThat(result.getConfig().getWindowSize()).isEqualTo(40);
        assertThat(result.getModelId()).isNotNull();
        assertThat(modelRegistryService.loadLatest()).isPresent();
    }
}
