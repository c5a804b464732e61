package com.motaz.pipeline.controller;

import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.dto.AnalysisConfigDto;
import com.motaz.pipeline.dto.AnalysisRequestDto;
import com.motaz.pipeline.dto.AnalysisResultDto;
import com.motaz.pipeline.dto.DataPreviewResponseDto;
import com.motaz.pipeline.dto.DataSummaryDto;
import com.motaz.pipeline.dto.SampleDto;
import com.motaz.pipeline.model.JobStatus;
import com.motaz.pipeline.services.AnalysisConfigService;
import com.motaz.pipeline.services.PipelineOrchestrator;
import com.motaz.pipeline.services.SensorDataSource;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private static final int PREVIEW_SAMPLES = 1000;

    private final PipelineOrchestrator orchestrator;
    private final AnalysisConfigService analysisConfigService;
    private final SensorDataSource sensorDataSource;

    @PostMapping("/analysis/start")
    public ResponseEntity<JobStatus> start(@RequestBody(required = false) AnalysisRequestDto request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.start(request));
    }

    @GetMapping("/analysis/status")
    public JobStatus status() {
        return orchestrator.status();
    }

    @GetMapping("/analysis/results")
    public ResponseEntity<AnalysisResultDto> results() {
        return orchestrator.results()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/analysis/config")
    public AnalysisConfigDto config() {
        return AnalysisConfigDto.from(analysisConfigService.defaults());
    }

    @PostMapping("/data/preview")
    public DataPreviewResponseDto preview(
            @Parameter(description = "Seed for the synthetic series", example = "42")
            @RequestParam(name = "seed", required = false) Long seed) {
        List<Sample> samples = sensorDataSource.load(seed);
        return DataPreviewResponseDto.builder()
                .statistics(DataSummaryDto.of(samples))
                .data(samples.stream().limit(PREVIEW_SAMPLES).map(SampleDto::from).collect(Collectors.toList()))
                .build();
    }
}
