package com.motaz.pipeline.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DataPreviewResponseDto {
    private DataSummaryDto statistics;
    private List<SampleDto> data;
}
