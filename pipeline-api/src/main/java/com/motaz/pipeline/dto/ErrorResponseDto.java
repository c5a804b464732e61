package com.motaz.pipeline.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorResponseDto {
    private String error;
    private String message;
}
