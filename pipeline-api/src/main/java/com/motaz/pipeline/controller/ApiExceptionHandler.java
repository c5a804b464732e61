package com.motaz.pipeline.controller;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import com.motaz.pipeline.dto.ErrorResponseDto;
import com.motaz.pipeline.exception.AnalysisAlreadyRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponseDto> configuration(ConfigurationException e) {
        log.warn("Rejected analysis configuration: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponseDto.builder()
                .error("configuration")
                .message(e.getMessage())
                .build());
    }

    @ExceptionHandler(AnalysisAlreadyRunningException.class)
    public ResponseEntity<ErrorResponseDto> alreadyRunning(AnalysisAlreadyRunningException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponseDto.builder()
                .error("busy")
                .message(e.getMessage())
                .build());
    }
}
