package com.motaz.pipeline.model;

public enum JobState {
    IDLE,
    RUNNING,
    COMPLETED,
    ERROR
}
