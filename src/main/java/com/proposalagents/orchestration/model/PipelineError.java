package com.proposalagents.orchestration.model;

public enum PipelineError {
    VALIDATION_FAILED,
    SCHEDULING_FAILED,
    SYNTHESIS_FAILED,
    PERSISTENCE_FAILED
}
