package com.proposalagents.orchestration.model;

public enum PipelineStage {
    START,
    FAN_OUT,
    AGGREGATE,
    SYNTHESIZE,
    PERSIST,
    DONE
}
