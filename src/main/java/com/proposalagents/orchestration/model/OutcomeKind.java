package com.proposalagents.orchestration.model;

public enum OutcomeKind {
    SUCCESS,
    FAILURE
}
