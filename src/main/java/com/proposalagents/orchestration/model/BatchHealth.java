package com.proposalagents.orchestration.model;

public enum BatchHealth {
    ALL_SUCCEEDED,
    PARTIALLY_FAILED
}
