package com.proposalagents.orchestration.model;

public enum JobStatus {
    SUCCESS("success"),
    PARTIAL_SUCCESS("partial_success"),
    ERROR("error");

    private final String wireValue;

    JobStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean producedArtifact() {
        return this != ERROR;
    }
}
