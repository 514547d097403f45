package com.proposalagents.orchestration.model;

public enum FailureReason {
    TIMEOUT("Timeout"),
    UPSTREAM_ERROR("Upstream error"),
    EMPTY_RESPONSE("Empty response"),
    MALFORMED_RESPONSE("Malformed response");

    private final String label;

    FailureReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
