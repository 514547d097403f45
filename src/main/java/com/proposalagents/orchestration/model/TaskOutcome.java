package com.proposalagents.orchestration.model;

import java.util.Objects;

/**
 * Result of one generation call. A success carries the trimmed text; a failure carries
 * the reason and a human-readable detail. Exactly one of {@code payload} and
 * {@code failureReason} is set.
 */
public record TaskOutcome(
        AgentIdentity identity,
        OutcomeKind kind,
        String payload,
        FailureReason failureReason,
        String detail
) {

    public TaskOutcome {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(kind, "kind");
        if (kind == OutcomeKind.SUCCESS) {
            Objects.requireNonNull(payload, "payload");
            if (failureReason != null) {
                throw new IllegalArgumentException("success outcome must not carry a failure reason");
            }
            detail = null;
        } else {
            Objects.requireNonNull(failureReason, "failureReason");
            if (payload != null) {
                throw new IllegalArgumentException("failure outcome must not carry a payload");
            }
            detail = detail == null || detail.isBlank() ? failureReason.label() : detail;
        }
    }

    public static TaskOutcome success(AgentIdentity identity, String payload) {
        return new TaskOutcome(identity, OutcomeKind.SUCCESS, payload, null, null);
    }

    public static TaskOutcome failure(AgentIdentity identity, FailureReason reason, String detail) {
        return new TaskOutcome(identity, OutcomeKind.FAILURE, null, reason, detail);
    }

    public boolean succeeded() {
        return kind == OutcomeKind.SUCCESS;
    }

    public boolean failed() {
        return kind == OutcomeKind.FAILURE;
    }
}
