package com.proposalagents.orchestration.model;

public record SpecialistFailure(
        String identity,
        FailureReason reason,
        String detail
) {

    public static SpecialistFailure from(TaskOutcome outcome) {
        return new SpecialistFailure(outcome.identity().key(), outcome.failureReason(), outcome.detail());
    }
}
