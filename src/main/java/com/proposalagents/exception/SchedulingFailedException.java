package com.proposalagents.exception;

/**
 * Thrown when the specialist batch could not be handed to the worker pool at all.
 */
public class SchedulingFailedException extends ProposalAgentsException {

    public SchedulingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
