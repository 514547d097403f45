package com.proposalagents.exception;

/**
 * Raised by a generation capability when the provider call did not produce usable text.
 * Subclasses narrow the cause so the invoker can classify it without inspecting provider types.
 */
public class GenerationException extends ProposalAgentsException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
