package com.proposalagents.exception;

/**
 * Base exception for proposal-agents errors that cross a component boundary.
 */
public class ProposalAgentsException extends RuntimeException {

    public ProposalAgentsException(String message) {
        super(message);
    }

    public ProposalAgentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
