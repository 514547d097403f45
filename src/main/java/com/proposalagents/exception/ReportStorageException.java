package com.proposalagents.exception;

/**
 * Thrown when a report could not be written under either its derived name or the fallback name.
 */
public class ReportStorageException extends ProposalAgentsException {

    public ReportStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
