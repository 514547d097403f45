package com.proposalagents.exception;

public class MalformedGenerationResponseException extends GenerationException {

    public MalformedGenerationResponseException(String message) {
        super(message);
    }

    public MalformedGenerationResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
