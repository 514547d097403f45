package com.proposalagents.exception;

import java.time.Duration;

public class GenerationTimeoutException extends GenerationException {

    private final Duration timeout;

    public GenerationTimeoutException(Duration timeout) {
        super("No response within " + timeout);
        this.timeout = timeout;
    }

    public GenerationTimeoutException(Duration timeout, Throwable cause) {
        super("No response within " + timeout, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
