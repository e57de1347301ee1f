package com.judgmentrag.exception;

/**
 * A model provider call timed out or failed in a way that may succeed on a second attempt.
 */
public class ProviderTransientException extends RagException {

    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
