package com.judgmentrag.exception;

/**
 * Fatal misconfiguration (missing model settings, invalid chunking, ...). Never retried.
 */
public class ConfigurationException extends RagException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
