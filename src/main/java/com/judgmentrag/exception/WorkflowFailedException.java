package com.judgmentrag.exception;

public class WorkflowFailedException extends RagException {

    public WorkflowFailedException(String message) {
        super(message);
    }

    public WorkflowFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
