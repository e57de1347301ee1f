package com.judgmentrag.service.workflow;

/**
 * AGENTIC runs all four stages; DIRECT goes from retrieval straight to one synthesis call.
 */
public enum WorkflowPath {

    AGENTIC("agentic"),
    DIRECT("direct");

    private final String mode;

    WorkflowPath(String mode) {
        this.mode = mode;
    }

    public String mode() {
        return mode;
    }
}
