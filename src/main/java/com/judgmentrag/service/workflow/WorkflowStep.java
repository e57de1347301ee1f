package com.judgmentrag.service.workflow;

public enum WorkflowStep {
    ANALYZING,
    RETRIEVING,
    SUMMARIZING,
    SYNTHESIZING,
    DONE,
    FAILED
}
