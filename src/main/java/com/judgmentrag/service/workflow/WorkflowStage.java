package com.judgmentrag.service.workflow;

/**
 * One step of the reasoning workflow. Implementations never mutate the input state.
 */
@FunctionalInterface
public interface WorkflowStage {

    StageOutcome<WorkflowState> apply(WorkflowState state);
}
