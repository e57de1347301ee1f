package com.judgmentrag.service.workflow;

import org.springframework.stereotype.Service;

import com.judgmentrag.service.monitoring.QueryTimer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a query through the stages in order:
 * ANALYZING, RETRIEVING, SUMMARIZING (only with evidence), SYNTHESIZING, then DONE.
 * The direct path starts at RETRIEVING and skips SUMMARIZING. A fatal stage outcome ends the
 * run in FAILED with the reason recorded on the state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegalReasoningWorkflow {

    private final QueryAnalysisStage analysisStage;
    private final RetrievalStage retrievalStage;
    private final SummarizationStage summarizationStage;
    private final SynthesisStage synthesisStage;

    public WorkflowState run(WorkflowState initial, QueryTimer timer) {
        WorkflowState state = initial;
        boolean agentic = state.getPath() == WorkflowPath.AGENTIC;

        /* =========================
           STEP 1: QUERY ANALYSIS
           ========================= */
        if (agentic) {
            state = advance(state, WorkflowStep.ANALYZING, analysisStage, timer, "Query Analysis");
            if (state.getStep() == WorkflowStep.FAILED) {
                return state;
            }
        }

        /* =========================
           STEP 2: RETRIEVAL
           ========================= */
        state = advance(state, WorkflowStep.RETRIEVING, retrievalStage, timer, "Retrieval");
        if (state.getStep() == WorkflowStep.FAILED) {
            return state;
        }

        /* =========================
           STEP 3: CASE SUMMARIES
           ========================= */
        if (agentic && state.isEvidenceFound()) {
            state = advance(state, WorkflowStep.SUMMARIZING, summarizationStage, timer, "Case Summaries");
            if (state.getStep() == WorkflowStep.FAILED) {
                return state;
            }
        }

        /* =========================
           STEP 4: SYNTHESIS
           ========================= */
        state = advance(state, WorkflowStep.SYNTHESIZING, synthesisStage, timer,
                agentic ? "Synthesis" : "Direct Synthesis");
        if (state.getStep() == WorkflowStep.FAILED) {
            return state;
        }

        return state.withStep(WorkflowStep.DONE);
    }

    private WorkflowState advance(WorkflowState state,
                                  WorkflowStep step,
                                  WorkflowStage stage,
                                  QueryTimer timer,
                                  String timerLabel) {

        log.debug("Workflow step {}", step);
        StageOutcome<WorkflowState> outcome = stage.apply(state.withStep(step));
        timer.mark(timerLabel);

        if (outcome.isFatal()) {
            log.error("Workflow failed at {}: {}", step, outcome.reason());
            return outcome.value().failed(outcome.reason());
        }
        if (outcome.isDegraded()) {
            log.warn("Step {} degraded: {}", step, outcome.reason());
            return outcome.value().toBuilder().degradation(outcome.reason()).build();
        }
        return outcome.value();
    }
}
