package com.judgmentrag.service.workflow;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.dto.response.ProcessingInfo;
import com.judgmentrag.dto.response.RelatedCase;
import com.judgmentrag.dto.response.StructuredAnswer;

/**
 * Final workflow state to response. Pure; absent values become empty ones.
 */
@Component
public class AnswerFormatter {

    public StructuredAnswer format(WorkflowState state) {
        List<RelatedCase> related = new ArrayList<>();
        for (RetrievedCase c : state.retrievedCases()) {
            related.add(RelatedCase.builder()
                    .caseId(c.caseId())
                    .title(c.title())
                    .citation(c.citation())
                    .court(c.metadata().court())
                    .decisionDate(c.metadata().decisionDate())
                    .score(c.score())
                    .build());
        }

        int analysed = state.getPath() == WorkflowPath.AGENTIC
                ? state.analysedCases().size()
                : state.retrievedCases().size();

        return StructuredAnswer.builder()
                .query(state.getQuery())
                .answer(state.getFinalAnswer() != null ? state.getFinalAnswer() : "")
                .relatedCases(related)
                .legalIssues(new ArrayList<>(state.getExtractedIssues()))
                .followUpQuestions(new ArrayList<>(state.getFollowUps()))
                .reasoningSteps(new ArrayList<>(state.getReasoningSteps()))
                .processingInfo(ProcessingInfo.builder()
                        .casesRetrieved(state.retrievedCases().size())
                        .casesAnalyzed(analysed)
                        .summaryFailures(new ArrayList<>(state.getSummaryFailures()))
                        .degradations(new ArrayList<>(state.getDegradations()))
                        .build())
                .mode(state.getPath() != null ? state.getPath().mode() : WorkflowPath.AGENTIC.mode())
                .evidenceFound(state.isEvidenceFound())
                .degraded(state.isDegraded())
                .build();
    }
}
