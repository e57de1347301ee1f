package com.judgmentrag.service.workflow;

import org.springframework.stereotype.Component;

import com.judgmentrag.dto.internal.RetrievalResult;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.DimensionMismatchException;
import com.judgmentrag.exception.EmbeddingException;
import com.judgmentrag.exception.ProviderTransientException;
import com.judgmentrag.service.rag.CaseRetrievalService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * RETRIEVING: ranked cases for the original query.
 * <p>
 * No match is a normal outcome. An unavailable embedding provider degrades to "no evidence",
 * unless analysis was already degraded, in which case no provider is working and the query fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrievalStage implements WorkflowStage {

    private final CaseRetrievalService retrievalService;

    @Override
    public StageOutcome<WorkflowState> apply(WorkflowState state) {
        RetrievalResult result;
        try {
            result = retrievalService.retrieve(state.getQuery(), state.getTopKCases(), state.getFilters());
        } catch (ConfigurationException | DimensionMismatchException e) {
            return StageOutcome.fatal(state, "retrieval: " + e.getMessage());
        } catch (EmbeddingException | ProviderTransientException e) {
            if (state.isAnalysisDegraded()) {
                return StageOutcome.fatal(state, "generation and embedding providers are both unavailable");
            }
            log.warn("Retrieval unavailable, continuing without evidence: {}", e.getMessage());
            return StageOutcome.degraded(state.toBuilder()
                    .retrievalUnavailable(true)
                    .evidenceFound(false)
                    .reasoningStep("Retrieval unavailable: no case law could be searched")
                    .build(), "retrieval: " + e.getMessage());
        }

        boolean found = !result.isEmpty();
        log.info("Retrieval: {} cases from {} segments", result.cases().size(), result.segmentsConsidered());

        return StageOutcome.ok(state.toBuilder()
                .retrieval(result)
                .evidenceFound(found)
                .reasoningStep(found
                        ? String.format("Retrieved %d relevant case(s) from %d matching segments",
                                result.cases().size(), result.segmentsConsidered())
                        : "No indexed judgment matched the question")
                .build());
    }
}
