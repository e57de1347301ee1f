package com.judgmentrag.service.workflow;

import java.util.List;

import com.judgmentrag.dto.internal.CaseSummary;
import com.judgmentrag.dto.internal.RetrievalResult;
import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.dto.internal.SearchFilters;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything one query has accumulated so far. Each stage returns a new copy.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowState {

    String query;

    WorkflowPath path;

    int topKCases;

    int casesAnalyzed;

    @Builder.Default
    SearchFilters filters = SearchFilters.none();

    @Builder.Default
    WorkflowStep step = WorkflowStep.ANALYZING;

    // ================= ANALYSIS =================
    @Singular("extractedIssue")
    List<String> extractedIssues;

    @Singular
    List<String> keywords;

    boolean analysisDegraded;

    // ================= RETRIEVAL =================
    @Builder.Default
    RetrievalResult retrieval = RetrievalResult.empty();

    boolean evidenceFound;

    /**
     * Retrieval failed because the embedding provider was unavailable
     */
    boolean retrievalUnavailable;

    // ================= SUMMARIZATION =================
    @Singular
    List<CaseSummary> summaries;

    @Singular
    List<String> summaryFailures;

    // ================= SYNTHESIS =================
    String finalAnswer;

    @Singular
    List<String> followUps;

    // ================= TRACE =================
    @Singular
    List<String> reasoningSteps;

    @Singular
    List<String> degradations;

    String failureReason;

    public static WorkflowState initial(String query, WorkflowPath path, int topKCases, int casesAnalyzed,
                                        SearchFilters filters) {
        return WorkflowState.builder()
                .query(query)
                .path(path)
                .topKCases(topKCases)
                .casesAnalyzed(casesAnalyzed)
                .filters(filters != null ? filters : SearchFilters.none())
                .step(path == WorkflowPath.DIRECT ? WorkflowStep.RETRIEVING : WorkflowStep.ANALYZING)
                .build();
    }

    public List<RetrievedCase> retrievedCases() {
        return retrieval.cases();
    }

    /**
     * The retrieved cases that summarization and attribution work on.
     */
    public List<RetrievedCase> analysedCases() {
        List<RetrievedCase> cases = retrieval.cases();
        return cases.size() > casesAnalyzed ? cases.subList(0, casesAnalyzed) : cases;
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }

    public WorkflowState withStep(WorkflowStep next) {
        return toBuilder().step(next).build();
    }

    public WorkflowState failed(String reason) {
        return toBuilder().step(WorkflowStep.FAILED).failureReason(reason).build();
    }
}
