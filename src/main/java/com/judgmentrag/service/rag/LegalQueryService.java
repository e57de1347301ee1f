package com.judgmentrag.service.rag;

import java.util.Optional;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.dto.internal.TimingInfo;
import com.judgmentrag.dto.response.StructuredAnswer;
import com.judgmentrag.exception.WorkflowFailedException;
import com.judgmentrag.model.CaseRecord;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.service.monitoring.PerformanceMonitorService;
import com.judgmentrag.service.monitoring.QueryTimer;
import com.judgmentrag.service.workflow.AnswerFormatter;
import com.judgmentrag.service.workflow.LegalReasoningWorkflow;
import com.judgmentrag.service.workflow.WorkflowPath;
import com.judgmentrag.service.workflow.WorkflowState;
import com.judgmentrag.service.workflow.WorkflowStep;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Online entry points: answering a question and looking a case up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegalQueryService {

    static final String MDC_QUERY_ID = "queryId";

    private final LegalReasoningWorkflow workflow;
    private final AnswerFormatter formatter;
    private final CaseStore caseStore;
    private final PerformanceMonitorService performanceMonitor;
    private final ModelConfig modelConfig;

    /**
     * Runs the agentic or direct workflow and formats its result.
     *
     * @param topKCases     cases to retrieve, configured default when null
     * @param casesAnalyzed cases to summarize, configured default when null
     * @throws WorkflowFailedException on configuration errors or when no provider is reachable
     */
    public StructuredAnswer answerQuery(String query,
                                        boolean useAgentic,
                                        Integer topKCases,
                                        Integer casesAnalyzed,
                                        SearchFilters filters) {

        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }

        WorkflowPath path = useAgentic ? WorkflowPath.AGENTIC : WorkflowPath.DIRECT;
        int topK = topKCases != null && topKCases > 0 ? topKCases : modelConfig.getTopKCases();
        int analysed = casesAnalyzed != null && casesAnalyzed > 0 ? casesAnalyzed : modelConfig.getCasesAnalyzed();

        MDC.put(MDC_QUERY_ID, UUID.randomUUID().toString().substring(0, 8));
        QueryTimer timer = QueryTimer.started();
        try {
            log.info("{} query: {}", path.mode(), truncate(query, 80));

            WorkflowState result = workflow.run(
                    WorkflowState.initial(query, path, topK, analysed, filters), timer);
            timer.end();

            TimingInfo timing = TimingInfo.from(timer);

            if (result.getStep() == WorkflowStep.FAILED) {
                performanceMonitor.addQuery(query, timing, path.mode(), "failed");
                throw new WorkflowFailedException(result.getFailureReason());
            }

            StructuredAnswer answer = formatter.format(result);
            answer.setTiming(timing);
            answer.setTimingDisplay(timer.formatDisplay());

            performanceMonitor.addQuery(query, timing, path.mode(), answer.isDegraded() ? "degraded" : "ok");
            log.info("Answered in {}s ({} cases, degraded={})",
                    String.format("%.2f", timing.getTotalTime()), answer.getRelatedCases().size(), answer.isDegraded());
            return answer;

        } finally {
            MDC.remove(MDC_QUERY_ID);
        }
    }

    public StructuredAnswer answerQuery(String query, boolean useAgentic, Integer topKCases, Integer casesAnalyzed) {
        return answerQuery(query, useAgentic, topKCases, casesAnalyzed, SearchFilters.none());
    }

    public Optional<CaseRecord> getCase(String caseId) {
        return caseStore.find(caseId);
    }

    private String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
