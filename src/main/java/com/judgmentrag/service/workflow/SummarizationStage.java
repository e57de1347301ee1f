package com.judgmentrag.service.workflow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.CaseSummary;
import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.service.llm.GenerationStage;
import com.judgmentrag.service.llm.LegalLlmService;
import com.judgmentrag.util.PromptBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * SUMMARIZING: one summary per analysed case, generated concurrently.
 * <p>
 * Each prompt only carries the case's retrieved segments, capped in length. A case whose summary
 * fails is left out and listed in the state's summary failures; results keep the retrieval rank.
 */
@Slf4j
@Component
public class SummarizationStage implements WorkflowStage {

    private final LegalLlmService llmService;
    private final PromptBuilder promptBuilder;
    private final ModelConfig modelConfig;
    private final Executor summaryExecutor;

    public SummarizationStage(LegalLlmService llmService,
                              PromptBuilder promptBuilder,
                              ModelConfig modelConfig,
                              @Qualifier("summaryExecutor") Executor summaryExecutor) {
        this.llmService = llmService;
        this.promptBuilder = promptBuilder;
        this.modelConfig = modelConfig;
        this.summaryExecutor = summaryExecutor;
    }

    private record Attempt(RetrievedCase retrievedCase, CaseSummary summary, Throwable error) {
    }

    @Override
    public StageOutcome<WorkflowState> apply(WorkflowState state) {
        List<RetrievedCase> cases = state.analysedCases();

        List<CompletableFuture<Attempt>> futures = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            futures.add(submit(cases.get(i), i + 1));
        }

        List<CaseSummary> summaries = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (CompletableFuture<Attempt> future : futures) {
            Attempt attempt = future.join();
            if (attempt.error() instanceof ConfigurationException config) {
                return StageOutcome.fatal(state, "summarization: " + config.getMessage());
            }
            if (attempt.error() != null) {
                log.warn("Summary of case {} failed: {}",
                        attempt.retrievedCase().caseId(), attempt.error().getMessage());
                failures.add(attempt.retrievedCase().caseId());
            } else {
                summaries.add(attempt.summary());
            }
        }
        summaries.sort(Comparator.comparingInt(CaseSummary::rank));

        WorkflowState next = state.toBuilder()
                .clearSummaries().summaries(summaries)
                .clearSummaryFailures().summaryFailures(failures)
                .reasoningStep(String.format("Summarized %d of %d case(s)", summaries.size(), cases.size()))
                .build();

        if (failures.isEmpty()) {
            return StageOutcome.ok(next);
        }
        return StageOutcome.degraded(next, "summarization failed for " + String.join(", ", failures));
    }

    private CompletableFuture<Attempt> submit(RetrievedCase retrievedCase, int rank) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> summarize(retrievedCase, rank), summaryExecutor)
                    .handle((summary, error) -> new Attempt(retrievedCase, summary, unwrap(error)));
        } catch (RuntimeException e) {
            // executor saturated
            return CompletableFuture.completedFuture(new Attempt(retrievedCase, null, e));
        }
    }

    private CaseSummary summarize(RetrievedCase retrievedCase, int rank) {
        String excerpts = promptBuilder.joinExcerpts(
                retrievedCase.supportingSegments(), modelConfig.getSummaryContextChars());

        String summary = llmService.generate(
                GenerationStage.SUMMARIZATION,
                promptBuilder.buildSummarySystemPrompt(),
                promptBuilder.buildSummaryPrompt(retrievedCase, excerpts),
                modelConfig.getSummaryMaxTokens());

        return new CaseSummary(rank, retrievedCase.caseId(), retrievedCase.title(), retrievedCase.citation(),
                summary.trim());
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
