package com.judgmentrag.service.workflow;

import java.util.List;

import org.springframework.stereotype.Component;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.ProviderTransientException;
import com.judgmentrag.service.llm.GenerationStage;
import com.judgmentrag.service.llm.LegalLlmService;
import com.judgmentrag.util.PromptBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * SYNTHESIZING: the final answer and its follow-up questions.
 * <p>
 * Without evidence the answer is fixed text and the model is not called. On the agentic path the
 * prompt carries the case summaries, or the raw segments when every summary failed; on the direct
 * path it carries the raw segments of all retrieved cases.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SynthesisStage implements WorkflowStage {

    private final LegalLlmService llmService;
    private final PromptBuilder promptBuilder;
    private final AnswerComposer composer;
    private final ModelConfig modelConfig;

    @Override
    public StageOutcome<WorkflowState> apply(WorkflowState state) {
        if (!state.isEvidenceFound()) {
            return StageOutcome.ok(state.toBuilder()
                    .finalAnswer(composer.insufficientEvidence(state.getQuery(), state.isRetrievalUnavailable()))
                    .clearFollowUps().followUps(composer.boundFollowUps(List.of(), issues(state)))
                    .reasoningStep("Insufficient evidence: answered without case law")
                    .build());
        }

        boolean direct = state.getPath() == WorkflowPath.DIRECT;
        List<RetrievedCase> cited = direct ? state.retrievedCases() : state.analysedCases();

        String reply;
        try {
            reply = llmService.generate(
                    GenerationStage.SYNTHESIS,
                    promptBuilder.buildSystemPrompt(),
                    direct ? directPrompt(state) : synthesisPrompt(state),
                    modelConfig.getSynthesisMaxTokens());
        } catch (ConfigurationException e) {
            return StageOutcome.fatal(state, "synthesis: " + e.getMessage());
        } catch (ProviderTransientException e) {
            log.warn("Synthesis unavailable, returning an extractive answer: {}", e.getMessage());
            return StageOutcome.degraded(state.toBuilder()
                    .finalAnswer(composer.extractive(cited, state.getSummaries()))
                    .clearFollowUps().followUps(composer.boundFollowUps(List.of(), issues(state)))
                    .reasoningStep("Synthesis unavailable: listed the most relevant cases instead")
                    .build(), "synthesis: " + e.getMessage());
        }

        AnswerComposer.Reply parsed = composer.parse(reply);
        String answer = composer.attribute(parsed.answer(), cited);

        return StageOutcome.ok(state.toBuilder()
                .finalAnswer(answer)
                .clearFollowUps().followUps(composer.boundFollowUps(parsed.followUps(), issues(state)))
                .reasoningStep(direct
                        ? String.format("Answered directly from %d retrieved case(s)", cited.size())
                        : String.format("Synthesized answer from %d case analysis(es)", cited.size()))
                .build());
    }

    private String synthesisPrompt(WorkflowState state) {
        String evidence = state.getSummaries().isEmpty()
                ? promptBuilder.formatCaseContext(state.analysedCases(), modelConfig.getSummaryContextChars())
                : promptBuilder.formatSummaries(state.getSummaries());

        return promptBuilder.buildSynthesisPrompt(
                state.getQuery(), issues(state), state.retrievedCases(), evidence);
    }

    private String directPrompt(WorkflowState state) {
        List<RetrievedCase> cases = state.retrievedCases();
        return promptBuilder.buildDirectPrompt(
                state.getQuery(), promptBuilder.formatCaseContext(cases, modelConfig.getSummaryContextChars()));
    }

    private List<String> issues(WorkflowState state) {
        return state.getExtractedIssues().isEmpty() ? List.of(state.getQuery()) : state.getExtractedIssues();
    }
}
