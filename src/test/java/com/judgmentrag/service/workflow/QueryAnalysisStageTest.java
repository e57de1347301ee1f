package com.judgmentrag.service.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.judgmentrag.TestSupport;
import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.ProviderTransientException;
import com.judgmentrag.service.llm.GenerationStage;
import com.judgmentrag.service.llm.LegalLlmService;
import com.judgmentrag.util.LegalTextTokenizer;
import com.judgmentrag.util.PromptBuilder;

@ExtendWith(MockitoExtension.class)
class QueryAnalysisStageTest {

    private static final String QUERY = "Is privacy a fundamental right under Article 21?";

    @Mock
    private LegalLlmService llmService;

    private QueryAnalysisStage stage;
    private WorkflowState state;

    @BeforeEach
    void setUp() {
        stage = new QueryAnalysisStage(llmService, new PromptBuilder(), new LegalTextTokenizer(),
                new ModelConfig(), TestSupport.objectMapper());
        state = WorkflowState.initial(QUERY, WorkflowPath.AGENTIC, 5, 3, SearchFilters.none());
    }

    private void reply(String response) {
        when(llmService.generate(eq(GenerationStage.ANALYSIS), anyString(), anyString(), anyInt()))
                .thenReturn(response);
    }

    @Test
    @DisplayName("reads issues and keywords from a JSON reply")
    void json() {
        reply("{\"legal_issues\": [\"Scope of Article 21\", \"Status of privacy\"], \"keywords\": [\"privacy\", \"article 21\"]}");

        StageOutcome<WorkflowState> outcome = stage.apply(state);

        assertThat(outcome.status()).isEqualTo(StageOutcome.Status.OK);
        assertThat(outcome.value().getExtractedIssues()).containsExactly("Scope of Article 21", "Status of privacy");
        assertThat(outcome.value().getKeywords()).containsExactly("privacy", "article 21");
        assertThat(outcome.value().isAnalysisDegraded()).isFalse();
    }

    @Test
    @DisplayName("finds a JSON block inside surrounding prose")
    void embeddedJson() {
        reply("Sure! Here is the analysis:\n```json\n{\"legal_issues\": [\"Privacy as a right\"], \"keywords\": []}\n```");

        StageOutcome<WorkflowState> outcome = stage.apply(state);

        assertThat(outcome.status()).isEqualTo(StageOutcome.Status.OK);
        assertThat(outcome.value().getExtractedIssues()).containsExactly("Privacy as a right");
        assertThat(outcome.value().getKeywords()).contains("privacy", "fundamental");
    }

    @Test
    @DisplayName("falls back to bullet sections")
    void bullets() {
        reply("Legal issues:\n- Whether privacy is protected\n- Limits on state surveillance\nKeywords:\n* privacy\n* surveillance");

        StageOutcome<WorkflowState> outcome = stage.apply(state);

        assertThat(outcome.value().getExtractedIssues())
                .containsExactly("Whether privacy is protected", "Limits on state surveillance");
        assertThat(outcome.value().getKeywords()).containsExactly("privacy", "surveillance");
    }

    @Test
    @DisplayName("an unparseable reply degrades to the query as the only issue")
    void unparseable() {
        reply("I cannot help with that.");

        StageOutcome<WorkflowState> outcome = stage.apply(state);

        assertThat(outcome.status()).isEqualTo(StageOutcome.Status.DEGRADED);
        assertThat(outcome.value().getExtractedIssues()).containsExactly(QUERY);
        assertThat(outcome.value().isAnalysisDegraded()).isTrue();
    }

    @Test
    @DisplayName("a provider failure degrades with tokenizer keywords")
    void providerFailure() {
        when(llmService.generate(eq(GenerationStage.ANALYSIS), anyString(), anyString(), anyInt()))
                .thenThrow(new ProviderTransientException("timed out"));

        StageOutcome<WorkflowState> outcome = stage.apply(state);

        assertThat(outcome.status()).isEqualTo(StageOutcome.Status.DEGRADED);
        assertThat(outcome.value().getExtractedIssues()).containsExactly(QUERY);
        assertThat(outcome.value().getKeywords()).contains("privacy", "article");
    }

    @Test
    @DisplayName("a configuration error is fatal")
    void configurationError() {
        when(llmService.generate(eq(GenerationStage.ANALYSIS), anyString(), anyString(), anyInt()))
                .thenThrow(new ConfigurationException("model not found"));

        assertThat(stage.apply(state).isFatal()).isTrue();
    }
}
