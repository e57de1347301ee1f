package com.judgmentrag.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.judgmentrag.TestSupport;
import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.util.LegalTextTokenizer;

@ExtendWith(MockitoExtension.class)
class SuggestionServiceTest {

    @Mock
    private CaseStore caseStore;

    private SuggestionService suggestionService;

    @BeforeEach
    void setUp() {
        when(caseStore.revision()).thenReturn(7L);
        when(caseStore.all()).thenReturn(List.of(TestSupport.contractCase(), TestSupport.privacyCase()));
        suggestionService = new SuggestionService(caseStore, new LegalTextTokenizer(), new ModelConfig());
    }

    @Test
    @DisplayName("word-prefix matches come from titles and from legal terms found in the text")
    void wordPrefix() {
        assertThat(suggestionService.suggest("pri"))
                .containsExactly("Right to Privacy judgment", "right to privacy");
    }

    @Test
    @DisplayName("a leading prefix match ranks ahead of a substring match")
    void prefixBeforeSubstring() {
        assertThat(suggestionService.suggest("con"))
                .containsExactly("Contract Law basics", "contract");
        assertThat(suggestionService.suggest("ract"))
                .containsExactly("Contract Law basics", "contract");
    }

    @Test
    @DisplayName("a too-short input returns the most recent titles")
    void shortInput() {
        assertThat(suggestionService.suggest("p"))
                .containsExactly("Right to Privacy judgment", "Contract Law basics");
        assertThat(suggestionService.suggest(null))
                .containsExactly("Right to Privacy judgment", "Contract Law basics");
    }

    @Test
    @DisplayName("no match yields an empty list")
    void noMatch() {
        assertThat(suggestionService.suggest("habeas")).isEmpty();
    }

    @Test
    @DisplayName("the vocabulary is rebuilt only when the case store changes")
    void cachedVocabulary() {
        suggestionService.suggest("pri");
        suggestionService.suggest("con");
        verify(caseStore, times(1)).all();

        when(caseStore.revision()).thenReturn(8L);
        suggestionService.suggest("pri");
        verify(caseStore, times(2)).all();
    }
}
