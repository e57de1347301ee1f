package com.judgmentrag.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;

import com.judgmentrag.TestSupport;
import com.judgmentrag.config.EmbeddingConfig;
import com.judgmentrag.exception.EmbeddingException;
import com.judgmentrag.util.LegalTextTokenizer;

@ExtendWith(MockitoExtension.class)
class CaseEmbeddingServiceTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private CaseEmbeddingService service;

    @BeforeEach
    void setUp() {
        service = new CaseEmbeddingService(
                TestSupport.embeddingConfig(EmbeddingConfig.PROVIDER_OLLAMA, 2, 2),
                embeddingModel,
                TestSupport.callGuard());
    }

    private static List<float[]> vectors(List<String> texts) {
        List<float[]> out = new ArrayList<>();
        for (String text : texts) {
            out.add(new float[] {text.length(), 1f});
        }
        return out;
    }

    @Test
    @DisplayName("batches keep input order and length")
    @SuppressWarnings("unchecked")
    void batchesInOrder() {
        when(embeddingModel.embed(anyList()))
                .thenAnswer(inv -> vectors((List<String>) inv.getArgument(0)));

        List<float[]> result = service.embed(List.of("a", "bb", "ccc", "dddd", "eeeee"));

        assertThat(result).hasSize(5);
        assertThat(result).extracting(v -> v[0]).containsExactly(1f, 2f, 3f, 4f, 5f);
        verify(embeddingModel, times(3)).embed(anyList());
    }

    @Test
    @DisplayName("batched output equals per-item output")
    void batchingIsTransparent() {
        HashingEmbeddingModel hashing = new HashingEmbeddingModel(new LegalTextTokenizer(), 16);
        CaseEmbeddingService batched = new CaseEmbeddingService(
                TestSupport.embeddingConfig(EmbeddingConfig.PROVIDER_HASHING, 16, 2), hashing, TestSupport.callGuard());
        List<String> texts = List.of("right to privacy", "breach of contract", "article 21");

        List<float[]> together = batched.embed(texts);

        for (int i = 0; i < texts.size(); i++) {
            assertThat(together.get(i)).containsExactly(batched.embed(List.of(texts.get(i))).get(0));
        }
    }

    @Test
    @DisplayName("a wrong vector count fails the whole call")
    void wrongCount() {
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new float[] {1f, 1f}));

        assertThatThrownBy(() -> service.embed(List.of("a", "b")))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    @DisplayName("a wrong dimension fails the whole call")
    void wrongDimension() {
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new float[] {1f, 1f, 1f}));

        assertThatThrownBy(() -> service.embed(List.of("a")))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    @DisplayName("a failing batch fails the call after one retry")
    void providerFailure() {
        when(embeddingModel.embed(anyList())).thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> service.embed(List.of("a", "b", "c")))
                .isInstanceOf(EmbeddingException.class);
        verify(embeddingModel, times(2)).embed(anyList());
    }
}
